package com.sysmuse.calc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.sysmuse.math.config.EngineConfig;
import com.sysmuse.math.serial.MathNodeJsonCodec;
import com.sysmuse.util.LoggingUtil;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Saves and restores calculator cells as a JSON file.
 *
 * <p>File layout:
 * <pre>
 * {"activeIndex": 0, "cells": [{"index": 0, "expression": "[...node json...]", "answer": "14"}]}
 * </pre>
 * A missing or unreadable file loads as an empty session.
 */
public class CellPersistence {

    private final File storeFile;
    private final ObjectMapper objectMapper;

    public CellPersistence(String path) {
        this(new File(path));
    }

    public CellPersistence(File storeFile) {
        this.storeFile = storeFile;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public static CellPersistence fromConfig(EngineConfig config) {
        return new CellPersistence(config.getCellStorePath());
    }

    public File getStoreFile() {
        return storeFile;
    }

    /**
     * Write all cells and the active index, replacing any earlier save.
     */
    public void save(List<Cell> cells, int activeIndex) throws IOException {
        List<CellRecord> records = new ArrayList<>();
        for (int i = 0; i < cells.size(); i++) {
            Cell cell = cells.get(i);
            records.add(new CellRecord(i, MathNodeJsonCodec.serializeToJson(cell.getExpression()), cell.getAnswer()));
        }

        File parent = storeFile.getAbsoluteFile().getParentFile();
        if (parent != null) {
            parent.mkdirs();
        }
        objectMapper.writeValue(storeFile, new SessionSnapshot(activeIndex, records));
        LoggingUtil.debug("Saved " + records.size() + " cells to " + storeFile);
    }

    /**
     * Read the saved session. Never throws; problems are logged and give an empty session.
     */
    public SessionSnapshot load() {
        if (!storeFile.exists()) {
            LoggingUtil.debug("No saved cells at " + storeFile);
            return SessionSnapshot.empty();
        }
        try {
            SessionSnapshot snapshot = objectMapper.readValue(storeFile, SessionSnapshot.class);
            if (snapshot == null) {
                return SessionSnapshot.empty();
            }
            LoggingUtil.debug("Loaded " + snapshot.getCells().size() + " cells from " + storeFile);
            return snapshot;
        } catch (IOException e) {
            LoggingUtil.warn("Could not read saved cells from " + storeFile + ": " + e.getMessage());
            return SessionSnapshot.empty();
        }
    }

    /**
     * Delete the saved session.
     *
     * @return true if nothing is stored afterwards
     */
    public boolean clear() {
        if (!storeFile.exists()) {
            return true;
        }
        boolean deleted = storeFile.delete();
        if (!deleted) {
            LoggingUtil.warn("Could not delete saved cells at " + storeFile);
        }
        return deleted;
    }
}
