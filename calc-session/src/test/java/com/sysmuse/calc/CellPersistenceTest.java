package com.sysmuse.calc;

import com.sysmuse.math.config.EngineConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.sysmuse.math.node.MathNode.text;
import static org.junit.jupiter.api.Assertions.*;

public class CellPersistenceTest {

    @TempDir
    Path tempDir;

    @Test
    public void testSaveAndLoad() throws Exception {
        Cell first = new Cell(text("1+1"));
        first.setAnswer("2");
        Cell second = new Cell(text("ans0"));
        second.setAnswer("2");

        File file = new File(tempDir.toFile(), "nested/dir/cells.json");
        CellPersistence persistence = new CellPersistence(file);
        persistence.save(List.of(first, second), 1);
        assertTrue(file.exists());

        SessionSnapshot snapshot = persistence.load();
        assertFalse(snapshot.isEmpty());
        assertEquals(1, snapshot.getActiveIndex());
        assertEquals(2, snapshot.getCells().size());

        CellRecord record = snapshot.getCells().get(1);
        assertEquals(1, record.getIndex());
        assertEquals("2", record.getAnswer());
        assertTrue(record.getExpression().contains("\"ans0\""));
    }

    @Test
    public void testFileFormat() throws Exception {
        File file = new File(tempDir.toFile(), "cells.json");
        Cell cell = new Cell(text("7"));
        cell.setAnswer("7");
        new CellPersistence(file).save(List.of(cell), 0);

        String json = Files.readString(file.toPath(), StandardCharsets.UTF_8);
        assertTrue(json.contains("\"activeIndex\""));
        assertTrue(json.contains("\"cells\""));
        assertTrue(json.contains("\"answer\" : \"7\""));
        assertFalse(json.contains("\"empty\""));
    }

    @Test
    public void testMissingFileLoadsEmpty() {
        CellPersistence persistence = new CellPersistence(new File(tempDir.toFile(), "none.json"));
        assertTrue(persistence.load().isEmpty());
        assertTrue(persistence.clear());
    }

    @Test
    public void testCorruptFileLoadsEmpty() throws Exception {
        File file = new File(tempDir.toFile(), "cells.json");
        Files.writeString(file.toPath(), "{ not valid json", StandardCharsets.UTF_8);
        assertTrue(new CellPersistence(file).load().isEmpty());
    }

    @Test
    public void testUnknownFieldsAreIgnored() throws Exception {
        File file = new File(tempDir.toFile(), "cells.json");
        Files.writeString(file.toPath(),
                "{\"version\":2,\"activeIndex\":0,\"cells\":[{\"index\":0,\"expression\":\"[]\",\"answer\":\"\",\"color\":\"red\"}]}",
                StandardCharsets.UTF_8);
        SessionSnapshot snapshot = new CellPersistence(file).load();
        assertEquals(1, snapshot.getCells().size());
    }

    @Test
    public void testClearDeletesFile() throws Exception {
        File file = new File(tempDir.toFile(), "cells.json");
        CellPersistence persistence = new CellPersistence(file);
        persistence.save(List.of(new Cell(text("1"))), 0);
        assertTrue(persistence.clear());
        assertFalse(file.exists());
        assertTrue(persistence.load().isEmpty());
    }

    @Test
    public void testFromConfigUsesConfiguredPath() {
        EngineConfig config = new EngineConfig();
        config.setCellStorePath(new File(tempDir.toFile(), "configured.json").getPath());
        assertEquals(new File(tempDir.toFile(), "configured.json"), CellPersistence.fromConfig(config).getStoreFile());
    }
}
