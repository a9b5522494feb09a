package com.sysmuse.util;

import com.sysmuse.math.config.EngineConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;

import static org.junit.jupiter.api.Assertions.*;

public class LoggingUtilTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    public void setup() {
        LoggingUtil.reset();
    }

    @AfterEach
    public void tearDown() {
        LoggingUtil.reset();
    }

    @Test
    public void testLevelFromConfig() {
        EngineConfig config = new EngineConfig();
        config.setLoggingLevel("debug");
        config.setConsoleLoggingEnabled(false);
        LoggingUtil.initialize(config);

        assertEquals(Level.FINE, LoggingUtil.getCurrentLevel());
        assertTrue(LoggingUtil.isDebugEnabled());
    }

    @Test
    public void testUnknownLevelFallsBackToInfo() {
        LoggingUtil.initialize("chatty", false, false, null);
        assertEquals(Level.INFO, LoggingUtil.getCurrentLevel());
        assertFalse(LoggingUtil.isDebugEnabled());
    }

    @Test
    public void testFirstInitializationWins() {
        LoggingUtil.initialize("WARN", false, false, null);
        LoggingUtil.initialize("DEBUG", false, false, null);
        assertEquals(Level.WARNING, LoggingUtil.getCurrentLevel());
    }

    @Test
    public void testFileLogging() throws Exception {
        File logFile = new File(tempDir.toFile(), "engine.log");
        LoggingUtil.initialize("INFO", false, true, logFile.getPath());
        LoggingUtil.warn("Cell 3 is on an ANS reference cycle");
        LoggingUtil.reset();

        String content = Files.readString(logFile.toPath());
        assertTrue(content.contains("Cell 3 is on an ANS reference cycle"));
    }

    @Test
    public void testConsoleModes() {
        LoggingUtil.setConsoleOutputMode(LoggingUtil.ConsoleOutputMode.ALL_TO_ERR);
        LoggingUtil.initialize("ERROR", true, false, null);
        LoggingUtil.error("shown on stderr");
        assertEquals(Level.SEVERE, LoggingUtil.getCurrentLevel());
        LoggingUtil.setConsoleOutputMode(LoggingUtil.ConsoleOutputMode.SPLIT_SEVERE_TO_ERR);
    }
}
