package com.sysmuse.math.config;

import com.sysmuse.math.format.FormatSettings;
import com.sysmuse.math.format.NumberFormat;
import com.sysmuse.math.format.ThresholdProfile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class EngineConfigLoaderTest {

    @TempDir
    Path tempDir;

    private EngineConfigLoader loader;

    @BeforeEach
    public void setup() {
        loader = new EngineConfigLoader();
    }

    @Test
    public void testLoadFromFileIgnoresUnknownProperties() throws IOException {
        Path file = tempDir.resolve("engine.json");
        Files.write(file, ("{\"precision\": 4, \"numberFormat\": \"PLAIN\", "
                + "\"thresholdProfile\": \"SIMPLE\", \"theme\": \"dark\"}").getBytes(StandardCharsets.UTF_8));

        EngineConfig config = loader.loadFromFile(file.toString());

        assertEquals(4, config.getPrecision());
        assertEquals(NumberFormat.PLAIN, config.getNumberFormat());
        assertEquals(ThresholdProfile.SIMPLE, config.getThresholdProfile());
        assertEquals("INFO", config.getLoggingLevel());
    }

    @Test
    public void testMissingFileThrows() {
        IOException e = assertThrows(IOException.class,
                () -> loader.loadFromFile(tempDir.resolve("absent.json").toString()));
        assertTrue(e.getMessage().contains("not found"));
    }

    @Test
    public void testClasspathDefault() throws IOException {
        EngineConfig config = loader.loadDefault();
        assertEquals(FormatSettings.defaults(), config.toFormatSettings());
        assertEquals("calculator_cells.json", config.getCellStorePath());
    }

    @Test
    public void testMissingResourceGivesDefaults() throws IOException {
        EngineConfig config = loader.loadFromResource("no-such-config.json");
        assertEquals(6, config.getPrecision());
        assertEquals(NumberFormat.AUTOMATIC, config.getNumberFormat());
    }

    @Test
    public void testSaveAndReload() throws IOException {
        EngineConfig config = new EngineConfig();
        config.setPrecision(10);
        config.setNumberFormat(NumberFormat.SCIENTIFIC);
        String path = tempDir.resolve("nested/engine.json").toString();

        loader.saveToFile(config, path);
        EngineConfig reloaded = loader.loadFromFile(path);

        assertEquals(10, reloaded.getPrecision());
        assertEquals(NumberFormat.SCIENTIFIC, reloaded.getNumberFormat());
    }

    @Test
    public void testPrecisionIsClamped() {
        EngineConfig config = new EngineConfig();
        config.setPrecision(40);
        assertEquals(FormatSettings.MAX_PRECISION, config.toFormatSettings().getPrecision());

        config.setPrecision(-3);
        assertEquals(FormatSettings.MIN_PRECISION, config.toFormatSettings().getPrecision());
    }
}
