package com.sysmuse.math.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sysmuse.math.format.FormatSettings;
import com.sysmuse.math.format.NumberFormat;
import com.sysmuse.math.format.ThresholdProfile;

/**
 * Engine configuration.
 *
 * Holds the display settings consumed by the formatter, the logging setup
 * and the location of the persisted cell store.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EngineConfig {

    @JsonProperty("precision")
    private int precision = FormatSettings.DEFAULT_PRECISION;

    @JsonProperty("numberFormat")
    private NumberFormat numberFormat = NumberFormat.AUTOMATIC;

    @JsonProperty("thresholdProfile")
    private ThresholdProfile thresholdProfile = ThresholdProfile.EXTENDED;

    @JsonProperty("loggingLevel")
    private String loggingLevel = "INFO";

    @JsonProperty("consoleLoggingEnabled")
    private boolean consoleLoggingEnabled = true;

    @JsonProperty("fileLoggingEnabled")
    private boolean fileLoggingEnabled = false;

    @JsonProperty("logFileName")
    private String logFileName = "math-engine.log";

    @JsonProperty("cellStorePath")
    private String cellStorePath = "calculator_cells.json";

    /**
     * Default constructor for Jackson.
     */
    public EngineConfig() {}

    /**
     * Build the immutable formatting value. Precision outside 0..16 is clamped.
     */
    @JsonIgnore
    public FormatSettings toFormatSettings() {
        int clamped = Math.max(FormatSettings.MIN_PRECISION, Math.min(FormatSettings.MAX_PRECISION, precision));
        NumberFormat format = numberFormat != null ? numberFormat : NumberFormat.AUTOMATIC;
        ThresholdProfile profile = thresholdProfile != null ? thresholdProfile : ThresholdProfile.EXTENDED;
        return new FormatSettings(clamped, format, profile);
    }

    public int getPrecision() { return precision; }
    public void setPrecision(int precision) { this.precision = precision; }

    public NumberFormat getNumberFormat() { return numberFormat; }
    public void setNumberFormat(NumberFormat numberFormat) { this.numberFormat = numberFormat; }

    public ThresholdProfile getThresholdProfile() { return thresholdProfile; }
    public void setThresholdProfile(ThresholdProfile thresholdProfile) { this.thresholdProfile = thresholdProfile; }

    public String getLoggingLevel() { return loggingLevel; }
    public void setLoggingLevel(String loggingLevel) { this.loggingLevel = loggingLevel; }

    public boolean isConsoleLoggingEnabled() { return consoleLoggingEnabled; }
    public void setConsoleLoggingEnabled(boolean consoleLoggingEnabled) { this.consoleLoggingEnabled = consoleLoggingEnabled; }

    public boolean isFileLoggingEnabled() { return fileLoggingEnabled; }
    public void setFileLoggingEnabled(boolean fileLoggingEnabled) { this.fileLoggingEnabled = fileLoggingEnabled; }

    public String getLogFileName() { return logFileName; }
    public void setLogFileName(String logFileName) { this.logFileName = logFileName; }

    public String getCellStorePath() { return cellStorePath; }
    public void setCellStorePath(String cellStorePath) { this.cellStorePath = cellStorePath; }

    @Override
    public String toString() {
        return String.format("EngineConfig{precision=%d, numberFormat=%s, thresholdProfile=%s, loggingLevel=%s}",
                precision, numberFormat, thresholdProfile, loggingLevel);
    }
}
