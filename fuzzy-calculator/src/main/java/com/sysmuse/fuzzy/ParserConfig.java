package com.sysmuse.fuzzy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

/**
 * ParserConfig - settings for the expression pipeline, bound from JSON.
 * Unknown properties are ignored so that one file can be shared with other tools.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ParserConfig {

    public static final String DEFAULT_RESOURCE = "fuzzy-config.json";

    // Logging configuration
    @JsonProperty("loggingLevel")
    private String loggingLevel = "INFO";
    @JsonProperty("consoleLoggingEnabled")
    private boolean consoleLoggingEnabled = true;
    @JsonProperty("fileLoggingEnabled")
    private boolean fileLoggingEnabled = false;
    @JsonProperty("logFileName")
    private String logFileName = "fuzzy-calculator.log";

    // Parsing
    @JsonProperty("ambiguityMode")
    private AmbiguityMode ambiguityMode = AmbiguityMode.WARNING;
    @JsonProperty("inputValidation")
    private boolean inputValidation = true;

    // Monte-Carlo
    @JsonProperty("monteCarloTrials")
    private int monteCarloTrials = 1000;
    @JsonProperty("randomSeed")
    private Long randomSeed = null;

    // Same schema as the files read by CustomOperationLoader
    @JsonProperty("customOperations")
    private JsonNode customOperations = JsonNodeFactory.instance.arrayNode();

    public static ParserConfig load(File file) throws IOException {
        return new ObjectMapper().readValue(file, ParserConfig.class);
    }

    public static ParserConfig load(InputStream in) throws IOException {
        return new ObjectMapper().readValue(in, ParserConfig.class);
    }

    /**
     * Loads a configuration from the classpath.
     */
    public static ParserConfig loadResource(String resource) throws IOException {
        try (InputStream in = ParserConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("Configuration resource not found: " + resource);
            }
            return load(in);
        }
    }

    public String getLoggingLevel() {
        return loggingLevel;
    }

    public void setLoggingLevel(String loggingLevel) {
        this.loggingLevel = loggingLevel;
    }

    public boolean isConsoleLoggingEnabled() {
        return consoleLoggingEnabled;
    }

    public void setConsoleLoggingEnabled(boolean consoleLoggingEnabled) {
        this.consoleLoggingEnabled = consoleLoggingEnabled;
    }

    public boolean isFileLoggingEnabled() {
        return fileLoggingEnabled;
    }

    public void setFileLoggingEnabled(boolean fileLoggingEnabled) {
        this.fileLoggingEnabled = fileLoggingEnabled;
    }

    public String getLogFileName() {
        return logFileName;
    }

    public void setLogFileName(String logFileName) {
        this.logFileName = logFileName;
    }

    public AmbiguityMode getAmbiguityMode() {
        return ambiguityMode;
    }

    public void setAmbiguityMode(AmbiguityMode ambiguityMode) {
        this.ambiguityMode = ambiguityMode;
    }

    public boolean isInputValidation() {
        return inputValidation;
    }

    public void setInputValidation(boolean inputValidation) {
        this.inputValidation = inputValidation;
    }

    public int getMonteCarloTrials() {
        return monteCarloTrials;
    }

    public void setMonteCarloTrials(int monteCarloTrials) {
        this.monteCarloTrials = monteCarloTrials;
    }

    /**
     * Seed for the samplers, or null for a time-based seed.
     */
    public Long getRandomSeed() {
        return randomSeed;
    }

    public void setRandomSeed(Long randomSeed) {
        this.randomSeed = randomSeed;
    }

    public JsonNode getCustomOperations() {
        return customOperations;
    }

    public void setCustomOperations(JsonNode customOperations) {
        this.customOperations = customOperations;
    }
}
