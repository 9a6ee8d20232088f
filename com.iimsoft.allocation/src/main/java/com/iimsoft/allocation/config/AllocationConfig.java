package com.iimsoft.allocation.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.iimsoft.allocation.domain.InvalidInputException;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Run configuration: where snapshots are read from, where reports go, and whether the
 * lookahead reservation is applied.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AllocationConfig {

    public static final String DEFAULT_RESOURCE = "allocation-config.json";

    @JsonProperty("inputDirectory")
    private String inputDirectory = "data_inputs";

    // glob，匹配多份时取最新的一份
    @JsonProperty("inputPattern")
    private String inputPattern = "allocation_input_*.json";

    @JsonProperty("outputDirectory")
    private String outputDirectory = "reports";

    @JsonProperty("lookaheadEnabled")
    private boolean lookaheadEnabled = true;

    @JsonProperty("csvCharset")
    private String csvCharset = "UTF-8";

    @JsonProperty("mockSeed")
    private long mockSeed = 42L;

    @JsonProperty("mockWeeks")
    private int mockWeeks = 30;

    @JsonProperty("mockStartDate")
    private String mockStartDate = "2026-01-01";

    public AllocationConfig() {
    }

    public static AllocationConfig load(Path path) throws IOException {
        return new ObjectMapper().readValue(path.toFile(), AllocationConfig.class).validate();
    }

    /**
     * Loads {@value #DEFAULT_RESOURCE} from the classpath.
     */
    public static AllocationConfig loadDefault() throws IOException {
        try (InputStream in = AllocationConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new FileNotFoundException("classpath resource not found: " + DEFAULT_RESOURCE);
            }
            return new ObjectMapper().readValue(in, AllocationConfig.class).validate();
        }
    }

    /**
     * Checks the values that are otherwise only used after the snapshot is loaded.
     *
     * @throws InvalidInputException naming the first bad field
     */
    public AllocationConfig validate() {
        requireText("inputDirectory", inputDirectory);
        requireText("inputPattern", inputPattern);
        requireText("outputDirectory", outputDirectory);
        try {
            Charset.forName(csvCharset);
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException("csvCharset is not a supported charset: " + csvCharset, e);
        }
        if (mockWeeks <= 0) {
            throw new InvalidInputException("mockWeeks must be positive: " + mockWeeks);
        }
        requireText("mockStartDate", mockStartDate);
        try {
            LocalDate.parse(mockStartDate);
        } catch (DateTimeParseException e) {
            throw new InvalidInputException("mockStartDate is not an ISO date (yyyy-MM-dd): " + mockStartDate, e);
        }
        return this;
    }

    private static void requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidInputException(field + " must not be blank");
        }
    }

    public String getInputDirectory() {
        return inputDirectory;
    }

    public void setInputDirectory(String inputDirectory) {
        this.inputDirectory = inputDirectory;
    }

    public String getInputPattern() {
        return inputPattern;
    }

    public void setInputPattern(String inputPattern) {
        this.inputPattern = inputPattern;
    }

    public String getOutputDirectory() {
        return outputDirectory;
    }

    public void setOutputDirectory(String outputDirectory) {
        this.outputDirectory = outputDirectory;
    }

    public boolean isLookaheadEnabled() {
        return lookaheadEnabled;
    }

    public void setLookaheadEnabled(boolean lookaheadEnabled) {
        this.lookaheadEnabled = lookaheadEnabled;
    }

    public String getCsvCharset() {
        return csvCharset;
    }

    public void setCsvCharset(String csvCharset) {
        this.csvCharset = csvCharset;
    }

    public Charset charset() {
        return Charset.forName(csvCharset);
    }

    public long getMockSeed() {
        return mockSeed;
    }

    public void setMockSeed(long mockSeed) {
        this.mockSeed = mockSeed;
    }

    public int getMockWeeks() {
        return mockWeeks;
    }

    public void setMockWeeks(int mockWeeks) {
        this.mockWeeks = mockWeeks;
    }

    public String getMockStartDate() {
        return mockStartDate;
    }

    public void setMockStartDate(String mockStartDate) {
        this.mockStartDate = mockStartDate;
    }
}
