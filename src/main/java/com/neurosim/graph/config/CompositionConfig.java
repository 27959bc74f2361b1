package com.neurosim.graph.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.neurosim.graph.api.ConfigurationException;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

import lombok.Data;

/**
 * Engine-wide defaults of a composition.
 *
 * Loaded from {@code /neurosim-defaults.json} on the classpath when present;
 * unknown keys are ignored so older and newer files stay readable.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CompositionConfig {
    public static final String RESOURCE = "/neurosim-defaults.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Iteration ceiling per firing for mechanisms that do not set their own. */
    private int maxExecutionsBeforeFinished = 1000;
    /** Passes after which a trial is cut short with a warning. */
    private int maxPassesPerTrial = 1000;
    /** Minimum interval between repeated warnings of the same kind. */
    private long warningThrottleMillis = 1000;
    /** Ring size of the value-history recorder; must be a power of two. */
    private int historyBufferSize = 1024;

    /** Built-in defaults, ignoring any classpath resource. */
    public static CompositionConfig defaults() {
        return new CompositionConfig();
    }

    /**
     * Reads {@link #RESOURCE} from the classpath, falling back to the
     * built-in defaults when it is missing.
     */
    public static CompositionConfig load() {
        try (InputStream in = CompositionConfig.class.getResourceAsStream(RESOURCE)) {
            if (in == null)
                return defaults();
            return MAPPER.readValue(in, CompositionConfig.class).validate();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
    }

    /**
     * Parses an explicit JSON document.
     *
     * @throws ConfigurationException if the document is malformed or a value
     *                                is out of range.
     */
    public static CompositionConfig fromJson(String json) {
        try {
            return MAPPER.readValue(json, CompositionConfig.class).validate();
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Malformed composition config: " + e.getOriginalMessage());
        }
    }

    /**
     * Checks value ranges.
     *
     * @return this
     * @throws ConfigurationException on the first value out of range.
     */
    public CompositionConfig validate() {
        if (maxExecutionsBeforeFinished < 1)
            throw new ConfigurationException("maxExecutionsBeforeFinished must be >= 1, got "
                    + maxExecutionsBeforeFinished);
        if (maxPassesPerTrial < 1)
            throw new ConfigurationException("maxPassesPerTrial must be >= 1, got " + maxPassesPerTrial);
        if (warningThrottleMillis < 0)
            throw new ConfigurationException("warningThrottleMillis must be >= 0, got " + warningThrottleMillis);
        if (historyBufferSize < 1 || Integer.bitCount(historyBufferSize) != 1)
            throw new ConfigurationException("historyBufferSize must be a power of two, got " + historyBufferSize);
        return this;
    }
}
