package io.nosqlbench.matrix;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON-serializable output width settings for matrix rendering.
 *
 * <h2>JSON Schema</h2>
 *
 * <pre>{@code
 * {
 *   "default_width": 5,      // optional, applied to every built-in element type
 *   "widths": {              // optional, per element type, keyed by ElementType.name()
 *     "double": 3,
 *     "long": 8
 *   }
 * }
 * }</pre>
 *
 * <p>{@link #apply()} installs the settings into the type-scoped registry of
 * {@link MatrixFormat}: first the default width for all built-in types, then the
 * per-type widths.</p>
 *
 * @see MatrixFormat#setOutputWidth(ElementType, int)
 * @see ElementTypes#byName(String)
 */
public class MatrixFormatConfig {

    private static final Logger logger = LogManager.getLogger(MatrixFormatConfig.class);

    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .create();

    @SerializedName("default_width")
    private Integer defaultWidth;

    @SerializedName("widths")
    private Map<String, Integer> widths;

    public MatrixFormatConfig() {
    }

    public MatrixFormatConfig(Integer defaultWidth, Map<String, Integer> widths) {
        this.defaultWidth = defaultWidth;
        this.widths = widths == null ? null : new LinkedHashMap<>(widths);
    }

    /**
     * Returns the default width, or null if the file did not set one.
     */
    public Integer getDefaultWidth() {
        return defaultWidth;
    }

    /**
     * Returns a read-only view of the per-type widths keyed by element type name, never null.
     */
    public Map<String, Integer> getWidths() {
        return widths == null ? Map.of() : Collections.unmodifiableMap(widths);
    }

    /**
     * Checks every width and type name without changing any registered width.
     *
     * @throws IllegalArgumentException if a width is missing or negative or a type name is unknown
     */
    public void validate() {
        if (defaultWidth != null && defaultWidth < 0) {
            throw new IllegalArgumentException("default_width must be non-negative, got: " + defaultWidth);
        }
        for (Map.Entry<String, Integer> entry : getWidths().entrySet()) {
            if (ElementTypes.byName(entry.getKey()).isEmpty()) {
                throw new IllegalArgumentException("Unknown element type in widths: '" + entry.getKey()
                    + "'. Known types: " + knownTypeNames());
            }
            if (entry.getValue() == null || entry.getValue() < 0) {
                throw new IllegalArgumentException("width for '" + entry.getKey()
                    + "' must be non-negative, got: " + entry.getValue());
            }
        }
    }

    /**
     * Validates this configuration and installs it into the {@link MatrixFormat} registry.
     */
    public void apply() {
        validate();
        if (defaultWidth != null) {
            for (ElementType<?> type : ElementTypes.all()) {
                MatrixFormat.setOutputWidth(type, defaultWidth);
            }
        }
        for (Map.Entry<String, Integer> entry : getWidths().entrySet()) {
            ElementType<?> type = ElementTypes.byName(entry.getKey()).orElseThrow();
            MatrixFormat.setOutputWidth(type, entry.getValue());
        }
        logger.debug("applied matrix format config: default_width={}, widths={}", defaultWidth, getWidths());
    }

    private static String knownTypeNames() {
        StringBuilder sb = new StringBuilder();
        for (ElementType<?> type : ElementTypes.all()) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(type.name());
        }
        return sb.toString();
    }

    /**
     * Parses a configuration from JSON.
     *
     * @throws com.google.gson.JsonParseException if the JSON is malformed
     */
    public static MatrixFormatConfig fromJson(String json) {
        return requireContent(GSON.fromJson(json, MatrixFormatConfig.class));
    }

    /**
     * Parses a configuration from a JSON reader.
     */
    public static MatrixFormatConfig fromJson(Reader reader) {
        return requireContent(GSON.fromJson(reader, MatrixFormatConfig.class));
    }

    private static MatrixFormatConfig requireContent(MatrixFormatConfig config) {
        return config == null ? new MatrixFormatConfig() : config;
    }

    /**
     * Serializes this configuration to JSON.
     */
    public String toJson() {
        return GSON.toJson(this);
    }

    /**
     * Serializes this configuration to a writer.
     */
    public void toJson(Writer writer) {
        GSON.toJson(this, writer);
    }

    /**
     * Reads a configuration file.
     *
     * @param path the JSON file
     * @return the parsed configuration, not yet applied
     * @throws IOException if the file cannot be read or is not valid JSON
     */
    public static MatrixFormatConfig loadFromFile(Path path) throws IOException {
        logger.debug("loading matrix format config from {}", path);
        try (Reader reader = Files.newBufferedReader(path)) {
            return fromJson(reader);
        } catch (JsonParseException e) {
            throw new IOException("Malformed matrix format config " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Writes this configuration to a file.
     *
     * @throws IOException if the file cannot be written
     */
    public void saveToFile(Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path)) {
            toJson(writer);
        }
    }

    @Override
    public String toString() {
        return "MatrixFormatConfig[default_width=" + defaultWidth + ", widths=" + getWidths() + "]";
    }
}
