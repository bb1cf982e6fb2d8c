package io.nosqlbench.command.common;

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

import io.nosqlbench.matrix.ElementType;
import io.nosqlbench.matrix.MatrixFormat;
import io.nosqlbench.matrix.MatrixFormatConfig;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Shared matrix output formatting options.
 * Provides {@code --width} and {@code --format-config} for controlling the element width
 * used when printing matrices.
 */
public class FormatOption {

    @CommandLine.Option(
        names = {"-w", "--width"},
        description = "Character width of each printed matrix element"
    )
    private Integer width;

    @CommandLine.Option(
        names = {"--format-config"},
        paramLabel = "FILE",
        description = "JSON file with output widths, e.g. {\"default_width\": 4, \"widths\": {\"double\": 3}}"
    )
    private Path formatConfig;

    public Integer getWidth() {
        return width;
    }

    public Path getFormatConfig() {
        return formatConfig;
    }

    /**
     * Installs the requested output width for an element type.
     *
     * <p>The configuration file, if given, is applied first. An explicit {@code --width}
     * then overrides the width for {@code type}. When neither option is given, the
     * fallback width is used.</p>
     *
     * @param type the element type whose matrices will be printed
     * @param fallbackWidth width to use when no option is given, or null to keep the registry
     * @return the format now registered for {@code type}
     * @throws IOException if the configuration file cannot be read
     * @throws IllegalArgumentException if a width is negative or the configuration names an unknown type
     */
    public MatrixFormat install(ElementType<?> type, Integer fallbackWidth) throws IOException {
        if (formatConfig != null) {
            MatrixFormatConfig.loadFromFile(formatConfig).apply();
        }
        if (width != null) {
            MatrixFormat.setOutputWidth(type, width);
        } else if (formatConfig == null && fallbackWidth != null) {
            MatrixFormat.setOutputWidth(type, fallbackWidth);
        }
        return MatrixFormat.forType(type);
    }
}
