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

import io.nosqlbench.matrix.ElementTypes;
import io.nosqlbench.matrix.Matrix;
import io.nosqlbench.matrix.MatrixException;
import picocli.CommandLine;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Command line matrix literals.
 * All supporting types are inner classes for self-contained encapsulation.
 *
 * <p>Supported formats, with double elements:</p>
 * <ul>
 *   <li>{@code ROWSxCOLS:v1,v2,...} - elements in row-major order, e.g. {@code 2x3:1,2,3,4,5,6}</li>
 *   <li>{@code ROWSxCOLS=v} - every element set to {@code v}, e.g. {@code 4x5=0}</li>
 *   <li>{@code diag:v1,v2,...} - square diagonal matrix, e.g. {@code diag:1,2,3}</li>
 * </ul>
 */
public class MatrixOption {

    /**
     * Picocli type converter for matrix literals.
     */
    public static class MatrixConverter implements CommandLine.ITypeConverter<Matrix<Double>> {

        @Override
        public Matrix<Double> convert(String value) {
            if (value == null || value.trim().isEmpty()) {
                throw new CommandLine.TypeConversionException("Matrix literal cannot be empty");
            }
            String trimmed = value.trim();
            try {
                if (trimmed.startsWith("diag:")) {
                    return new Matrix<>(ElementTypes.DOUBLE, parseValues(trimmed.substring("diag:".length()), value));
                }
                int colon = trimmed.indexOf(':');
                int equals = trimmed.indexOf('=');
                if (colon > 0) {
                    int[] shape = parseShape(trimmed.substring(0, colon), value);
                    List<Double> flat = parseValues(trimmed.substring(colon + 1), value);
                    return new Matrix<>(ElementTypes.DOUBLE, shape[0], shape[1], flat);
                }
                if (equals > 0) {
                    int[] shape = parseShape(trimmed.substring(0, equals), value);
                    double fill = Double.parseDouble(trimmed.substring(equals + 1).trim());
                    return new Matrix<>(ElementTypes.DOUBLE, shape[0], shape[1], fill);
                }
                throw new CommandLine.TypeConversionException(
                    "Invalid matrix format: " + value + ". Expected: ROWSxCOLS:v1,v2,..., ROWSxCOLS=v or diag:v1,v2,...");
            } catch (NumberFormatException e) {
                throw new CommandLine.TypeConversionException(
                    "Invalid matrix format: " + value + ". Could not parse numbers: " + e.getMessage());
            } catch (MatrixException | IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(
                    "Invalid matrix " + value + ": " + e.getMessage());
            }
        }

        private static int[] parseShape(String shape, String original) {
            String[] parts = shape.trim().toLowerCase(Locale.ROOT).split("x");
            if (parts.length != 2) {
                throw new CommandLine.TypeConversionException(
                    "Invalid matrix shape in " + original + ". Expected: ROWSxCOLS");
            }
            return new int[]{Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim())};
        }

        private static List<Double> parseValues(String values, String original) {
            List<Double> parsed = new ArrayList<>();
            if (values.trim().isEmpty()) {
                return parsed;
            }
            for (String part : values.split(",", -1)) {
                if (part.trim().isEmpty()) {
                    throw new CommandLine.TypeConversionException("Empty element in matrix " + original);
                }
                parsed.add(Double.parseDouble(part.trim()));
            }
            return parsed;
        }
    }
}
