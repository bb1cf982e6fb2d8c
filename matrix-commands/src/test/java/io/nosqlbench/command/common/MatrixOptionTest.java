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

import io.nosqlbench.matrix.Matrix;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import picocli.CommandLine;

import java.util.List;
import java.util.Locale;

import static io.nosqlbench.matrix.ElementTypes.DOUBLE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MatrixOptionTest {

    private final MatrixOption.MatrixConverter converter = new MatrixOption.MatrixConverter();

    @Test
    void parsesRowMajorLiteral() {
        Matrix<Double> m = converter.convert("2x3:1,2,3,4,5,6");

        assertThat(m.rows()).isEqualTo(2);
        assertThat(m.cols()).isEqualTo(3);
        assertThat(m.get(1, 0)).isEqualTo(4.0);
        assertThat(m.toList()).containsExactly(1.0, 2.0, 3.0, 4.0, 5.0, 6.0);
    }

    @Test
    void parsesFilledLiteral() {
        Matrix<Double> m = converter.convert(" 3X2 = 1.5 ");

        assertThat(m).isEqualTo(new Matrix<>(DOUBLE, 3, 2, 1.5));
    }

    @Test
    void parsesDiagonalLiteral() {
        Matrix<Double> m = converter.convert("diag:1, 2, 3");

        assertThat(m).isEqualTo(new Matrix<>(DOUBLE, List.of(1.0, 2.0, 3.0)));
        assertThat(m.get(0, 1)).isEqualTo(0.0);
    }

    @Test
    void shapeParsingIgnoresTheDefaultLocale() {
        Locale saved = Locale.getDefault();
        try {
            Locale.setDefault(Locale.forLanguageTag("tr-TR"));
            Matrix<Double> m = converter.convert("2X3=0.5");

            assertThat(m.rows()).isEqualTo(2);
            assertThat(m.cols()).isEqualTo(3);
        } finally {
            Locale.setDefault(saved);
        }
    }

    @Test
    void trailingCommaIsAnEmptyElement() {
        assertThatThrownBy(() -> converter.convert("2x2:1,2,3,4,"))
            .isInstanceOf(CommandLine.TypeConversionException.class)
            .hasMessageContaining("Empty element");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "2x2", "2by2:1,2,3,4", "2x2:1,,3,4", "2x2:1,2,3,4,", "2x2:,1,2,3,4", "2x2:a,b,c,d", "2x2=z"})
    void rejectsMalformedLiterals(String literal) {
        assertThatThrownBy(() -> converter.convert(literal))
            .isInstanceOf(CommandLine.TypeConversionException.class);
    }

    @Test
    void reportsInitializerMismatch() {
        assertThatThrownBy(() -> converter.convert("2x2:1,2,3"))
            .isInstanceOf(CommandLine.TypeConversionException.class)
            .hasMessageContaining("Initializer size 3");
    }

    @Test
    void reportsZeroSize() {
        assertThatThrownBy(() -> converter.convert("diag:"))
            .isInstanceOf(CommandLine.TypeConversionException.class)
            .hasMessageContaining("zero rows or columns");
    }

    @Test
    void reportsNegativeShape() {
        assertThatThrownBy(() -> converter.convert("-1x2=0"))
            .isInstanceOf(CommandLine.TypeConversionException.class)
            .hasMessageContaining("-1x2=0");
    }
}
