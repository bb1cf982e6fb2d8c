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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static io.nosqlbench.matrix.ElementTypes.DOUBLE;
import static io.nosqlbench.matrix.ElementTypes.LONG;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MatrixRendererTest {

    @AfterEach
    void resetWidths() {
        MatrixFormat.resetOutputWidths();
    }

    @Test
    void rendersRowsInParenthesesWithTrailingBlankLine() {
        Matrix<Double> g = Matrix.of(DOUBLE, 2, 3, 1.0, 4.0, 21.0, 4.0, 10.0, 18.0);

        assertThat(g.render(MatrixFormat.of(3)))
            .isEqualTo("(   1   4  21 )\n(   4  10  18 )\n\n");
    }

    @Test
    void toStringUsesTheTypeScopedWidth() {
        Matrix<Long> m = new Matrix<>(LONG, 1, 2, 3L);

        assertThat(m.toString()).isEqualTo("(     3     3 )\n\n");

        MatrixFormat.setOutputWidth(Long.class, 2);
        assertThat(m.toString()).isEqualTo("(  3  3 )\n\n");
    }

    @Test
    void widthIsScopedToTheElementType() {
        MatrixFormat.setOutputWidth(DOUBLE, 1);
        Matrix<Long> longs = new Matrix<>(LONG, 1, 1, 8L);
        Matrix<Double> doubles = new Matrix<>(DOUBLE, 1, 1, 8.0);

        assertThat(longs.toString()).isEqualTo("(     8 )\n\n");
        assertThat(doubles.toString()).isEqualTo("( 8 )\n\n");
    }

    @Test
    void explicitFormatDoesNotTouchTheRegistry() {
        Matrix<Long> m = new Matrix<>(LONG, 1, 1, 1L);

        m.render(MatrixFormat.of(8));

        assertThat(MatrixFormat.forType(Long.class)).isEqualTo(MatrixFormat.DEFAULT);
    }

    @Test
    void elementsWiderThanTheWidthAreNotTruncated() {
        Matrix<Long> m = Matrix.of(LONG, 1, 2, 123456L, -7L);

        assertThat(m.render(MatrixFormat.of(3))).isEqualTo("( 123456  -7 )\n\n");
        assertThat(m.render(MatrixFormat.of(0))).isEqualTo("( 123456 -7 )\n\n");
    }

    @Test
    void movedFromMatrixRendersAsPlaceholder() {
        Matrix<Double> m = Matrix.diagonal(DOUBLE, 1.0);
        m.move();

        assertThat(m.toString()).isEqualTo("()\n");
    }

    @Test
    void unsetElementsRenderAsPlaceholder() {
        Matrix<Double> m = new Matrix<>(DOUBLE, 1, 2);
        m.set(0, 1, 0.5);

        assertThat(m.render(MatrixFormat.of(4))).isEqualTo("(    ?  0.5 )\n\n");
    }

    @Test
    void printWritesTheRenderedText() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);
        Matrix<Long> m = Matrix.of(LONG, 2, 1, 1L, 2L);

        MatrixRenderer.print(out, m, MatrixFormat.of(2));

        assertThat(bytes.toString(StandardCharsets.UTF_8)).isEqualTo("(  1 )\n(  2 )\n\n");
    }

    @Test
    void negativeWidthIsRejected() {
        assertThatThrownBy(() -> MatrixFormat.of(-1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MatrixFormat.setOutputWidth(Double.class, -3))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
