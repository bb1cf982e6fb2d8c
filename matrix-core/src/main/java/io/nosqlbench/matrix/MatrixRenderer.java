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

import java.io.PrintStream;

/**
 * Renders matrices as parenthesized rows of right-aligned elements.
 *
 * <p>A 2x3 matrix rendered at width 3:</p>
 * <pre>{@code
 * (   1   4  21 )
 * (   4  10  18 )
 *
 * }</pre>
 *
 * <p>Every row is followed by a newline and the whole matrix by one blank line.
 * An empty (moved-from) matrix renders as the single line {@code ()}.
 * Elements that were never written render as {@value #UNSET}.</p>
 */
public final class MatrixRenderer {

    /** Placeholder text for elements of an uninitialized matrix that were never set. */
    public static final String UNSET = "?";

    /** Rendering of a matrix that no longer owns a buffer. */
    public static final String EMPTY = "()";

    private MatrixRenderer() {
    }

    /**
     * Renders a matrix using the width registered for its element type.
     */
    public static <T> String render(Matrix<T> matrix) {
        return render(matrix, MatrixFormat.forType(matrix.elementType()));
    }

    /**
     * Renders a matrix with an explicit format.
     *
     * @param matrix the matrix to render
     * @param format the layout settings
     * @return the rendered text, newline terminated
     */
    public static <T> String render(Matrix<T> matrix, MatrixFormat format) {
        StringBuilder sb = new StringBuilder();
        appendTo(sb, matrix, format);
        return sb.toString();
    }

    /**
     * Prints a matrix to a stream using the width registered for its element type.
     */
    public static <T> void print(PrintStream out, Matrix<T> matrix) {
        out.print(render(matrix));
    }

    /**
     * Prints a matrix to a stream with an explicit format.
     */
    public static <T> void print(PrintStream out, Matrix<T> matrix, MatrixFormat format) {
        out.print(render(matrix, format));
    }

    static <T> void appendTo(StringBuilder sb, Matrix<T> matrix, MatrixFormat format) {
        if (matrix.isEmpty()) {
            sb.append(EMPTY).append('\n');
            return;
        }
        ElementType<T> type = matrix.elementType();
        for (int i = 0; i < matrix.rows(); i++) {
            sb.append("( ");
            for (int j = 0; j < matrix.cols(); j++) {
                T value = matrix.get(i, j);
                sb.append(format.pad(value == null ? UNSET : type.format(value))).append(' ');
            }
            sb.append(")\n");
        }
        sb.append('\n');
    }
}
