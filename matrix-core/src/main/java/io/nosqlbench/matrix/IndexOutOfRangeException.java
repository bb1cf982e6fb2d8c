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

/// Thrown by checked element access when the requested element lies outside the matrix.
public class IndexOutOfRangeException extends MatrixException {

    public IndexOutOfRangeException(int row, int col, int rows, int cols) {
        super(MatrixErrorKind.INDEX_OUT_OF_RANGE,
            String.format("Element (%d, %d) is out of range for a %dx%d matrix", row, col, rows, cols));
    }
}
