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

/// Thrown when the column count of the left factor differs from the row count of the right.
public class IncompatibleSizesMultiplyException extends MatrixException {

    public IncompatibleSizesMultiplyException(int leftRows, int leftCols, int rightRows, int rightCols) {
        super(MatrixErrorKind.INCOMPATIBLE_SIZES_MULTIPLY,
            String.format("Cannot multiply a %dx%d matrix by a %dx%d matrix: inner dimensions %d and %d differ",
                leftRows, leftCols, rightRows, rightCols, leftCols, rightRows));
    }
}
