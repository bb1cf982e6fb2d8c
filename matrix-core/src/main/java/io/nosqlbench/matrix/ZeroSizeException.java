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

/// Thrown when a matrix is constructed with zero rows, zero columns or an empty diagonal.
public class ZeroSizeException extends MatrixException {

    public ZeroSizeException(int rows, int cols) {
        super(MatrixErrorKind.ZERO_SIZE,
            String.format("Cannot create a matrix with zero rows or columns (requested %dx%d)", rows, cols));
    }
}
