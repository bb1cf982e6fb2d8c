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

/// Thrown when a flat initializer does not contain exactly `rows * cols` elements.
public class InitializerWrongSizeException extends MatrixException {

    public InitializerWrongSizeException(int rows, int cols, int supplied) {
        super(MatrixErrorKind.INITIALIZER_WRONG_SIZE,
            String.format("Initializer size %d does not match the %d elements of a %dx%d matrix",
                supplied, rows * cols, rows, cols));
    }
}
