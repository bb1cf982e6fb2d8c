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

/// Thrown when two matrices of different shapes are added or subtracted.
public class IncompatibleSizesAddException extends MatrixException {

    public IncompatibleSizesAddException(int leftRows, int leftCols, int rightRows, int rightCols) {
        super(MatrixErrorKind.INCOMPATIBLE_SIZES_ADD,
            String.format("Two matrices can only be added or subtracted if they are of the same size: %dx%d vs %dx%d",
                leftRows, leftCols, rightRows, rightCols));
    }
}
