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

/// The kinds of precondition violation a [Matrix] can report.
///
/// Each kind maps one-to-one onto a [MatrixException] subclass, so callers can either
/// catch the specific exception type or switch on [MatrixException#kind()].
public enum MatrixErrorKind {
    /// A construction form was given zero rows, zero columns or an empty diagonal.
    ZERO_SIZE,
    /// A flat initializer did not hold exactly `rows * cols` elements.
    INITIALIZER_WRONG_SIZE,
    /// Operands of an addition or subtraction differ in shape.
    INCOMPATIBLE_SIZES_ADD,
    /// The left operand's column count differs from the right operand's row count.
    INCOMPATIBLE_SIZES_MULTIPLY,
    /// A checked access addressed a row or column outside the matrix.
    INDEX_OUT_OF_RANGE
}
