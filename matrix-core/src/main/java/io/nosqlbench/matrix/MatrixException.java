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

/// Base class of all errors raised by [Matrix] construction, access and arithmetic.
///
/// Matrix errors are unchecked. They are raised where the precondition is violated and
/// are never recovered inside the library.
public abstract class MatrixException extends RuntimeException {

    private final MatrixErrorKind kind;

    protected MatrixException(MatrixErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    /// @return the kind of violation this exception reports
    public MatrixErrorKind kind() {
        return kind;
    }
}
