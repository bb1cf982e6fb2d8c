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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/// A dense, mutable, rectangular grid of elements with elementwise arithmetic.
///
/// ## Storage
///
/// Elements live in a single owned buffer of `rows * cols` slots in row-major order.
/// The element at `(i, j)` is stored at offset `i * cols + j`:
///
/// ```
///   2x3 matrix               buffer
///   ┌─────────────┐          ┌───┬───┬───┬───┬───┬───┐
///   │  a   b   c  │   ───►   │ a │ b │ c │ d │ e │ f │
///   │  d   e   f  │          └───┴───┴───┴───┴───┴───┘
///   └─────────────┘            0   1   2   3   4   5
/// ```
///
/// A buffer is owned by exactly one matrix. [#copy()], the copy constructor and
/// [#assign(Matrix)] allocate an independent buffer. [#move()] and
/// [#moveAssign(Matrix)] hand the buffer to another matrix and leave the source
/// empty: zero rows, zero columns and no buffer. An empty matrix may only be reassigned,
/// rendered or discarded.
///
/// ## Construction
///
/// | Form | Result |
/// |------|--------|
/// | `new Matrix<>(type, rows, cols)` | elements unset; write every element before reading it |
/// | `new Matrix<>(type, rows, cols, fill)` | every element is `fill` |
/// | `new Matrix<>(type, diagonal)`, [#diagonal] | square, off-diagonal elements are `type.zero()` |
/// | `new Matrix<>(type, rows, cols, flat)`, [#of] | elements taken from `flat` in row-major order |
/// | `new Matrix<>(other)`, [#copy()] | deep copy |
/// | [#move()] | takes over the buffer of the source |
///
/// Zero rows or columns raise [ZeroSizeException]; a flat initializer of the wrong
/// length raises [InitializerWrongSizeException].
///
/// ## Access
///
/// [#get] and [#set] compute the buffer offset without validating the indices. They are
/// meant for loops whose indices are known to be in range; out-of-range indices address
/// another element or fail with the JVM's own array exception. [#at] and [#setAt] check
/// both indices first and raise [IndexOutOfRangeException].
///
/// ## Arithmetic
///
/// ```java
/// Matrix<Double> e = Matrix.of(ElementTypes.DOUBLE, 2, 3, 1.0, 2.0, 3.0, 4.0, 5.0, 6.0);
/// Matrix<Double> c = Matrix.diagonal(ElementTypes.DOUBLE, 1.0, 2.0, 3.0);
/// e.set(0, 2, 7.0);
/// Matrix<Double> g = e.multiply(c);      // ( 1 4 21 ) ( 4 10 18 )
/// Matrix<Double> sum = e.add(g);
/// Matrix<Double> scaled = Matrix.multiply(7.0, c);
/// ```
///
/// All operators return new matrices and leave their operands unchanged, except
/// [#addInPlace] and [#subtractInPlace], which replace this matrix with the result.
///
/// Matrices are not thread-safe.
///
/// @param <T> the element type; its arithmetic is supplied by an [ElementType]
public final class Matrix<T> {

    private ElementType<T> type;
    private int rows;
    private int cols;
    private Object[] elements;

    /// Creates a matrix whose elements are unset.
    ///
    /// Unset elements read as `null` and render as [MatrixRenderer#UNSET]; every element
    /// should be written before it is read or used in arithmetic.
    ///
    /// @param type the element arithmetic
    /// @param rows the number of rows, at least 1
    /// @param cols the number of columns, at least 1
    /// @throws ZeroSizeException if `rows` or `cols` is zero
    public Matrix(ElementType<T> type, int rows, int cols) {
        this.type = Objects.requireNonNull(type, "type");
        this.elements = allocate(rows, cols);
        this.rows = rows;
        this.cols = cols;
    }

    /// Creates a matrix with every element set to `fill`.
    ///
    /// @throws ZeroSizeException if `rows` or `cols` is zero
    public Matrix(ElementType<T> type, int rows, int cols, T fill) {
        this(type, rows, cols);
        Arrays.fill(elements, Objects.requireNonNull(fill, "fill"));
    }

    /// Creates a square diagonal matrix.
    ///
    /// @param type the element arithmetic
    /// @param diagonal the diagonal elements; the matrix side is the list size
    /// @throws ZeroSizeException if `diagonal` is empty
    public Matrix(ElementType<T> type, List<T> diagonal) {
        this(type, sideOf(diagonal), sideOf(diagonal));
        T zero = type.zero();
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                set(i, j, i == j ? Objects.requireNonNull(diagonal.get(i), "diagonal element") : zero);
            }
        }
    }

    /// Creates a matrix from elements given in flattened row-major order.
    ///
    /// The element at row `i` and column `j` is `flat.get(i * cols + j)`. For a 2x2
    /// matrix the list is `[A(0,0), A(0,1), A(1,0), A(1,1)]`.
    ///
    /// @throws ZeroSizeException if `rows` or `cols` is zero
    /// @throws InitializerWrongSizeException if `flat.size() != rows * cols`
    public Matrix(ElementType<T> type, int rows, int cols, List<T> flat) {
        this(type, rows, cols);
        Objects.requireNonNull(flat, "flat");
        if (flat.size() != elements.length) {
            throw new InitializerWrongSizeException(rows, cols, flat.size());
        }
        for (int i = 0; i < elements.length; i++) {
            elements[i] = Objects.requireNonNull(flat.get(i), "flat element");
        }
    }

    /// Creates a deep copy of another matrix.
    public Matrix(Matrix<T> other) {
        this.type = other.type;
        this.rows = other.rows;
        this.cols = other.cols;
        this.elements = other.elements == null ? null : other.elements.clone();
    }

    private Matrix(ElementType<T> type, int rows, int cols, Object[] elements) {
        this.type = type;
        this.rows = rows;
        this.cols = cols;
        this.elements = elements;
    }

    /// Creates a square diagonal matrix from the given diagonal elements.
    ///
    /// @throws ZeroSizeException if no elements are given
    @SafeVarargs
    public static <T> Matrix<T> diagonal(ElementType<T> type, T... diagonal) {
        return new Matrix<>(type, Arrays.asList(diagonal));
    }

    /// Creates a matrix from elements given in flattened row-major order.
    ///
    /// @throws ZeroSizeException if `rows` or `cols` is zero
    /// @throws InitializerWrongSizeException if the element count is not `rows * cols`
    @SafeVarargs
    public static <T> Matrix<T> of(ElementType<T> type, int rows, int cols, T... flat) {
        return new Matrix<>(type, rows, cols, Arrays.asList(flat));
    }

    private static int sideOf(List<?> diagonal) {
        return Objects.requireNonNull(diagonal, "diagonal").size();
    }

    private static Object[] allocate(int rows, int cols) {
        if (rows < 0 || cols < 0) {
            throw new IllegalArgumentException(
                "matrix dimensions must be non-negative, got: " + rows + "x" + cols);
        }
        if (rows == 0 || cols == 0) {
            throw new ZeroSizeException(rows, cols);
        }
        long size = (long) rows * cols;
        if (size > Integer.MAX_VALUE - 8) {
            throw new IllegalArgumentException(
                "matrix of " + rows + "x" + cols + " exceeds the maximum buffer size");
        }
        return new Object[(int) size];
    }

    /// @return a deep copy of this matrix
    public Matrix<T> copy() {
        return new Matrix<>(this);
    }

    /// Transfers this matrix's buffer to a new matrix.
    ///
    /// Afterwards this matrix is empty.
    ///
    /// @return a matrix holding the content this matrix had
    public Matrix<T> move() {
        Matrix<T> target = new Matrix<>(type, rows, cols, elements);
        release();
        return target;
    }

    /// Replaces this matrix with a deep copy of `other`.
    ///
    /// The previous buffer is discarded; dimensions and element type are taken from
    /// `other`.
    ///
    /// @return this matrix
    public Matrix<T> assign(Matrix<T> other) {
        if (other == this) {
            return this;
        }
        this.type = other.type;
        this.rows = other.rows;
        this.cols = other.cols;
        this.elements = other.elements == null ? null : other.elements.clone();
        return this;
    }

    /// Replaces this matrix with the content of `other`, taking over its buffer.
    ///
    /// Afterwards `other` is empty. Move-assigning a matrix to itself has no effect.
    ///
    /// @return this matrix
    public Matrix<T> moveAssign(Matrix<T> other) {
        if (other == this) {
            return this;
        }
        this.type = other.type;
        this.rows = other.rows;
        this.cols = other.cols;
        this.elements = other.elements;
        other.release();
        return this;
    }

    private void release() {
        rows = 0;
        cols = 0;
        elements = null;
    }

    /// @return the number of rows, or 0 for an empty matrix
    public int rows() {
        return rows;
    }

    /// @return the number of columns, or 0 for an empty matrix
    public int cols() {
        return cols;
    }

    /// @return true if this matrix has given its buffer away through a move
    public boolean isEmpty() {
        return elements == null;
    }

    public ElementType<T> elementType() {
        return type;
    }

    /// Reads an element without checking the indices.
    ///
    /// The caller guarantees `0 <= row < rows()` and `0 <= col < cols()`.
    @SuppressWarnings("unchecked")
    public T get(int row, int col) {
        return (T) elements[row * cols + col];
    }

    /// Writes an element without checking the indices.
    ///
    /// The caller guarantees `0 <= row < rows()` and `0 <= col < cols()`.
    public void set(int row, int col, T value) {
        elements[row * cols + col] = value;
    }

    /// Reads an element after checking both indices.
    ///
    /// @throws IndexOutOfRangeException if the element is outside this matrix
    public T at(int row, int col) {
        checkIndex(row, col);
        return get(row, col);
    }

    /// Writes an element after checking both indices.
    ///
    /// @throws IndexOutOfRangeException if the element is outside this matrix
    public void setAt(int row, int col, T value) {
        checkIndex(row, col);
        set(row, col, value);
    }

    private void checkIndex(int row, int col) {
        if (row < 0 || col < 0 || row >= rows || col >= cols) {
            throw new IndexOutOfRangeException(row, col, rows, cols);
        }
    }

    /// @return a row-major snapshot of the elements; empty for an empty matrix
    @SuppressWarnings("unchecked")
    public List<T> toList() {
        if (elements == null) {
            return List.of();
        }
        return Collections.unmodifiableList(Arrays.asList((T[]) elements.clone()));
    }

    /// @return a new matrix holding the negation of every element
    public Matrix<T> negate() {
        Matrix<T> result = new Matrix<>(type, rows, cols);
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                result.set(i, j, type.negate(get(i, j)));
            }
        }
        return result;
    }

    /// @return the elementwise sum `this + other`
    /// @throws IncompatibleSizesAddException if the shapes differ
    public Matrix<T> add(Matrix<T> other) {
        requireSameShape(other);
        Matrix<T> result = new Matrix<>(type, rows, cols);
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                result.set(i, j, type.add(get(i, j), other.get(i, j)));
            }
        }
        return result;
    }

    /// @return the elementwise difference `this - other`
    /// @throws IncompatibleSizesAddException if the shapes differ
    public Matrix<T> subtract(Matrix<T> other) {
        requireSameShape(other);
        Matrix<T> result = new Matrix<>(type, rows, cols);
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                result.set(i, j, type.subtract(get(i, j), other.get(i, j)));
            }
        }
        return result;
    }

    /// Replaces this matrix with `this + other`.
    ///
    /// @return this matrix
    /// @throws IncompatibleSizesAddException if the shapes differ; this matrix is unchanged
    public Matrix<T> addInPlace(Matrix<T> other) {
        return moveAssign(add(other));
    }

    /// Replaces this matrix with `this - other`.
    ///
    /// @return this matrix
    /// @throws IncompatibleSizesAddException if the shapes differ; this matrix is unchanged
    public Matrix<T> subtractInPlace(Matrix<T> other) {
        return moveAssign(subtract(other));
    }

    private void requireSameShape(Matrix<T> other) {
        if (rows != other.rows || cols != other.cols) {
            throw new IncompatibleSizesAddException(rows, cols, other.rows, other.cols);
        }
    }

    /// Computes the matrix product `this * other`.
    ///
    /// Entry `(i, j)` of the result is the sum over `k` of `this(i, k) * other(k, j)`,
    /// accumulated from [ElementType#zero()].
    ///
    /// @return a `rows() x other.cols()` matrix
    /// @throws IncompatibleSizesMultiplyException if `cols() != other.rows()`
    public Matrix<T> multiply(Matrix<T> other) {
        if (cols != other.rows) {
            throw new IncompatibleSizesMultiplyException(rows, cols, other.rows, other.cols);
        }
        Matrix<T> result = new Matrix<>(type, rows, other.cols);
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < other.cols; j++) {
                T sum = type.zero();
                for (int k = 0; k < cols; k++) {
                    sum = type.add(sum, type.multiply(get(i, k), other.get(k, j)));
                }
                result.set(i, j, sum);
            }
        }
        return result;
    }

    /// Multiplies every element by a scalar given on the right.
    ///
    /// `A * s` is defined as `s * A`: each element is `type.multiply(scalar, this(i, j))`,
    /// the same as [#multiply(Object, Matrix)]. This assumes the element type's
    /// multiplication is commutative. For a non-commutative element type the result is
    /// `s * this(i, j)`, not `this(i, j) * s`.
    public Matrix<T> multiply(T scalar) {
        return multiply(scalar, this);
    }

    /// Multiplies every element by a scalar on the left: `scalar * matrix(i, j)`.
    public static <T> Matrix<T> multiply(T scalar, Matrix<T> matrix) {
        ElementType<T> type = matrix.type;
        Matrix<T> result = new Matrix<>(type, matrix.rows, matrix.cols);
        for (int i = 0; i < matrix.rows; i++) {
            for (int j = 0; j < matrix.cols; j++) {
                result.set(i, j, type.multiply(scalar, matrix.get(i, j)));
            }
        }
        return result;
    }

    /// Renders this matrix with an explicit format.
    ///
    /// @see MatrixRenderer
    public String render(MatrixFormat format) {
        return MatrixRenderer.render(this, format);
    }

    /// Two matrices are equal when they have the same dimensions and equal elements in
    /// the same positions.
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Matrix)) {
            return false;
        }
        Matrix<?> other = (Matrix<?>) o;
        return rows == other.rows && cols == other.cols && Arrays.equals(elements, other.elements);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * rows + cols) + Arrays.hashCode(elements);
    }

    /// Renders this matrix with the width registered for its element type.
    ///
    /// @see MatrixFormat#setOutputWidth(Class, int)
    @Override
    public String toString() {
        return MatrixRenderer.render(this);
    }
}
