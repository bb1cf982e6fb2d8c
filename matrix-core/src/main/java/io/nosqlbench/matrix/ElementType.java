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

import java.util.Objects;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/// Arithmetic over the elements of a [Matrix].
///
/// ## Purpose
///
/// A matrix is generic over its element type, but Java has no operator overloading.
/// An ElementType supplies the four operations a matrix needs from its elements, plus the
/// additive identity used as the starting value of every dot product and as the
/// off-diagonal value of diagonal matrices.
///
/// ```
///   Matrix<T> ──── elementType() ────► ElementType<T>
///                                        ├─ zero()
///                                        ├─ add(a, b)       a + b
///                                        ├─ subtract(a, b)  a - b
///                                        ├─ negate(a)       -a
///                                        ├─ multiply(a, b)  a * b   (operand order preserved)
///                                        └─ format(a)       text for rendering
/// ```
///
/// ## Built-in and custom types
///
/// The common numeric types are provided by [ElementTypes]. Other element types are
/// built from functional operators:
///
/// ```java
/// ElementType<Complex> complex = ElementType.of(
///     "complex", Complex.class, Complex.ZERO,
///     Complex::plus, Complex::minus, Complex::negate, Complex::times);
/// ```
///
/// The [#name()] of a type is used to address its output width in a
/// [MatrixFormatConfig] file, and [#javaType()] keys the type-scoped width registry in
/// [MatrixFormat].
///
/// @param <T> the element type
public interface ElementType<T> {

    /// @return a short lowercase name for this element type, such as `double`
    String name();

    /// @return the Java class of the elements
    Class<T> javaType();

    /// @return the additive identity
    T zero();

    T add(T a, T b);

    T subtract(T a, T b);

    T negate(T a);

    /// Multiplies two elements, `a` on the left and `b` on the right.
    ///
    /// Implementations must not reorder the operands, so that non-commutative element
    /// types keep their meaning.
    T multiply(T a, T b);

    /// Renders one element for [MatrixRenderer].
    ///
    /// @param value a non-null element
    /// @return the element text, without padding
    default String format(T value) {
        return String.valueOf(value);
    }

    /// Creates an element type from functional operators, using [Objects#toString(Object)]
    /// for rendering.
    static <T> ElementType<T> of(
        String name,
        Class<T> javaType,
        T zero,
        BinaryOperator<T> add,
        BinaryOperator<T> subtract,
        UnaryOperator<T> negate,
        BinaryOperator<T> multiply
    ) {
        return of(name, javaType, zero, add, subtract, negate, multiply, Objects::toString);
    }

    /// Creates an element type from functional operators and a custom element formatter.
    static <T> ElementType<T> of(
        String name,
        Class<T> javaType,
        T zero,
        BinaryOperator<T> add,
        BinaryOperator<T> subtract,
        UnaryOperator<T> negate,
        BinaryOperator<T> multiply,
        Function<? super T, String> formatter
    ) {
        return new Functional<>(name, javaType, zero, add, subtract, negate, multiply, formatter);
    }

    /// An [ElementType] assembled from functional operators.
    final class Functional<T> implements ElementType<T> {
        private final String name;
        private final Class<T> javaType;
        private final T zero;
        private final BinaryOperator<T> add;
        private final BinaryOperator<T> subtract;
        private final UnaryOperator<T> negate;
        private final BinaryOperator<T> multiply;
        private final Function<? super T, String> formatter;

        Functional(
            String name,
            Class<T> javaType,
            T zero,
            BinaryOperator<T> add,
            BinaryOperator<T> subtract,
            UnaryOperator<T> negate,
            BinaryOperator<T> multiply,
            Function<? super T, String> formatter
        ) {
            this.name = Objects.requireNonNull(name, "name");
            this.javaType = Objects.requireNonNull(javaType, "javaType");
            this.zero = Objects.requireNonNull(zero, "zero");
            this.add = Objects.requireNonNull(add, "add");
            this.subtract = Objects.requireNonNull(subtract, "subtract");
            this.negate = Objects.requireNonNull(negate, "negate");
            this.multiply = Objects.requireNonNull(multiply, "multiply");
            this.formatter = Objects.requireNonNull(formatter, "formatter");
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public Class<T> javaType() {
            return javaType;
        }

        @Override
        public T zero() {
            return zero;
        }

        @Override
        public T add(T a, T b) {
            return add.apply(a, b);
        }

        @Override
        public T subtract(T a, T b) {
            return subtract.apply(a, b);
        }

        @Override
        public T negate(T a) {
            return negate.apply(a);
        }

        @Override
        public T multiply(T a, T b) {
            return multiply.apply(a, b);
        }

        @Override
        public String format(T value) {
            return formatter.apply(value);
        }

        @Override
        public String toString() {
            return "ElementType[" + name + "]";
        }
    }
}
