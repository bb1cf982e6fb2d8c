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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/// Built-in [ElementType] instances for the common numeric types.
///
/// | Constant | Element | Rendering |
/// |----------|---------|-----------|
/// | [#DOUBLE] | `Double` | general notation, 6 significant digits |
/// | [#FLOAT] | `Float` | general notation, 6 significant digits |
/// | [#LONG] | `Long` | decimal |
/// | [#INTEGER] | `Integer` | decimal |
/// | [#BIG_DECIMAL] | `BigDecimal` | plain decimal |
/// | [#BIG_INTEGER] | `BigInteger` | decimal |
///
/// Integer types use Java's wrapping arithmetic, as the primitive operators do.
public final class ElementTypes {

    /// Significant digits used when rendering floating point elements.
    public static final int GENERAL_PRECISION = 6;

    private static final MathContext GENERAL = new MathContext(GENERAL_PRECISION, RoundingMode.HALF_EVEN);

    public static final ElementType<Double> DOUBLE = ElementType.of(
        "double", Double.class, 0.0,
        Double::sum, (a, b) -> a - b, a -> -a, (a, b) -> a * b,
        ElementTypes::formatGeneral);

    public static final ElementType<Float> FLOAT = ElementType.of(
        "float", Float.class, 0.0f,
        Float::sum, (a, b) -> a - b, a -> -a, (a, b) -> a * b,
        f -> formatGeneral(f.doubleValue()));

    public static final ElementType<Long> LONG = ElementType.of(
        "long", Long.class, 0L,
        Long::sum, (a, b) -> a - b, a -> -a, (a, b) -> a * b);

    public static final ElementType<Integer> INTEGER = ElementType.of(
        "int", Integer.class, 0,
        Integer::sum, (a, b) -> a - b, a -> -a, (a, b) -> a * b);

    public static final ElementType<BigDecimal> BIG_DECIMAL = ElementType.of(
        "bigdecimal", BigDecimal.class, BigDecimal.ZERO,
        BigDecimal::add, BigDecimal::subtract, BigDecimal::negate, BigDecimal::multiply,
        BigDecimal::toPlainString);

    public static final ElementType<BigInteger> BIG_INTEGER = ElementType.of(
        "biginteger", BigInteger.class, BigInteger.ZERO,
        BigInteger::add, BigInteger::subtract, BigInteger::negate, BigInteger::multiply);

    private static final List<ElementType<?>> BUILT_INS =
        List.of(DOUBLE, FLOAT, LONG, INTEGER, BIG_DECIMAL, BIG_INTEGER);

    private ElementTypes() {
    }

    /// @return all built-in element types
    public static List<ElementType<?>> all() {
        return BUILT_INS;
    }

    /// Looks up a built-in element type by its [ElementType#name()], ignoring case.
    ///
    /// @param name the type name, such as `double` or `long`
    /// @return the matching type, or empty if there is none
    public static Optional<ElementType<?>> byName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String key = name.trim().toLowerCase(Locale.ROOT);
        for (ElementType<?> type : BUILT_INS) {
            if (type.name().equals(key)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /// Formats a floating point value the way a default-configured C++ or C stream
    /// does with `%g`: 6 significant digits, trailing zeros removed, and scientific
    /// notation when the decimal exponent is below -4 or at least 6.
    ///
    /// @param value the value to format
    /// @return the formatted text, for example `21`, `0.5` or `1.23457e+07`
    public static String formatGeneral(double value) {
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        if (value == 0.0) {
            return Double.doubleToRawLongBits(value) < 0 ? "-0" : "0";
        }

        BigDecimal rounded = new BigDecimal(value).round(GENERAL).stripTrailingZeros();
        int exponent = rounded.precision() - rounded.scale() - 1;
        if (exponent < -4 || exponent >= GENERAL_PRECISION) {
            String mantissa = rounded.movePointLeft(exponent).toPlainString();
            return String.format(Locale.ROOT, "%se%s%02d", mantissa, exponent < 0 ? "-" : "+", Math.abs(exponent));
        }
        return rounded.toPlainString();
    }
}
