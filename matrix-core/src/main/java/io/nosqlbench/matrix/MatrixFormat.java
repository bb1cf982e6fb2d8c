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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/// Text layout settings for rendering a [Matrix].
///
/// ## Explicit and type-scoped widths
///
/// A MatrixFormat can be passed directly to [Matrix#render(MatrixFormat)] or
/// [MatrixRenderer]. When no format is given, the width registered for the element's
/// Java class is used, so all matrices of one element type share a width:
///
/// ```java
/// MatrixFormat.setOutputWidth(Double.class, 3);
/// System.out.print(matrix);                         // width 3 for every Matrix<Double>
/// System.out.print(matrix.render(MatrixFormat.of(8))); // explicit width, registry untouched
/// ```
///
/// The width is not part of any matrix's state or equality.
///
/// @param width the minimum number of characters per element; shorter elements are
///              right-aligned, longer ones are printed in full. Zero disables padding.
public record MatrixFormat(int width) {

    private static final Logger logger = LogManager.getLogger(MatrixFormat.class);

    /// Width used for element types that have not been configured.
    public static final int DEFAULT_WIDTH = 5;

    public static final MatrixFormat DEFAULT = new MatrixFormat(DEFAULT_WIDTH);

    private static final Map<Class<?>, MatrixFormat> TYPE_FORMATS = new ConcurrentHashMap<>();

    public MatrixFormat {
        if (width < 0) {
            throw new IllegalArgumentException("width must be non-negative, got: " + width);
        }
    }

    /// @param width the element width
    /// @return a format with the given width
    public static MatrixFormat of(int width) {
        return width == DEFAULT_WIDTH ? DEFAULT : new MatrixFormat(width);
    }

    /// Sets the output width for every matrix whose elements are of the given class.
    ///
    /// Only rendering performed after this call is affected.
    ///
    /// @param elementClass the element Java class, such as `Double.class`
    /// @param width the new width
    public static void setOutputWidth(Class<?> elementClass, int width) {
        Objects.requireNonNull(elementClass, "elementClass");
        MatrixFormat format = of(width);
        MatrixFormat previous = TYPE_FORMATS.put(elementClass, format);
        logger.debug("output width for {} set to {} (was {})",
            elementClass.getSimpleName(), width, previous == null ? DEFAULT_WIDTH : previous.width());
    }

    /// Sets the output width for every matrix of the given element type.
    public static void setOutputWidth(ElementType<?> type, int width) {
        setOutputWidth(type.javaType(), width);
    }

    /// @param elementClass the element Java class
    /// @return the format registered for that class, or [#DEFAULT]
    public static MatrixFormat forType(Class<?> elementClass) {
        return TYPE_FORMATS.getOrDefault(elementClass, DEFAULT);
    }

    /// @return the format registered for the Java class of the given element type
    public static MatrixFormat forType(ElementType<?> type) {
        return forType(type.javaType());
    }

    /// Removes every registered width, restoring [#DEFAULT_WIDTH] for all element types.
    public static void resetOutputWidths() {
        TYPE_FORMATS.clear();
        logger.debug("output widths reset to {}", DEFAULT_WIDTH);
    }

    /// Right-aligns text to this format's width.
    ///
    /// @param text element text
    /// @return the text, left-padded with spaces up to [#width()]
    public String pad(String text) {
        if (text.length() >= width) {
            return text;
        }
        return " ".repeat(width - text.length()) + text;
    }
}
