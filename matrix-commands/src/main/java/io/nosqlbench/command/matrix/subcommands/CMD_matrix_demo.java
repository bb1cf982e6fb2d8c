package io.nosqlbench.command.matrix.subcommands;

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

import io.nosqlbench.command.common.FormatOption;
import io.nosqlbench.command.matrix.CMD_matrix;
import io.nosqlbench.matrix.Matrix;
import io.nosqlbench.matrix.MatrixException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import java.util.concurrent.Callable;

import static io.nosqlbench.matrix.ElementTypes.DOUBLE;

/// Walk through every matrix construction form and the arithmetic operators.
///
/// ## Usage
///
/// ```bash
/// matrix demo
/// matrix demo --width 6
/// ```
///
/// ## Example Output
///
/// ```
/// G = E * C:
/// (   1   4  21 )
/// (   4  10  18 )
///
/// ```
///
/// Each step prints a caption followed by the rendered matrix. Element widths default
/// to 3 characters for double matrices.
@CommandLine.Command(
    name = "demo",
    header = "Demonstrate matrix construction and arithmetic",
    description = "Builds matrices with every construction form, applies the arithmetic operators and prints the results.",
    exitCodeList = {
        "0: Success",
        "1: A matrix operation failed"
    }
)
public class CMD_matrix_demo implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_matrix_demo.class);

    /// Element width used when neither `--width` nor `--format-config` is given.
    public static final int DEMO_WIDTH = 3;

    @CommandLine.Mixin
    private FormatOption formatOption = new FormatOption();

    @Override
    public Integer call() {
        try {
            formatOption.install(DOUBLE, DEMO_WIDTH);
        } catch (IOException | IllegalArgumentException e) {
            logger.debug("could not configure output width", e);
            System.err.println("Error: Could not apply the output format: " + e.getMessage());
            return 1;
        }

        try {
            run(System.out);
            return 0;
        } catch (MatrixException e) {
            logger.debug("matrix demo failed", e);
            System.err.println(CMD_matrix.describe(e.kind()));
            return 1;
        }
    }

    private void run(PrintStream out) {
        Matrix<Double> a = new Matrix<>(DOUBLE, 3, 4);
        show(out, "new Matrix<>(DOUBLE, 3, 4): (UNINITIALIZED!)", a);

        Matrix<Double> b = new Matrix<>(DOUBLE, 4, 5, 0.0);
        show(out, "new Matrix<>(DOUBLE, 4, 5, 0.0):", b);

        Matrix<Double> c = new Matrix<>(DOUBLE, List.of(1.0, 2.0, 3.0));
        show(out, "new Matrix<>(DOUBLE, List.of(1.0, 2.0, 3.0)):", c);

        Matrix<Double> d = Matrix.diagonal(DOUBLE, 1.0, 2.0, 3.0, 4.0);
        show(out, "Matrix.diagonal(DOUBLE, 1.0, 2.0, 3.0, 4.0):", d);

        Matrix<Double> e = new Matrix<>(DOUBLE, 2, 3, List.of(1.0, 2.0, 3.0, 4.0, 5.0, 6.0));
        show(out, "new Matrix<>(DOUBLE, 2, 3, List.of(1.0, 2.0, 3.0, 4.0, 5.0, 6.0)):", e);

        Matrix<Double> f = Matrix.of(DOUBLE, 2, 2, 1.0, 2.0, 3.0, 4.0);
        show(out, "Matrix.of(DOUBLE, 2, 2, 1.0, 2.0, 3.0, 4.0):", f);

        e.set(0, 2, 7.0);
        show(out, "E after E.set(0, 2, 7.0):", e);

        Matrix<Double> g = e.multiply(c);
        show(out, "G = E * C:", g);

        show(out, "E + G:", e.add(g));

        show(out, "7.0 * C:", Matrix.multiply(7.0, c));

        show(out, "Matrix.diagonal(DOUBLE, 1.0, 2.0, 3.0):", Matrix.diagonal(DOUBLE, 1.0, 2.0, 3.0));

        show(out, "new Matrix<>(DOUBLE, 1, 2, 3.0):", new Matrix<>(DOUBLE, 1, 2, 3.0));
    }

    private static void show(PrintStream out, String caption, Matrix<?> matrix) {
        out.println(caption);
        out.print(matrix);
    }
}
