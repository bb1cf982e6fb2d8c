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
import io.nosqlbench.command.common.MatrixOption;
import io.nosqlbench.command.matrix.CMD_matrix;
import io.nosqlbench.matrix.Matrix;
import io.nosqlbench.matrix.MatrixException;
import io.nosqlbench.matrix.MatrixFormat;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.util.concurrent.Callable;

import static io.nosqlbench.matrix.ElementTypes.DOUBLE;

/// Multiply two matrices given on the command line.
///
/// ```bash
/// matrix multiply 2x3:1,2,7,4,5,6 diag:1,2,3 --width 3
/// matrix multiply 2x2:1,2,3,4 --scalar 0.5
/// ```
///
/// With `--scalar`, only the left operand is given and every element is multiplied by
/// the scalar.
@CommandLine.Command(
    name = "multiply",
    header = "Multiply two matrices, or a matrix by a scalar",
    description = "Prints the matrix product LEFT * RIGHT, or LEFT * SCALAR when --scalar is given.",
    exitCodeList = {
        "0: Success",
        "1: The operands have incompatible sizes",
        "2: Invalid arguments"
    }
)
public class CMD_matrix_multiply implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_matrix_multiply.class);

    @CommandLine.Parameters(index = "0", paramLabel = "LEFT",
        description = "Left operand: ROWSxCOLS:v1,v2,..., ROWSxCOLS=v or diag:v1,v2,...",
        converter = MatrixOption.MatrixConverter.class)
    private Matrix<Double> left;

    @CommandLine.Parameters(index = "1", paramLabel = "RIGHT", arity = "0..1",
        description = "Right operand, required unless --scalar is given",
        converter = MatrixOption.MatrixConverter.class)
    private Matrix<Double> right;

    @CommandLine.Option(names = {"--scalar"}, description = "Multiply LEFT by this scalar instead of a matrix")
    private Double scalar;

    @CommandLine.Mixin
    private FormatOption formatOption = new FormatOption();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        if ((scalar == null) == (right == null)) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Specify exactly one of RIGHT or --scalar");
        }

        MatrixFormat format;
        try {
            format = formatOption.install(DOUBLE, null);
        } catch (IOException | IllegalArgumentException e) {
            logger.debug("could not configure output width", e);
            System.err.println("Error: Could not apply the output format: " + e.getMessage());
            return 1;
        }

        try {
            Matrix<Double> product = scalar != null ? left.multiply(scalar) : left.multiply(right);
            System.out.print(product.render(format));
            return 0;
        } catch (MatrixException e) {
            logger.debug("multiply failed", e);
            System.err.println(CMD_matrix.describe(e.kind()));
            System.err.println("  " + e.getMessage());
            return 1;
        }
    }
}
