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

/// Add or subtract two matrices of the same shape.
///
/// ```bash
/// matrix add 2x2:1,2,3,4 2x2=10
/// matrix add --subtract 2x2:1,2,3,4 diag:1,1
/// ```
@CommandLine.Command(
    name = "add",
    header = "Add or subtract two matrices",
    description = "Prints LEFT + RIGHT, or LEFT - RIGHT with --subtract. Both operands must have the same shape.",
    exitCodeList = {
        "0: Success",
        "1: The operands have different shapes",
        "2: Invalid arguments"
    }
)
public class CMD_matrix_add implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_matrix_add.class);

    @CommandLine.Parameters(index = "0", paramLabel = "LEFT",
        description = "Left operand: ROWSxCOLS:v1,v2,..., ROWSxCOLS=v or diag:v1,v2,...",
        converter = MatrixOption.MatrixConverter.class)
    private Matrix<Double> left;

    @CommandLine.Parameters(index = "1", paramLabel = "RIGHT",
        description = "Right operand, same shape as LEFT",
        converter = MatrixOption.MatrixConverter.class)
    private Matrix<Double> right;

    @CommandLine.Option(names = {"--subtract"}, description = "Subtract RIGHT from LEFT instead of adding")
    private boolean subtract = false;

    @CommandLine.Mixin
    private FormatOption formatOption = new FormatOption();

    @Override
    public Integer call() {
        MatrixFormat format;
        try {
            format = formatOption.install(DOUBLE, null);
        } catch (IOException | IllegalArgumentException e) {
            logger.debug("could not configure output width", e);
            System.err.println("Error: Could not apply the output format: " + e.getMessage());
            return 1;
        }

        try {
            Matrix<Double> result = subtract ? left.subtract(right) : left.add(right);
            System.out.print(result.render(format));
            return 0;
        } catch (MatrixException e) {
            logger.debug("{} failed", subtract ? "subtract" : "add", e);
            System.err.println(CMD_matrix.describe(e.kind()));
            System.err.println("  " + e.getMessage());
            return 1;
        }
    }
}
