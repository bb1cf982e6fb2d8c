package io.nosqlbench.command.matrix;

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

import io.nosqlbench.command.matrix.subcommands.CMD_matrix_add;
import io.nosqlbench.command.matrix.subcommands.CMD_matrix_demo;
import io.nosqlbench.command.matrix.subcommands.CMD_matrix_multiply;
import io.nosqlbench.matrix.MatrixErrorKind;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// The matrix command contains subcommands that exercise the matrix library.
///
/// This is an umbrella command for the demo and arithmetic subcommands.
@CommandLine.Command(name = "matrix",
    header = "Build, combine and print dense matrices",
    description = "Contains subcommands that construct matrices and apply matrix arithmetic",
    mixinStandardHelpOptions = true,
    subcommands = {
        CMD_matrix_demo.class,
        CMD_matrix_add.class,
        CMD_matrix_multiply.class
    })
public class CMD_matrix implements Callable<Integer> {

    /// Run CMD_matrix
    ///
    /// @param args Command line arguments
    public static void main(String[] args) {
        System.exit(new CommandLine(new CMD_matrix()).execute(args));
    }

    /// Execute the matrix command
    ///
    /// @return 0 for success
    @Override
    public Integer call() {
        // Print help information if no subcommand is specified
        CommandLine.usage(this, System.out);
        return 0;
    }

    /// Returns the user-facing explanation for a matrix error.
    ///
    /// @param kind the error kind
    /// @return a one-line message starting with `Error:`
    public static String describe(MatrixErrorKind kind) {
        switch (kind) {
            case ZERO_SIZE:
                return "Error: Cannot create a matrix with zero rows or columns!";
            case INITIALIZER_WRONG_SIZE:
                return "Error: Initializer size does not match the expected number of elements!";
            case INCOMPATIBLE_SIZES_ADD:
                return "Error: Two matrices can only be added or subtracted if they are of the same size!";
            case INCOMPATIBLE_SIZES_MULTIPLY:
                return "Error: Two matrices can only be multiplied if the number of columns in the first matrix"
                    + " is equal to the number of rows in the second matrix!";
            case INDEX_OUT_OF_RANGE:
                return "Error: Requested matrix element is out of range!";
            default:
                throw new IllegalArgumentException("Unknown matrix error kind: " + kind);
        }
    }
}
