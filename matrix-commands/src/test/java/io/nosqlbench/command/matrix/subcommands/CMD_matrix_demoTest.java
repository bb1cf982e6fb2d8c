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

import io.nosqlbench.command.matrix.CMD_matrix;
import io.nosqlbench.matrix.MatrixFormat;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

public class CMD_matrix_demoTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream outContent = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errContent = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    public void captureOutput() {
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(outContent));
        System.setErr(new PrintStream(errContent));
    }

    @AfterEach
    public void restoreOutput() {
        System.setOut(originalOut);
        System.setErr(originalErr);
        MatrixFormat.resetOutputWidths();
    }

    @Test
    public void testDemoPrintsEveryStep() {
        int exitCode = new CommandLine(new CMD_matrix()).execute("demo");

        assertThat(exitCode).isEqualTo(0);
        String output = outContent.toString();
        assertThat(output)
            .contains("new Matrix<>(DOUBLE, 3, 4): (UNINITIALIZED!)")
            .contains("(   ?   ?   ?   ? )\n")
            .contains("(   0   0   0   0   0 )\n")
            .contains("(   1   0   0   0 )\n(   0   2   0   0 )\n(   0   0   3   0 )\n(   0   0   0   4 )\n")
            .contains("(   1   2   3 )\n(   4   5   6 )\n")
            .contains("(   1   2   7 )\n(   4   5   6 )\n")
            .contains("(   7   0   0 )\n(   0  14   0 )\n(   0   0  21 )\n")
            .contains("(   3   3 )\n");
    }

    @Test
    public void testDemoShowsProductAndSum() {
        int exitCode = new CommandLine(new CMD_matrix()).execute("demo");

        assertThat(exitCode).isEqualTo(0);
        String output = outContent.toString();
        int product = output.indexOf("G = E * C:");
        int sum = output.indexOf("E + G:");
        assertThat(product).isGreaterThan(0);
        assertThat(sum).isGreaterThan(product);
        assertThat(output.substring(product, sum)).contains("(   1   4  21 )\n(   4  10  18 )\n\n");
        assertThat(output.substring(sum)).contains("(   2   6  28 )\n(   8  15  24 )\n\n");
    }

    @Test
    public void testWidthOptionOverridesDemoWidth() {
        int exitCode = new CommandLine(new CMD_matrix()).execute("demo", "--width", "5");

        assertThat(exitCode).isEqualTo(0);
        assertThat(outContent.toString()).contains("(     1     4    21 )\n");
    }

    @Test
    public void testFormatConfigFile() throws IOException {
        Path config = tempDir.resolve("format.json");
        Files.writeString(config, "{ \"widths\": { \"double\": 4 } }");

        int exitCode = new CommandLine(new CMD_matrix()).execute("demo", "--format-config", config.toString());

        assertThat(exitCode).isEqualTo(0);
        assertThat(outContent.toString()).contains("(    1    4   21 )\n");
    }

    @Test
    public void testInvalidFormatConfigFails() throws IOException {
        Path config = tempDir.resolve("format.json");
        Files.writeString(config, "{ \"widths\": { \"octonion\": 4 } }");

        int exitCode = new CommandLine(new CMD_matrix()).execute("demo", "--format-config", config.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(errContent.toString()).contains("octonion");
        assertThat(outContent.toString()).isEmpty();
    }

    @Test
    public void testMissingFormatConfigFails() {
        int exitCode = new CommandLine(new CMD_matrix()).execute(
            "demo", "--format-config", tempDir.resolve("absent.json").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(errContent.toString()).contains("Could not apply the output format");
    }

    @Test
    public void testDescribeCoversEveryErrorKind() {
        for (io.nosqlbench.matrix.MatrixErrorKind kind : io.nosqlbench.matrix.MatrixErrorKind.values()) {
            assertThat(CMD_matrix.describe(kind)).startsWith("Error: ");
        }
    }
}
