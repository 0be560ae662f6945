package org.pathwise.cli.commands;

import org.pathwise.cli.CommandLineInterface;
import org.pathwise.compiler.frontend.io.SourceLoader;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Smoke tests for the resolve command.
 */
@Tag("unit")
public class ResolveCommandTest {

    @TempDir
    Path tempDir;

    private Path writeFixture() throws IOException {
        for (String name : new String[] {"main.sw", "contract_a_types.sw", "another_lib.sw"}) {
            Files.writeString(tempDir.resolve(name), SourceLoader.loadClasspath("fixtures/" + name).content());
        }
        return tempDir.resolve("main.sw");
    }

    @Test
    void testCommandParses() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();

        assertThat(cmdLine.getSubcommands()).containsKey("resolve");
    }

    @Test
    void testHelpOutput() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();

        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
        cmdLine.execute("resolve", "--help");

        String output = out.toString() + err.toString();
        assertThat(output).contains("resolve");
        assertThat(output).contains("--file");
        assertThat(output).contains("--json");
    }

    @Test
    void testResolveFixtureAsText() throws Exception {
        Path root = writeFixture();
        CommandLine cmdLine = CommandLineInterface.createCommandLine();

        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));

        int exitCode = cmdLine.execute("resolve", "-f", root.toString());

        assertThat(exitCode)
            .describedAs("Exit code should be 0. stderr: %s, stdout: %s", err.toString(), out.toString())
            .isEqualTo(ResolveCommand.EXIT_OK);
        assertThat(out.toString())
            .contains("Modules (3):")
            .contains("References (5):")
            .contains("-> struct crate::contract_a_types::VeryCommonNameStruct")
            .contains("-> struct crate::another_lib::VeryCommonNameStruct")
            .contains("5/5 reference(s) resolved, 0 error(s), 0 warning(s)")
            .doesNotContain("Diagnostics");
    }

    @Test
    void testResolveFixtureAsJson() throws Exception {
        Path root = writeFixture();
        CommandLine cmdLine = CommandLineInterface.createCommandLine();

        StringWriter out = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));

        int exitCode = cmdLine.execute("resolve", "-f", root.toString(), "--json", "-p", "2");

        assertThat(exitCode).isEqualTo(ResolveCommand.EXIT_OK);
        assertThat(out.toString())
            .contains("\"declaration\": \"crate::another_lib::VeryCommonNameStruct\"")
            .contains("\"kind\": \"abi\"")
            .contains("\"resolved\": 5");
    }

    @Test
    void testZeroParallelismUsesAllProcessors() throws Exception {
        Path root = writeFixture();
        CommandLine cmdLine = CommandLineInterface.createCommandLine();

        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));

        int exitCode = cmdLine.execute("resolve", "-f", root.toString(), "--parallelism", "0");

        assertThat(exitCode)
            .describedAs("stderr: %s", err.toString())
            .isEqualTo(ResolveCommand.EXIT_OK);
        assertThat(out.toString()).contains("5/5 reference(s) resolved");
    }

    @Test
    void testUnresolvedPathReturnsErrorExitCode() throws Exception {
        Path root = tempDir.resolve("main.sw");
        Files.writeString(root, """
            contract;

            struct Order {
                item: missing::Item,
            }
            """);
        CommandLine cmdLine = CommandLineInterface.createCommandLine();

        StringWriter out = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));

        int exitCode = cmdLine.execute("resolve", "-f", root.toString());

        assertThat(exitCode).isEqualTo(ResolveCommand.EXIT_ERRORS);
        assertThat(out.toString())
            .contains("error[UNKNOWN_MODULE]")
            .contains("Diagnostics (1):");
    }

    @Test
    void testResolveNonexistentFileReturnsError() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();

        StringWriter err = new StringWriter();
        cmdLine.setErr(new PrintWriter(err));

        int exitCode = cmdLine.execute("resolve", "-f", tempDir.resolve("nonexistent.sw").toString());

        assertThat(exitCode).isEqualTo(ResolveCommand.EXIT_UNREADABLE);
        assertThat(err.toString()).contains("cannot read root source file");
    }

    @Test
    void testMissingRequiredFileOption() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();

        StringWriter err = new StringWriter();
        cmdLine.setErr(new PrintWriter(err));

        int exitCode = cmdLine.execute("resolve");

        assertThat(exitCode).isNotEqualTo(0);
        assertThat(err.toString()).contains("--file");
    }
}
