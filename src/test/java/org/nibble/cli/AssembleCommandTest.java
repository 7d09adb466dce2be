package org.nibble.cli;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.nibble.assembler.diagnostics.AssemblerLogger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Contains unit tests for the {@link AssembleCommand}. The image sink is mocked so the
 * tests can check exactly what would be written.
 */
@Tag("unit")
@ExtendWith(MockitoExtension.class)
public class AssembleCommandTest {

    @Mock
    private ImageSink sink;

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        commandLine = new CommandLine(new AssembleCommand(sink));
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    @AfterEach
    void tearDown() {
        AssemblerLogger.setLevel(AssemblerLogger.INFO);
    }

    private Path source(String name, String text) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, text, StandardCharsets.UTF_8);
        return file;
    }

    /**
     * Verifies that a valid program is written as a 64-byte image next to the source.
     */
    @Test
    void writesImageToDerivedPath() throws Exception {
        // Arrange
        Path file = source("prog.s", "add r1, r2\n");

        // Act
        int exitCode = commandLine.execute(file.toString());

        // Assert
        assertThat(exitCode).isZero();
        ArgumentCaptor<byte[]> image = ArgumentCaptor.forClass(byte[].class);
        verify(sink).write(eq(tempDir.resolve("prog.bin")), image.capture());
        assertThat(image.getValue()).hasSize(64);
        assertThat(image.getValue()[0]).isEqualTo((byte) 0x11);
        assertThat(image.getValue()[1]).isEqualTo((byte) 0x20);
        assertThat(err.toString()).isEmpty();
    }

    @Test
    void explicitOutputPathIsUsed() throws Exception {
        Path file = source("prog.s", "nop\n");
        Path target = tempDir.resolve("out/custom.img");

        int exitCode = commandLine.execute(file.toString(), "-o", target.toString());

        assertThat(exitCode).isZero();
        verify(sink).write(eq(target), any());
    }

    /**
     * Verifies that a failing program prints the rendered diagnostic and writes nothing.
     */
    @Test
    void failureWritesNothingAndReportsDiagnostic() throws Exception {
        Path file = source("bad.s", "nop\nj nowhere\n");

        int exitCode = commandLine.execute(file.toString());

        assertThat(exitCode).isEqualTo(1);
        verify(sink, never()).write(any(), any());
        assertThat(err.toString())
                .contains("error: Label `nowhere` is undefined")
                .contains(" 2 | j nowhere")
                .contains("^^^^^^^");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void unreadableSourceIsReportedWithoutSpan() throws Exception {
        Path missing = tempDir.resolve("missing.s");

        int exitCode = commandLine.execute(missing.toString());

        assertThat(exitCode).isEqualTo(1);
        verify(sink, never()).write(any(), any());
        assertThat(err.toString()).startsWith("error: Could not read `" + missing + "`: ");
    }

    /**
     * Verifies that a source whose name already carries the output extension is not overwritten.
     */
    @Test
    void outputMatchingSourceIsRejected() throws Exception {
        Path file = source("prog.bin", "nop\n");

        int exitCode = commandLine.execute(file.toString());

        assertThat(exitCode).isEqualTo(1);
        verify(sink, never()).write(any(), any());
        assertThat(err.toString()).startsWith("error: Output file `" + file + "` is the source file");
        assertThat(Files.readString(file)).isEqualTo("nop\n");
    }

    @Test
    void sinkFailureIsReported() throws Exception {
        Path file = source("prog.s", "nop\n");
        doThrow(new IOException("disk full")).when(sink).write(any(), any());

        int exitCode = commandLine.execute(file.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Could not write").contains("disk full");
    }

    @Test
    void hexOptionPrintsDump() throws Exception {
        Path file = source("prog.s", "ldi r3, 42\n");

        int exitCode = commandLine.execute(file.toString(), "--hex");

        assertThat(exitCode).isZero();
        String[] lines = out.toString().split("\n");
        assertThat(lines).hasSize(4);
        assertThat(lines[0]).startsWith("0000: 23 2a 00 00");
        assertThat(lines[3]).startsWith("0030: ");
    }

    /**
     * Verifies the JSON summary fields printed with --json.
     */
    @Test
    void jsonOptionPrintsSummary() throws Exception {
        Path file = source("prog.s", "top: inv r2\nj top\n");

        int exitCode = commandLine.execute(file.toString(), "--json");

        assertThat(exitCode).isZero();
        JsonObject json = JsonParser.parseString(out.toString()).getAsJsonObject();
        assertThat(json.get("program").getAsString()).isEqualTo(file.toString());
        assertThat(json.get("instructionCount").getAsInt()).isEqualTo(2);
        assertThat(json.getAsJsonObject("labels").get("top").getAsInt()).isZero();
        assertThat(json.get("image").getAsString()).hasSize(128).startsWith("7200f000");
    }

    @Test
    void verboseFlagsRaiseAssemblerLogLevel() throws Exception {
        Path file = source("prog.s", "nop\n");

        int exitCode = commandLine.execute(file.toString(), "-vv");

        assertThat(exitCode).isZero();
        assertThat(AssemblerLogger.getLevel()).isEqualTo(AssemblerLogger.DEBUG);
    }
}
