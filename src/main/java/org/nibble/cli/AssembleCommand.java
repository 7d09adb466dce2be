package org.nibble.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.nibble.assembler.Assembler;
import org.nibble.assembler.api.AssemblyException;
import org.nibble.assembler.api.ProgramImage;
import org.nibble.assembler.diagnostics.AssemblerLogger;
import org.nibble.assembler.diagnostics.DiagnosticFactory;
import org.nibble.assembler.util.HexDump;
import org.nibble.cli.config.AssemblerSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "assemble",
        mixinStandardHelpOptions = true,
        description = "Assembles a source file into a 64-byte instruction memory image.")
public class AssembleCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AssembleCommand.class);
    private static final String ASSEMBLER_LOGGER_NAME = "org.nibble.assembler";

    @ParentCommand
    private CommandLineInterface parent;

    @Parameters(index = "0", description = "The assembly source file.")
    private Path source;

    @Option(names = {"-o", "--output"}, description = "Output image file (default: source name with the configured extension).")
    private Path output;

    @Option(names = "--hex", description = "Print a hex dump of the image to stdout.")
    private boolean hex;

    @Option(names = "--json", description = "Print a JSON summary of the image to stdout.")
    private boolean json;

    @Option(names = {"-v", "--verbose"}, description = "Increase assembler log verbosity (-v info, -vv debug, -vvv trace).")
    private boolean[] verbose = new boolean[0];

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private final ImageSink sink;

    public AssembleCommand() {
        this(new FileImageSink());
    }

    /**
     * @param sink Where successfully assembled images are written.
     */
    public AssembleCommand(ImageSink sink) {
        this.sink = sink;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        AssemblerSettings settings = AssemblerSettings.from(getConfig());

        String text;
        try {
            text = Files.readString(source, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.debug("Failed to read {}", source, e);
            err.println(DiagnosticFactory.ioError(source.toString(), describe(e)).headline());
            err.flush();
            return 1;
        }

        Assembler assembler = new Assembler(settings.tabWidth());
        if (verbose.length > 0) {
            int level = AssemblerLogger.WARN + verbose.length;
            assembler.setVerbosity(level);
            raiseAssemblerLogLevel(level);
        }

        ProgramImage image;
        try {
            image = assembler.assemble(text, source.toString());
        } catch (AssemblyException e) {
            err.println(e.rendered());
            err.flush();
            return 1;
        }

        Path target = output != null ? output : OutputPaths.derive(source, settings.outputExtension());
        if (target.toAbsolutePath().normalize().equals(source.toAbsolutePath().normalize())) {
            err.println("error: Output file `" + target + "` is the source file; use -o to choose another path");
            err.flush();
            return 1;
        }
        byte[] bytes = image.image();
        try {
            sink.write(target, bytes);
        } catch (IOException e) {
            log.error("Failed to write image to {}: {}", target, describe(e));
            err.println("error: Could not write `" + target + "`: " + describe(e));
            err.flush();
            return 1;
        }
        log.info("Wrote {} bytes ({} instructions) to {}", bytes.length, image.instructionCount(), target);

        if (hex || settings.hexDump()) {
            out.print(HexDump.format(bytes, settings.hexDumpBytesPerLine()));
        }
        if (json) {
            Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
            out.println(gson.toJson(new ImageSummary(image, target)));
        }
        out.flush();
        return 0;
    }

    private Config getConfig() {
        return parent != null ? parent.getConfig() : ConfigFactory.load();
    }

    private static String describe(IOException e) {
        String message = e.getMessage();
        return message == null ? e.getClass().getSimpleName() : e.getClass().getSimpleName() + ": " + message;
    }

    private static void raiseAssemblerLogLevel(int verbosity) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        Level level = switch (verbosity) {
            case AssemblerLogger.INFO -> Level.INFO;
            case AssemblerLogger.DEBUG -> Level.DEBUG;
            default -> Level.TRACE;
        };
        context.getLogger(ASSEMBLER_LOGGER_NAME).setLevel(level);
    }

    /** JSON view of an assembled image. */
    static final class ImageSummary {
        final String program;
        final String output;
        final int instructionCount;
        final Map<String, Integer> labels;
        final String image;

        ImageSummary(ProgramImage image, Path output) {
            this.program = image.programName();
            this.output = output.toString();
            this.instructionCount = image.instructionCount();
            this.labels = image.labelOffsets();
            this.image = HexDump.toHexString(image.image());
        }
    }
}
