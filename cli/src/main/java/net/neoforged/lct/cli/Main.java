package net.neoforged.lct.cli;

import net.neoforged.lct.api.Logger;
import net.neoforged.lct.api.ProblemReporter;
import net.neoforged.lct.api.TransformContext;
import net.neoforged.lct.core.CitationException;
import net.neoforged.lct.core.CitationPipeline;
import net.neoforged.lct.core.bibliography.Bibliography;
import net.neoforged.lct.core.journal.JournalAbbreviations;
import net.neoforged.lct.core.render.RenderOptions;
import org.jetbrains.annotations.VisibleForTesting;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "lct", mixinStandardHelpOptions = true, usageHelpWidth = 100,
        subcommands = NewUserJournalsCommand.class,
        description = "Formats the legal citations of a pandoc markdown document from a CSL JSON library.")
public class Main implements Callable<Integer> {
    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    // Not required at the parser level, so that subcommands can be run without them
    @CommandLine.Parameters(index = "0", arity = "0..1", paramLabel = "INPUT", description = "The pandoc markdown file to process.")
    Path inputPath;

    @CommandLine.Parameters(index = "1", arity = "0..1", paramLabel = "LIBRARY", description = "The reference library in CSL JSON format.")
    Path libraryPath;

    @CommandLine.Parameters(index = "2", arity = "0..1", paramLabel = "OUTPUT", description = "Where to write the result. Without it, the result is printed.")
    Path outputPath;

    @CommandLine.Option(names = {"-f", "--offset"}, paramLabel = "NUMBER", description = "Number of footnotes that come before this document.")
    int offset = 0;

    @CommandLine.Option(names = {"-u", "--user-journals"}, paramLabel = "FILE", description = "A JSON file of your own journal abbreviations. Create one with new-user-journals.")
    Path userJournals;

    @CommandLine.Option(names = {"-s", "--smallcaps"}, description = "Apply the Word style \"True Small Caps\" to all bold text.")
    boolean smallCaps;

    @CommandLine.Option(names = {"-W", "--force-overwrite"}, description = "Allow OUTPUT to be the same file as INPUT.")
    boolean forceOverwrite;

    @CommandLine.Option(names = "--case-lookback", paramLabel = "FOOTNOTES", description = "How many footnotes back a case may be cited in short form. Defaults to ${DEFAULT-VALUE}.")
    int caseLookback = RenderOptions.DEFAULT_CASE_LOOKBACK;

    @CommandLine.Option(names = "--problems-report", paramLabel = "FILE", description = "Write all problems found to this file as JSON.")
    Path problemsReport;

    @CommandLine.Option(names = "--debug", description = "Print additional debugging information")
    boolean debug = false;

    public static void main(String[] args) {
        System.exit(innerMain(args));
    }

    @VisibleForTesting
    public static int innerMain(String... args) {
        var commandLine = new CommandLine(new Main());
        return commandLine.execute(args);
    }

    @Override
    public Integer call() throws Exception {
        if (inputPath == null || libraryPath == null) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Missing required parameters: INPUT, LIBRARY");
        }
        if (offset < 0) {
            throw new CommandLine.ParameterException(spec.commandLine(), "The offset must not be negative: " + offset);
        }
        if (caseLookback < 0) {
            throw new CommandLine.ParameterException(spec.commandLine(), "The case lookback must not be negative: " + caseLookback);
        }

        // Debug output must not end up in the document when it is printed
        var debugOut = outputPath == null ? System.err : System.out;
        var logger = debug ? new Logger(debugOut, System.err) : new Logger(null, System.err);

        if (outputPath != null && !forceOverwrite && isSameFile(inputPath, outputPath)) {
            logger.error("The input file %s and the output file %s are the same, but -W/--force-overwrite was not given", inputPath, outputPath);
            return 1;
        }

        var problemReporter = problemsReport != null ? new FileProblemReporter(logger, problemsReport) : null;
        try {
            var context = new TransformContext(logger, problemReporter != null ? problemReporter : ProblemReporter.NOOP, inputPath);
            return run(context);
        } finally {
            if (problemReporter != null) {
                problemReporter.close();
            }
        }
    }

    private int run(TransformContext context) throws IOException {
        var logger = context.logger();

        logger.debug("Loading %s", inputPath);
        var markdown = Files.readString(inputPath, StandardCharsets.UTF_8);

        String output;
        try {
            logger.debug("Loading %s", libraryPath);
            var bibliography = Bibliography.loadJson(libraryPath, context);
            var journals = userJournals != null ? JournalAbbreviations.load(userJournals) : JournalAbbreviations.empty();
            var options = new RenderOptions(offset, smallCaps, caseLookback);
            output = new CitationPipeline(context).renderDocument(markdown, bibliography, journals, options);
        } catch (CitationException e) {
            logger.error("Processing %s failed: %s", inputPath, e.getMessage());
            return 1;
        }

        if (outputPath != null) {
            logger.debug("Writing %s", outputPath);
            Files.writeString(outputPath, output, StandardCharsets.UTF_8);
        } else {
            System.out.println(output);
        }
        return 0;
    }

    private static boolean isSameFile(Path input, Path output) throws IOException {
        if (Files.exists(output)) {
            return Files.isSameFile(input, output);
        }
        return input.toAbsolutePath().normalize().equals(output.toAbsolutePath().normalize());
    }
}
