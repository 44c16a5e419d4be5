package net.neoforged.lct.cli;

import net.neoforged.lct.api.Logger;
import net.neoforged.lct.core.journal.JournalAbbreviations;
import picocli.CommandLine;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "new-user-journals", mixinStandardHelpOptions = true,
        description = "Write a blank user-journals file to fill in with your own journal abbreviations.")
class NewUserJournalsCommand implements Callable<Integer> {
    static final String DEFAULT_FILE_NAME = "blank-user-journals.json";

    @CommandLine.Parameters(index = "0", arity = "0..1", paramLabel = "FILE", description = "Where to write the file. Defaults to " + DEFAULT_FILE_NAME + ".")
    Path file = Paths.get(DEFAULT_FILE_NAME);

    @Override
    public Integer call() throws Exception {
        var logger = new Logger(System.out, System.err);
        if (Files.exists(file)) {
            logger.error("%s already exists; not overwriting it", file);
            return 1;
        }

        Files.writeString(file, JournalAbbreviations.blankTemplate(), StandardCharsets.UTF_8);
        logger.debug("Created %s", file);
        return 0;
    }
}
