package wordpiecefstcli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.IVersionProvider;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Entry point of the {@code wordpiecefst} command line.
 */
@Command(
        name = "wordpiecefst",
        mixinStandardHelpOptions = true,
        versionProvider = Main.VersionProvider.class,
        description = "\033[1;34mFST based word-piece tokenizer CLI\033[0m",
        subcommands = {
                TokenizeCommand.class,
                VocabCommand.class,
                CommandLine.HelpCommand.class
        }
)
public class Main implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        // no subcommand given
        spec.commandLine().usage(System.out);
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new Main()).execute(args));
    }

    /**
     * Reads the version from the jar manifest, {@code dev} when running from classes.
     */
    public static class VersionProvider implements IVersionProvider {
        @Override
        public String[] getVersion() {
            String version = Main.class.getPackage().getImplementationVersion();
            return new String[]{"wordpiecefst " + (version != null ? version : "dev")};
        }
    }
}
