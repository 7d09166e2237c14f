package org.noteg.lang.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.noteg.lang.cli.commands.CompileCommand;
import org.noteg.lang.cli.commands.InterpretCommand;
import org.noteg.lang.cli.commands.ParseCommand;
import org.noteg.lang.cli.commands.TokenizeCommand;
import org.noteg.lang.compiler.CompilerOptions;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "noteg",
    mixinStandardHelpOptions = true,
    version = "noteg-lang 0.1.0",
    description = "NoteG language toolchain: tokenize, parse, interpret and compile NoteG sources",
    subcommands = {
        TokenizeCommand.class,
        ParseCommand.class,
        InterpretCommand.class,
        CompileCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    public static final int EXIT_OK = 0;
    public static final int EXIT_LANGUAGE_ERROR = 1;
    public static final int EXIT_IO_ERROR = 2;

    @Option(
        names = {"-c", "--config"},
        description = "HOCON file overriding the noteg.compiler defaults"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // No subcommand: show usage
        CommandLine.usage(this, System.out);
        return EXIT_OK;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = createCommandLine();
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates a fully configured CommandLine instance.
     * <p>
     * Use this method in tests to get the same configuration as the CLI entry point.
     *
     * @return A configured CommandLine instance.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("noteg");
        return commandLine;
    }

    /**
     * Configuration from {@code --config} (when given) layered over {@code application.conf} and
     * {@code reference.conf}.
     */
    public Config getConfig() {
        if (config == null) {
            final Config defaults = ConfigFactory.load();
            config = configFile == null
                     ? defaults
                     : ConfigFactory.parseFile(configFile).withFallback(defaults).resolve();
        }
        return config;
    }

    public CompilerOptions getCompilerOptions() {
        return CompilerOptions.fromConfig(getConfig());
    }
}
