package org.persistor.pipeline.cli;

import com.typesafe.config.Config;
import org.persistor.pipeline.cli.commands.PullCommand;
import org.persistor.pipeline.cli.commands.PushCommand;
import org.persistor.pipeline.config.ConfigLoader;
import org.persistor.pipeline.config.PersistorConfigurationException;
import org.persistor.pipeline.config.PersistorSettings;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "persistor",
    mixinStandardHelpOptions = true,
    version = "Blob Persistor 1.0",
    description = "Persists queue and event stream messages to blob storage",
    subcommands = {
        PullCommand.class,
        PushCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("persistor");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the layered configuration once: environment, system properties, the given or
     * working directory file, then the classpath defaults.
     *
     * @throws PersistorConfigurationException if the file given via {@code --config} does not exist
     */
    public Config getConfig() {
        if (config == null) {
            if (configFile != null && !configFile.isFile()) {
                throw new PersistorConfigurationException(
                    "Configuration file specified via --config was not found: " + configFile.getAbsolutePath());
            }
            config = configFile != null ? ConfigLoader.load(configFile) : ConfigLoader.load();
        }
        return config;
    }

    public PersistorSettings getSettings() {
        return PersistorSettings.from(getConfig());
    }
}
