package org.persistor.pipeline.cli.commands;

import org.persistor.pipeline.api.resources.sources.IMessageReceiver;
import org.persistor.pipeline.api.resources.sources.SourceMessage;
import org.persistor.pipeline.api.resources.storage.StoreFailureException;
import org.persistor.pipeline.cli.CommandLineInterface;
import org.persistor.pipeline.config.BindingConfigurationException;
import org.persistor.pipeline.config.PersistorConfigurationException;
import org.persistor.pipeline.config.PersistorSettings;
import org.persistor.pipeline.resources.sources.InMemoryMessageSource;
import org.persistor.pipeline.resources.storage.FileSystemBlobStore;
import org.persistor.pipeline.services.IOutputSlot;
import org.persistor.pipeline.services.PushPersistor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

/**
 * Stores the lines of a file as one pushed delivery. With {@code --output} the serialized
 * records go to that file, acting as the host's output binding.
 */
@Command(name = "push", description = "Stores a file of messages as one pushed delivery")
public class PushCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(PushCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = {"-i", "--input"}, required = true, description = "File with one message body per line")
    private File inputFile;

    @Option(names = {"-o", "--output"}, description = "Output binding target; enables the output binding")
    private File outputFile;

    @Option(names = "--metadata", description = "Store message metadata next to the payload")
    private boolean metadata;

    @Override
    public Integer call() {
        try {
            PersistorSettings settings = parent.getSettings();
            if (metadata) {
                settings = settings.withMetadata(true);
            }
            if (outputFile != null) {
                settings = settings.withOutputBinding(true);
            } else if (settings.outputBinding()) {
                throw new BindingConfigurationException("Output binding is enabled but no --output file was given");
            }

            List<SourceMessage> messages = readMessages(settings);
            PushPersistor persistor = new PushPersistor(new FileSystemBlobStore("blob-store", settings.storage()), settings);
            IOutputSlot slot = outputFile == null ? null : value -> {
                try {
                    Files.writeString(outputFile.toPath(), value, StandardCharsets.UTF_8);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            };
            System.out.println(persistor.persist(messages, slot));
            return 0;
        } catch (IOException | UncheckedIOException e) {
            log.error("Failed to read input or write output: {}", e.getMessage());
            return 1;
        } catch (PersistorConfigurationException | IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return 1;
        } catch (StoreFailureException e) {
            log.error("Push failed: {}", e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Push interrupted");
            return 1;
        }
    }

    /**
     * Runs the lines through an in-memory source so pushed messages carry the configured kind.
     */
    private List<SourceMessage> readMessages(PersistorSettings settings) throws IOException, InterruptedException {
        List<String> lines = Files.readAllLines(inputFile.toPath(), StandardCharsets.UTF_8);
        InMemoryMessageSource source = new InMemoryMessageSource("push-input", settings.source());
        source.offerAll(lines);
        if (lines.isEmpty()) {
            return List.of();
        }
        IMessageReceiver receiver = source.openReceiver();
        try {
            return receiver.fetchBatch(lines.size(), 1, TimeUnit.SECONDS);
        } finally {
            receiver.close();
        }
    }
}
