package org.persistor.pipeline.cli.commands;

import org.persistor.pipeline.cli.CommandLineInterface;
import org.persistor.pipeline.config.PersistorConfigurationException;
import org.persistor.pipeline.config.PersistorSettings;
import org.persistor.pipeline.config.PullRequestParameters;
import org.persistor.pipeline.resources.sources.InMemoryMessageSource;
import org.persistor.pipeline.resources.storage.FileSystemBlobStore;
import org.persistor.pipeline.services.PullOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Feeds newline-delimited messages from a file into an in-memory source and runs a pull
 * against the configured blob store. Prints the number of stored records.
 */
@Command(name = "pull", description = "Pulls messages from a file-backed source into blob storage")
public class PullCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(PullCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = {"-i", "--input"}, required = true, description = "File with one message body per line")
    private File inputFile;

    @Option(names = {"-n", "--tasks"}, description = "Number of concurrent pull tasks (default: 1)")
    private String tasks;

    @Option(names = {"-b", "--batch-size"}, description = "Messages per stored batch (default: 200)")
    private String batchSize;

    @Option(names = {"-d", "--duration"}, description = "Receive duration in seconds, decimals allowed")
    private String duration;

    @Option(names = "--append", description = "Append batches to a shared blob instead of one blob per batch")
    private boolean append;

    @Option(names = "--timed-append", description = "Append to a blob that rotates every minute")
    private boolean timedAppend;

    @Option(names = "--metadata", description = "Store message metadata next to the payload")
    private boolean metadata;

    @Override
    public Integer call() {
        try {
            PersistorSettings settings = applyFlags(parent.getSettings());
            PullRequestParameters parameters = PullRequestParameters.parse(requestParameters(), settings.prefetch());

            InMemoryMessageSource source = new InMemoryMessageSource("file-source", settings.source());
            List<String> lines = Files.readAllLines(inputFile.toPath(), StandardCharsets.UTF_8);
            int offered = source.offerAll(lines);
            log.info("Loaded {} messages from {}", offered, inputFile.getAbsolutePath());

            FileSystemBlobStore store = new FileSystemBlobStore("blob-store", settings.storage());
            PullOrchestrator orchestrator = new PullOrchestrator(source, store, settings);
            System.out.println(orchestrator.handle(parameters));
            return 0;
        } catch (IOException e) {
            log.error("Failed to read input file {}: {}", inputFile.getAbsolutePath(), e.getMessage());
            return 1;
        } catch (PersistorConfigurationException | IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Pull interrupted");
            return 1;
        } catch (RuntimeException e) {
            log.error("Pull failed: {}", e.getMessage());
            log.debug("Pull failure", e);
            return 1;
        }
    }

    private PersistorSettings applyFlags(PersistorSettings settings) {
        PersistorSettings result = settings;
        if (append || timedAppend) {
            result = result.withAppend(append || settings.append(), timedAppend || settings.timedAppend());
        }
        if (metadata) {
            result = result.withMetadata(true);
        }
        return result;
    }

    private Map<String, String> requestParameters() {
        Map<String, String> params = new HashMap<>();
        if (tasks != null) {
            params.put(PullRequestParameters.TASK_COUNT, tasks);
        }
        if (batchSize != null) {
            params.put(PullRequestParameters.BATCH_STORE_SIZE, batchSize);
        }
        if (duration != null) {
            params.put(PullRequestParameters.RECEIVE_DURATION, duration);
        }
        return params;
    }
}
