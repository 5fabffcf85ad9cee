package org.persistor.pipeline.services;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.persistor.junit.extensions.logging.AllowLog;
import org.persistor.junit.extensions.logging.ExpectLog;
import org.persistor.junit.extensions.logging.LogLevel;
import org.persistor.junit.extensions.logging.LogWatchExtension;
import org.persistor.pipeline.api.resources.sources.IMessageReceiver;
import org.persistor.pipeline.api.resources.sources.IMessageSource;
import org.persistor.pipeline.api.resources.sources.MessageKind;
import org.persistor.pipeline.api.resources.sources.SourceMessage;
import org.persistor.pipeline.api.resources.storage.IBlobStore;
import org.persistor.pipeline.api.resources.storage.StorageTargetException;
import org.persistor.pipeline.config.PersistorSettings;
import org.persistor.pipeline.formatting.RecordFormatter;
import org.persistor.pipeline.formatting.RecordSerializer;
import org.persistor.pipeline.resources.sources.InMemoryMessageSource;
import org.persistor.pipeline.resources.storage.FileSystemBlobStore;
import org.persistor.pipeline.services.PullTaskResult.Outcome;
import org.persistor.pipeline.storage.AppendTargetRotator;
import org.persistor.pipeline.storage.BatchStoreWriter;
import org.persistor.pipeline.storage.DestinationNamer;
import org.persistor.test.utils.BlobFiles;
import org.persistor.test.utils.TestMessage;
import org.persistor.test.utils.TestSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class PullTaskTest {

    @TempDir
    Path tempDir;

    private PersistorSettings settings;
    private InMemoryMessageSource source;
    private FileSystemBlobStore store;
    private DestinationNamer namer;
    private ReceiveContext context;
    private ProcessedCounter counter;

    @BeforeEach
    void setUp() {
        settings = TestSettings.settings(tempDir);
        source = new InMemoryMessageSource("test-source", settings.source());
        store = new FileSystemBlobStore("test-store", settings.storage());
        namer = new DestinationNamer(Clock.systemUTC());
        context = new ReceiveContext();
        counter = new ProcessedCounter();
    }

    private PullTask task(int batchSize) {
        return task(settings, store, null, new RecordFormatter(), batchSize);
    }

    private PullTask task(PersistorSettings taskSettings, IBlobStore taskStore, AppendTargetRotator rotator,
                          RecordFormatter formatter, int batchSize) {
        BatchStoreWriter writer = new BatchStoreWriter(taskStore, namer, taskSettings.storeKey(), taskSettings.writer());
        return new PullTask(0, source, formatter, new RecordSerializer(), writer, rotator,
            taskSettings, batchSize, context, counter);
    }

    private static List<String> bodies(int count) {
        return IntStream.range(0, count).mapToObj(i -> "m" + i).collect(Collectors.toList());
    }

    @Test
    void call_storesAllMessagesInFullBatchesPlusRemainder() throws IOException {
        source.offerAll(bodies(25));

        PullTaskResult result = task(10).call();

        assertThat(result.outcome()).isEqualTo(Outcome.COMPLETED);
        assertThat(result.batchesFlushed()).isEqualTo(3);
        assertThat(result.recordsStored()).isEqualTo(25);
        assertThat(result.messagesAcknowledged()).isEqualTo(25);
        assertThat(counter.get()).isEqualTo(25);
        assertThat(BlobFiles.findBlobs(tempDir)).hasSize(3);
        assertThat(BlobFiles.readAllLines(tempDir)).hasSize(25);
        assertThat(source.getCheckpoint()).isEqualTo(24);
        assertThat(source.pendingCount()).isZero();
        assertThat(source.openReceiverCount()).isZero();
    }

    @Test
    void call_remainderGoesToItsOwnBlob() throws IOException {
        source.offerAll(List.of("a", "b", "c"));

        PullTaskResult result = task(2).call();

        Set<String> contents = new HashSet<>();
        for (Path blob : BlobFiles.findBlobs(tempDir)) {
            contents.add(Files.readString(blob, StandardCharsets.UTF_8));
        }
        assertThat(contents).containsExactlyInAnyOrder(
            "{\"DATA\":\"a\"}\n{\"DATA\":\"b\"}",
            "{\"DATA\":\"c\"}");
        assertThat(result.recordsStored()).isEqualTo(3);
        assertThat(counter.get()).isEqualTo(3);
    }

    @Test
    void call_emptyStreamStoresNothing() throws IOException {
        PullTaskResult result = task(10).call();

        assertThat(result.outcome()).isEqualTo(Outcome.COMPLETED);
        assertThat(result.batchesFlushed()).isZero();
        assertThat(BlobFiles.findBlobs(tempDir)).isEmpty();
        assertThat(source.getCheckpoint()).isEqualTo(-1);
    }

    @Test
    @AllowLog(level = LogLevel.WARN, loggerPattern = ".*BatchStoreWriter", messagePattern = ".*retrying.*")
    @ExpectLog(level = LogLevel.ERROR, loggerPattern = ".*BatchStoreWriter", messagePattern = ".*after 3 attempts.*")
    void call_storeFailureStopsWithoutCheckpointingTheFailedBatch() throws IOException {
        IBlobStore failingStore = mock(IBlobStore.class);
        doNothing().doNothing().doThrow(new IOException("store down"))
            .when(failingStore).writeWhole(anyString(), any());
        source.offerAll(bodies(50));

        PullTaskResult result = task(settings, failingStore, null, new RecordFormatter(), 10).call();

        assertThat(result.outcome()).isEqualTo(Outcome.STORE_FAILED);
        assertThat(result.detail()).contains("could not be stored");
        assertThat(result.recordsStored()).isEqualTo(20);
        assertThat(result.messagesAcknowledged()).isEqualTo(20);
        assertThat(result.messagesAbandoned()).isEqualTo(10);
        assertThat(source.getCheckpoint()).isEqualTo(19);
        assertThat(source.pendingCount()).isEqualTo(30);
        assertThat(counter.get()).isEqualTo(20);
        verify(failingStore, times(5)).writeWhole(anyString(), any());
    }

    @Test
    void call_cancellationStoresIncorporatedAndAbandonsTheRest() throws Exception {
        RecordFormatter formatter = spy(new RecordFormatter());
        AtomicInteger formatted = new AtomicInteger();
        doAnswer(invocation -> {
            if (formatted.incrementAndGet() == 37) {
                context.cancel();
            }
            return invocation.callRealMethod();
        }).when(formatter).format(any(), anyBoolean());
        source.offerAll(bodies(50));

        PullTaskResult result = task(settings, store, null, formatter, 10).call();

        assertThat(result.outcome()).isEqualTo(Outcome.CANCELLED);
        assertThat(result.recordsStored()).isEqualTo(37);
        assertThat(result.messagesAbandoned()).isEqualTo(3);
        assertThat(BlobFiles.readAllLines(tempDir)).hasSize(37);
        assertThat(source.getCheckpoint()).isEqualTo(36);
        assertThat(source.pendingCount()).isEqualTo(13);
        assertThat(counter.get()).isEqualTo(37);
    }

    @Test
    void call_fetchesNoMoreThanTheOpenBatchTakes() throws Exception {
        IMessageSource mockSource = mock(IMessageSource.class);
        IMessageReceiver receiver = mock(IMessageReceiver.class);
        when(mockSource.openReceiver()).thenReturn(receiver);
        when(receiver.fetchBatch(anyInt(), anyLong(), any(TimeUnit.class))).thenReturn(
            List.of(TestMessage.text(MessageKind.EVENT_HUB_PULL, 0, "m0"), TestMessage.text(MessageKind.EVENT_HUB_PULL, 1, "m1"),
                TestMessage.text(MessageKind.EVENT_HUB_PULL, 2, "m2")),
            List.of());
        PersistorSettings largePrefetch = TestSettings.settings(tempDir, "persistor.pull.prefetch = 512");
        BatchStoreWriter writer = new BatchStoreWriter(store, namer, largePrefetch.storeKey(), largePrefetch.writer());

        new PullTask(0, mockSource, new RecordFormatter(), new RecordSerializer(), writer,
            null, largePrefetch, 10, context, counter).call();

        ArgumentCaptor<Integer> sizes = ArgumentCaptor.forClass(Integer.class);
        verify(receiver, times(2)).fetchBatch(sizes.capture(), anyLong(), any(TimeUnit.class));
        assertThat(sizes.getAllValues()).containsExactly(10, 7);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Task 0: skipping message 1: .*")
    void call_skipsUndecodableMessagesButStillSettlesThem() throws IOException {
        source.offer("first");
        source.offer(new byte[]{(byte) 0xC3, (byte) 0x28}, Map.of());
        source.offer("third");

        PullTaskResult result = task(10).call();

        assertThat(result.recordsStored()).isEqualTo(2);
        assertThat(result.messagesAcknowledged()).isEqualTo(3);
        assertThat(source.getCheckpoint()).isEqualTo(2);
        assertThat(BlobFiles.readAllLines(tempDir)).containsExactly("{\"DATA\":\"first\"}", "{\"DATA\":\"third\"}");
    }

    @Test
    void call_appendModeWritesIntoTheResolvedTarget() throws IOException {
        PersistorSettings appendSettings = settings.withAppend(true, false);
        AppendTargetRotator rotator = new AppendTargetRotator(store, namer);
        rotator.resolvePath(appendSettings.storeKey(), false);
        source.offerAll(bodies(7));

        PullTaskResult result = task(appendSettings, store, rotator, new RecordFormatter(), 3).call();

        assertThat(result.batchesFlushed()).isEqualTo(3);
        List<Path> blobs = BlobFiles.findBlobs(tempDir);
        assertThat(blobs).hasSize(1);
        assertThat(Files.readAllLines(blobs.get(0))).hasSize(7).first().isEqualTo("{\"DATA\":\"m0\"}");
    }

    @Test
    void constructor_appendModeRequiresRotator() {
        PersistorSettings appendSettings = settings.withAppend(true, false);

        assertThatThrownBy(() -> task(appendSettings, store, null, new RecordFormatter(), 10))
            .isInstanceOf(StorageTargetException.class);
    }

    @Test
    void call_appendModeWithoutResolvedTargetFails() {
        PersistorSettings appendSettings = settings.withAppend(true, false);
        PullTask task = task(appendSettings, store, new AppendTargetRotator(store, namer), new RecordFormatter(), 10);

        assertThatThrownBy(task::call).isInstanceOf(StorageTargetException.class);
    }

    @Test
    void call_checkpointsAtTheConfiguredCadenceAndOnExit() throws Exception {
        IMessageSource mockSource = mock(IMessageSource.class);
        IMessageReceiver receiver = mock(IMessageReceiver.class);
        when(mockSource.openReceiver()).thenReturn(receiver);
        List<SourceMessage> messages = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            messages.add(TestMessage.text(MessageKind.EVENT_HUB_PULL, i, "m" + i));
        }
        when(receiver.fetchBatch(anyInt(), anyLong(), any(TimeUnit.class))).thenReturn(messages, List.of());

        PersistorSettings cadence = settings.withCheckpointUpdateRate(25);
        BatchStoreWriter writer = new BatchStoreWriter(store, namer, cadence.storeKey(), cadence.writer());
        PullTaskResult result = new PullTask(0, mockSource, new RecordFormatter(), new RecordSerializer(), writer,
            null, cadence, 10, context, counter).call();

        ArgumentCaptor<SourceMessage> checkpoints = ArgumentCaptor.forClass(SourceMessage.class);
        verify(receiver, times(2)).advanceCheckpoint(checkpoints.capture());
        assertThat(checkpoints.getAllValues()).extracting(SourceMessage::position).containsExactly(29L, 49L);
        assertThat(result.recordsStored()).isEqualTo(50);
        verify(receiver).close();
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Task 0: error occurred with receiver, stopping: link detached")
    void call_receiverFaultStopsWithoutFlushing() throws Exception {
        IMessageSource mockSource = mock(IMessageSource.class);
        IMessageReceiver receiver = mock(IMessageReceiver.class);
        when(mockSource.openReceiver()).thenReturn(receiver);
        List<SourceMessage> messages = List.of(
            TestMessage.text(MessageKind.EVENT_HUB_PULL, 0, "a"),
            TestMessage.text(MessageKind.EVENT_HUB_PULL, 1, "b"));
        when(receiver.fetchBatch(anyInt(), anyLong(), any(TimeUnit.class)))
            .thenReturn(messages)
            .thenThrow(new IOException("link detached"));

        BatchStoreWriter writer = new BatchStoreWriter(store, namer, settings.storeKey(), settings.writer());
        PullTaskResult result = new PullTask(0, mockSource, new RecordFormatter(), new RecordSerializer(), writer,
            null, settings, 10, context, counter).call();

        assertThat(result.outcome()).isEqualTo(Outcome.RECEIVER_FAULT);
        assertThat(result.recordsStored()).isZero();
        assertThat(BlobFiles.findBlobs(tempDir)).isEmpty();
        verify(receiver, never()).advanceCheckpoint(any());
        verify(receiver).close();
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Task 0: failed to open receiver.*")
    void call_openFailureIsAReceiverFault() throws Exception {
        IMessageSource mockSource = mock(IMessageSource.class);
        when(mockSource.getResourceName()).thenReturn("broken-source");
        when(mockSource.openReceiver()).thenThrow(new IOException("unauthorized"));

        BatchStoreWriter writer = new BatchStoreWriter(store, namer, settings.storeKey(), settings.writer());
        PullTaskResult result = new PullTask(0, mockSource, new RecordFormatter(), new RecordSerializer(), writer,
            null, settings, 10, context, counter).call();

        assertThat(result.outcome()).isEqualTo(Outcome.RECEIVER_FAULT);
        assertThat(result.detail()).isEqualTo("unauthorized");
    }

    @Test
    void call_documentsAreStoredAsValidJsonLines() throws IOException {
        source.offerAll(List.of("plain", "with \"quotes\""));

        task(10).call();

        ObjectMapper mapper = new ObjectMapper();
        for (String line : BlobFiles.readAllLines(tempDir)) {
            assertThat(mapper.readTree(line).has("DATA")).isTrue();
        }
    }
}
