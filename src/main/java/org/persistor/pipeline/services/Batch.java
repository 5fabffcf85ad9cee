package org.persistor.pipeline.services;

import org.persistor.pipeline.api.contracts.Record;
import org.persistor.pipeline.api.resources.sources.SourceMessage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Records accumulated by one pull task plus every source message that contributed to them.
 * <p>
 * A message whose record could not be formatted stays in the batch without a record, so it is
 * settled together with the batch. Owned by a single task; not thread-safe.
 */
final class Batch {

    private final List<Record> records = new ArrayList<>();
    private final List<SourceMessage> messages = new ArrayList<>();

    void add(SourceMessage message, Record record) {
        messages.add(message);
        records.add(record);
    }

    void addSkipped(SourceMessage message) {
        messages.add(message);
    }

    boolean isEmpty() {
        return messages.isEmpty();
    }

    int recordCount() {
        return records.size();
    }

    int messageCount() {
        return messages.size();
    }

    List<Record> records() {
        return Collections.unmodifiableList(records);
    }

    List<SourceMessage> messages() {
        return Collections.unmodifiableList(messages);
    }

    SourceMessage last() {
        return messages.get(messages.size() - 1);
    }

    void clear() {
        records.clear();
        messages.clear();
    }
}
