package org.persistor.pipeline.formatting;

import org.persistor.junit.extensions.logging.LogWatchExtension;
import org.persistor.pipeline.api.contracts.Record;
import org.persistor.pipeline.api.resources.sources.MessageKind;
import org.persistor.test.utils.TestMessage;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class RecordFormatterTest {

    private final RecordFormatter formatter = new RecordFormatter();

    @Test
    void format_plainBodyWithoutMetadata() throws FormatException {
        Record record = formatter.format(TestMessage.text(MessageKind.GENERIC, 1, "hello"), false);

        assertThat(record.payload()).isEqualTo("hello");
        assertThat(record.jsonPayload()).isFalse();
        assertThat(record.hasMetadata()).isFalse();
    }

    @Test
    void format_metadataOnlyWhenRequested() throws FormatException {
        TestMessage message = new TestMessage(MessageKind.SERVICE_BUS_PUSH, 2,
            "body".getBytes(StandardCharsets.UTF_8), Map.of("tenant", "acme"));

        assertThat(formatter.format(message, false).metadata()).isEmpty();
        assertThat(formatter.format(message, true).metadata()).containsEntry("tenant", "acme");
    }

    @Test
    void format_decodesRawPropertiesOfPullKinds() throws FormatException {
        Map<byte[], byte[]> raw = new LinkedHashMap<>();
        raw.put("region".getBytes(StandardCharsets.UTF_8), "eu-west".getBytes(StandardCharsets.UTF_8));
        raw.put("retries".getBytes(StandardCharsets.UTF_8), "3".getBytes(StandardCharsets.UTF_8));
        TestMessage message = new TestMessage(MessageKind.EVENT_HUB_PULL, 3,
            "payload".getBytes(StandardCharsets.UTF_8), raw);

        Record record = formatter.format(message, true);

        assertThat(record.metadata()).containsExactly(
            Map.entry("region", "eu-west"),
            Map.entry("retries", "3"));
    }

    @Test
    void format_eventGridBodyStaysJsonAndDropsMetadata() throws FormatException {
        TestMessage message = new TestMessage(MessageKind.EVENT_GRID, 4,
            "{\"id\":\"e1\",\"data\":{\"n\":1}}".getBytes(StandardCharsets.UTF_8), Map.of("ignored", "x"));

        Record record = formatter.format(message, true);

        assertThat(record.jsonPayload()).isTrue();
        assertThat(record.payload()).isEqualTo("{\"id\":\"e1\",\"data\":{\"n\":1}}");
        assertThat(record.hasMetadata()).isFalse();
    }

    @Test
    void format_rejectsEventGridBodyThatIsNotJson() {
        TestMessage message = TestMessage.text(MessageKind.EVENT_GRID, 5, "not json {");

        assertThatThrownBy(() -> formatter.format(message, false))
            .isInstanceOf(FormatException.class)
            .hasMessageContaining("not valid JSON");
    }

    @Test
    void format_rejectsInvalidUtf8Body() {
        TestMessage message = new TestMessage(MessageKind.GENERIC, 6, new byte[]{(byte) 0xC3, (byte) 0x28}, Map.of());

        assertThatThrownBy(() -> formatter.format(message, false))
            .isInstanceOf(FormatException.class)
            .hasMessageContaining("Invalid UTF-8");
    }

    @Test
    void format_keepsMultiByteCharacters() throws FormatException {
        Record record = formatter.format(TestMessage.text(MessageKind.GENERIC, 7, "Grüße 日本"), false);

        assertThat(record.payload()).isEqualTo("Grüße 日本");
    }
}
