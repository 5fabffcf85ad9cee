package org.persistor.pipeline.storage;

import org.persistor.junit.extensions.logging.LogWatchExtension;
import org.persistor.pipeline.api.resources.storage.StoragePath;
import org.persistor.test.utils.MutableClock;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class DestinationNamerTest {

    private final MutableClock clock = new MutableClock(LocalDateTime.of(2024, 3, 7, 14, 5, 30));
    private final DestinationNamer namer = new DestinationNamer(clock);

    @Test
    void timedPath_usesUnpaddedDateAndBucket() {
        StoragePath path = namer.timedPath("orders", namer.now());

        assertThat(path.asString()).isEqualTo("orders/2024/3/7/14-5.txt");
    }

    @Test
    void uniquePath_isFreshPerCall() {
        StoragePath first = namer.uniquePath("orders");
        StoragePath second = namer.uniquePath("orders");

        assertThat(first).isNotEqualTo(second);
        assertThat(first.asString()).startsWith("orders/2024/3/7/").endsWith(".txt");
        assertThat(first.asString())
            .matches("orders/2024/3/7/[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}\\.txt");
    }

    @Test
    void uniquePath_followsTheClock() {
        clock.set(LocalDateTime.of(2025, 12, 31, 23, 59));

        assertThat(namer.uniquePath("orders").asString()).startsWith("orders/2025/12/31/");
    }

    @Test
    void bucketName_isHourAndMinute() {
        assertThat(DestinationNamer.bucketName(LocalDateTime.of(2024, 1, 1, 0, 0))).isEqualTo("0-0");
        assertThat(DestinationNamer.bucketName(LocalDateTime.of(2024, 1, 1, 23, 59))).isEqualTo("23-59");
    }

    @Test
    void pathFor_rejectsEmptyKey() {
        assertThatThrownBy(() -> namer.pathFor("", "x", namer.now()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
