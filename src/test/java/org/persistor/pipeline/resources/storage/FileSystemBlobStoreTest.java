package org.persistor.pipeline.resources.storage;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.persistor.junit.extensions.logging.LogWatchExtension;
import org.persistor.pipeline.api.resources.IResource;
import org.persistor.pipeline.api.resources.OperationalError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class FileSystemBlobStoreTest {

    @TempDir
    Path tempDir;

    private FileSystemBlobStore store;

    @BeforeEach
    void setUp() {
        store = new FileSystemBlobStore("test-store", rootConfig(tempDir));
    }

    private static Config rootConfig(Path root) {
        return ConfigFactory.parseString("rootDirectory = \"" + root.toAbsolutePath().toString().replace("\\", "/") + "\"");
    }

    @Test
    void writeWhole_createsParentsAndLeavesNoTempFiles() throws IOException {
        store.writeWhole("orders/2024/3/7/abc.txt", bytes("line"));

        Path blob = tempDir.resolve("orders/2024/3/7/abc.txt");
        assertThat(Files.readString(blob)).isEqualTo("line");
        try (Stream<Path> files = Files.list(blob.getParent())) {
            assertThat(files).containsExactly(blob);
        }
        assertThat(store.exists("orders/2024/3/7/abc.txt")).isTrue();
    }

    @Test
    void createAppendableIfAbsent_secondCreatorLoses() throws IOException {
        store.createAppendableIfAbsent("orders/2024/3/7/14-5.txt");

        assertThatThrownBy(() -> store.createAppendableIfAbsent("orders/2024/3/7/14-5.txt"))
            .isInstanceOf(FileAlreadyExistsException.class);
        assertThat(store.getMetrics().get("appendables_created")).isEqualTo(1L);
    }

    @Test
    void appendBlock_appendsInOrder() throws IOException {
        store.createAppendableIfAbsent("orders/a.txt");
        store.appendBlock("orders/a.txt", bytes("one\n"));
        store.appendBlock("orders/a.txt", bytes("two\n"));

        assertThat(Files.readAllLines(tempDir.resolve("orders/a.txt"))).containsExactly("one", "two");
        assertThat(store.getMetrics().get("blocks_appended")).isEqualTo(2L);
    }

    @Test
    void appendBlock_failsWhenBlobMissing() {
        assertThatThrownBy(() -> store.appendBlock("orders/missing.txt", bytes("x")))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("does not exist");
        assertThat(store.getMetrics().get("write_errors")).isEqualTo(1L);
        assertThat(store.isHealthy()).isFalse();
        assertThat(store.getErrors()).extracting(OperationalError::errorType).containsExactly("APPEND_FAILED");
    }

    @Test
    void exists_isFalseForUnknownKey() throws IOException {
        assertThat(store.exists("orders/nothing.txt")).isFalse();
    }

    @Test
    void keys_mustStayInsideTheRoot() {
        assertThatThrownBy(() -> store.writeWhole("../escape.txt", bytes("x")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.writeWhole("/absolute.txt", bytes("x")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.writeWhole("bad|name.txt", bytes("x")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_requiresAbsoluteRoot() {
        assertThatThrownBy(() -> new FileSystemBlobStore("s", ConfigFactory.parseString("rootDirectory = \"relative/dir\"")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FileSystemBlobStore("s", ConfigFactory.empty()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_expandsSystemProperties() {
        System.setProperty("persistor.test.root", tempDir.toAbsolutePath().toString().replace("\\", "/"));
        try {
            FileSystemBlobStore expanded = new FileSystemBlobStore("s",
                ConfigFactory.parseString("rootDirectory = \"${persistor.test.root}/nested\""));
            assertThat(Files.isDirectory(tempDir.resolve("nested"))).isTrue();
            assertThat(expanded.getState()).isEqualTo(IResource.ResourceState.ACTIVE);
        } finally {
            System.clearProperty("persistor.test.root");
        }
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
