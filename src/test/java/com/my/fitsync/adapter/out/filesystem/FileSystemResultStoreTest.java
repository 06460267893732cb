package com.my.fitsync.adapter.out.filesystem;

import com.my.fitsync.domain.exception.InvalidRequestException;
import com.my.fitsync.domain.exception.StorageException;
import com.my.fitsync.domain.model.MetricKind;
import com.my.fitsync.domain.model.MetricPayload;
import com.my.fitsync.domain.model.StoredArtifact;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class FileSystemResultStoreTest {

    private static final LocalDate DATE = LocalDate.of(2026, 3, 9);

    @TempDir
    Path dataRoot;

    @Test
    void writesArtifactUnderAccountDirectory() throws Exception {
        FileSystemResultStore store = new FileSystemResultStore(dataRoot);

        store.save("default", MetricKind.STEPS, DATE, MetricPayload.of("{\"steps\":10}"));

        Path expected = dataRoot.resolve("default").resolve("2026-03-09_steps.json");
        assertThat(Files.readString(expected, StandardCharsets.UTF_8)).isEqualTo("{\"steps\":10}");
        assertThat(store.exists("default", MetricKind.STEPS, DATE)).isTrue();
        assertThat(store.exists("default", MetricKind.SLEEP, DATE)).isFalse();
    }

    @Test
    void overwriteLeavesOnlyFinalContentAndNoTempFiles() throws Exception {
        FileSystemResultStore store = new FileSystemResultStore(dataRoot);

        store.save("default", MetricKind.STEPS, DATE, MetricPayload.of("{\"run\":1}"));
        store.save("default", MetricKind.STEPS, DATE, MetricPayload.of("{\"run\":2}"));

        assertThat(store.find("default", MetricKind.STEPS, DATE))
                .map(artifact -> new String(artifact.payload(), StandardCharsets.UTF_8))
                .contains("{\"run\":2}");
        try (Stream<Path> files = Files.list(dataRoot.resolve("default"))) {
            assertThat(files.map(path -> path.getFileName().toString())).containsExactly("2026-03-09_steps.json");
        }
    }

    @Test
    void historyIsOrderedByDateThenMetricAndIgnoresStrayFiles() throws Exception {
        FileSystemResultStore store = new FileSystemResultStore(dataRoot);
        store.save("default", MetricKind.STEPS, DATE, MetricPayload.of("{}"));
        store.save("default", MetricKind.HEART_RATE_INTRADAY, DATE, MetricPayload.of("{}"));
        store.save("default", MetricKind.SLEEP, DATE.minusDays(1), MetricPayload.empty());
        Files.writeString(dataRoot.resolve("default").resolve(".tmp-123.part"), "partial");
        Files.writeString(dataRoot.resolve("default").resolve("notes.txt"), "ignore");

        List<StoredArtifact> history = store.history("default");

        assertThat(history)
                .extracting(StoredArtifact::date, StoredArtifact::metric)
                .containsExactly(
                        tuple(DATE.minusDays(1), "sleep"),
                        tuple(DATE, "heartrate-intraday"),
                        tuple(DATE, "steps"));
        assertThat(history.get(0).size()).isEqualTo(2);
        assertThat(store.history("nobody")).isEmpty();
    }

    @Test
    void rejectsUnsafeAccountKeys() {
        FileSystemResultStore store = new FileSystemResultStore(dataRoot);

        assertThatThrownBy(() -> store.save("../escape", MetricKind.STEPS, DATE, MetricPayload.empty()))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> store.history("a/b"))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void unwritableRootIsStorageFailure() throws Exception {
        Path file = Files.writeString(dataRoot.resolve("not-a-directory"), "x");
        FileSystemResultStore store = new FileSystemResultStore(file);

        assertThatThrownBy(() -> store.save("default", MetricKind.STEPS, DATE, MetricPayload.empty()))
                .isInstanceOf(StorageException.class);
    }
}
