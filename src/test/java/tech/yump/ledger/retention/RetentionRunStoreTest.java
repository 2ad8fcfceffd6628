package tech.yump.ledger.retention;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tech.yump.ledger.event.LedgerJson;
import tech.yump.ledger.storage.StorageException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetentionRunStoreTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("recordRun: persisted runs are visible to a new store on the same file")
    void recordRun_persists() {
        Path file = tempDir.resolve("config").resolve(RetentionRunStore.FILE_NAME);
        RetentionRunStore store = new RetentionRunStore(file, LedgerJson.newObjectMapper());
        Instant first = Instant.parse("2024-05-01T03:00:00Z");
        Instant second = Instant.parse("2024-05-02T03:00:00Z");

        store.recordRun("policy_session", first);
        store.recordRun("policy_error_logs", first);
        store.recordRun("policy_session", second);

        RetentionRunStore reopened = new RetentionRunStore(file, LedgerJson.newObjectMapper());
        assertThat(reopened.lastRuns())
                .containsEntry("policy_session", second)
                .containsEntry("policy_error_logs", first)
                .hasSize(2);
        assertThat(reopened.lastRun("policy_consent")).isEmpty();
    }

    @Test
    @DisplayName("lastRuns: a missing or corrupt file reads as never run")
    void lastRuns_lenientRead() throws IOException {
        Path file = tempDir.resolve(RetentionRunStore.FILE_NAME);
        RetentionRunStore store = new RetentionRunStore(file, LedgerJson.newObjectMapper());
        assertThat(store.lastRuns()).isEmpty();

        Files.writeString(file, "{ not json");
        assertThat(store.lastRuns()).isEmpty();
    }

    @Test
    @DisplayName("recordRun: an unwritable location raises StorageException")
    void recordRun_unwritable() throws IOException {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "a file, not a directory");
        RetentionRunStore store = new RetentionRunStore(blocker.resolve(RetentionRunStore.FILE_NAME), LedgerJson.newObjectMapper());

        assertThatThrownBy(() -> store.recordRun("policy_session", Instant.now()))
                .isInstanceOf(StorageException.class);
    }
}
