package com.umitunal.jobqueue.storage;

import com.umitunal.jobqueue.config.ProcessIdentity;
import com.umitunal.jobqueue.config.StorageConfig;
import com.umitunal.jobqueue.model.JobRecord;
import com.umitunal.jobqueue.model.JobStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.*;

class JobRecordStoreTest {

    @TempDir
    Path tempDir;

    private StorageConfig config;
    private JobDatabase database;
    private JobRecordStore store;

    @BeforeEach
    void setUp() throws Exception {
        config = StorageConfig.newBuilder(tempDir.toString())
                .withDurableWrites(false)
                .build();
        database = JobDatabase.open(config);
        store = new JobRecordStore(ProcessIdentity.mainProcess("main-app"));
    }

    @AfterEach
    void tearDown() {
        if (database != null) {
            database.close();
        }
    }

    private JobRecord insert(String label, String exclusive) throws Exception {
        return database.write(tx -> store.insert(label, label.getBytes(UTF_8), exclusive, tx));
    }

    @Test
    @DisplayName("Should insert ready records with increasing ids")
    void testInsert() throws Exception {
        // When
        JobRecord first = insert("send", null);
        JobRecord second = insert("send", null);

        // Then
        assertThat(first.getStatus()).isEqualTo(JobStatus.READY);
        assertThat(first.getFailureCount()).isZero();
        assertThat(second.getId()).isGreaterThan(first.getId());
        JobRecord stored = database.read(tx -> store.find(first.getId(), tx));
        assertThat(stored.getLabel()).isEqualTo("send");
        assertThat(stored.getPayload()).isEqualTo("send".getBytes(UTF_8));
    }

    @Test
    @DisplayName("Should keep handing out fresh ids after reopen")
    void testIdsSurviveReopen() throws Exception {
        // Given
        JobRecord before = insert("send", null);
        database.write(tx -> {
            store.remove(before, tx);
            return null;
        });

        // When
        database.close();
        database = JobDatabase.open(config);
        JobRecord after = insert("send", null);

        // Then
        assertThat(after.getId()).isGreaterThan(before.getId());
    }

    @Test
    @DisplayName("Should return the lowest-id ready record of a label")
    void testNextReady() throws Exception {
        // Given
        JobRecord first = insert("send", null);
        JobRecord second = insert("send", null);
        insert("upload", null);

        // When
        database.write(tx -> store.markRunning(first, tx));
        JobRecord next = database.read(tx -> store.nextReady("send", tx));

        // Then
        assertThat(next.getId()).isEqualTo(second.getId());
    }

    @Test
    @DisplayName("Should skip records reserved for another process")
    void testNextReadySkipsForeignRecords() throws Exception {
        // Given
        insert("send", "extension");
        JobRecord mine = insert("send", "main-app");

        // When
        JobRecord next = database.read(tx -> store.nextReady("send", tx));

        // Then
        assertThat(next.getId()).isEqualTo(mine.getId());
    }

    @Test
    @DisplayName("Should return null when no record is ready")
    void testNextReadyEmpty() throws Exception {
        JobRecord next = database.read(tx -> store.nextReady("send", tx));

        assertThat(next).isNull();
    }

    @Test
    @DisplayName("Should list records by status in id order")
    void testAllByStatus() throws Exception {
        // Given
        JobRecord a = insert("send", null);
        JobRecord b = insert("send", null);
        JobRecord c = insert("send", null);
        database.write(tx -> {
            store.markRunning(a, tx);
            store.markRunning(c, tx);
            return null;
        });

        // When
        List<JobRecord> running = database.read(tx -> store.all("send", JobStatus.RUNNING, tx));
        List<JobRecord> all = database.read(tx -> store.all("send", tx));

        // Then
        assertThat(running).extracting(JobRecord::getId).containsExactly(a.getId(), c.getId());
        assertThat(all).extracting(JobRecord::getId).containsExactly(a.getId(), b.getId(), c.getId());
    }

    @Test
    @DisplayName("Should treat terminal and foreign ready records as stale but never running ones")
    void testStaleRecords() throws Exception {
        // Given
        JobRecord failed = insert("send", null);
        JobRecord obsolete = insert("send", null);
        JobRecord foreign = insert("send", "extension");
        JobRecord running = insert("send", "extension");
        JobRecord ready = insert("send", null);
        database.write(tx -> {
            store.markPermanentlyFailed(failed, "boom", tx);
            store.markObsolete(obsolete, "old", tx);
            store.markRunning(running, tx);
            return null;
        });

        // When
        List<JobRecord> stale = database.read(tx -> store.staleRecords("send", tx));

        // Then
        assertThat(stale).extracting(JobRecord::getId)
                .containsExactly(failed.getId(), obsolete.getId(), foreign.getId())
                .doesNotContain(running.getId(), ready.getId());
    }

    @Test
    @DisplayName("Should persist failures while keeping the record running")
    void testAddFailure() throws Exception {
        // Given
        JobRecord record = insert("send", null);
        database.write(tx -> store.markRunning(record, tx));

        // When
        database.write(tx -> store.addFailure(record, "timeout", tx));
        JobRecord updated = database.write(tx -> store.addFailure(record, "reset", tx));

        // Then
        assertThat(updated.getFailureCount()).isEqualTo(2);
        JobRecord stored = database.read(tx -> store.find(record.getId(), tx));
        assertThat(stored.getStatus()).isEqualTo(JobStatus.RUNNING);
        assertThat(stored.getFailureCount()).isEqualTo(2);
        assertThat(stored.getLastError()).isEqualTo("reset");
    }

    @Test
    @DisplayName("Should reject updates to a deleted record")
    void testUpdateMissing() throws Exception {
        // Given
        JobRecord record = insert("send", null);
        database.write(tx -> {
            store.remove(record, tx);
            return null;
        });

        // When / Then
        assertThatThrownBy(() -> database.write(tx -> store.markRunning(record, tx)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("not found");
        List<JobRecord> remaining = database.read(tx -> store.all("send", tx));
        assertThat(remaining).isEmpty();
    }

    @Test
    @DisplayName("Should surface undecodable records as unknown")
    void testCorruptedRecord() throws Exception {
        // Given
        JobRecord record = insert("send", null);
        database.write(tx -> {
            tx.put(JobRecordStore.recordKey(record.getId()), new byte[]{1, 2});
            return null;
        });

        // When
        List<JobRecord> all = database.read(tx -> store.all("send", tx));
        List<JobRecord> stale = database.read(tx -> store.staleRecords("send", tx));

        // Then
        assertThat(all).singleElement().satisfies(r -> {
            assertThat(r.getId()).isEqualTo(record.getId());
            assertThat(r.getStatus()).isEqualTo(JobStatus.UNKNOWN);
        });
        JobRecord next = database.read(tx -> store.nextReady("send", tx));
        assertThat(stale).hasSize(1);
        assertThat(next).isNull();
    }

    @Test
    @DisplayName("Should count every status for a label")
    void testCountByStatus() throws Exception {
        // Given
        JobRecord a = insert("send", null);
        insert("send", null);
        database.write(tx -> store.markRunning(a, tx));

        // When
        Map<JobStatus, Long> counts = database.read(tx -> store.countByStatus("send", tx));

        // Then
        assertThat(counts).containsEntry(JobStatus.READY, 1L)
                .containsEntry(JobStatus.RUNNING, 1L)
                .containsEntry(JobStatus.OBSOLETE, 0L)
                .hasSize(JobStatus.values().length);
    }

    @Test
    @DisplayName("Should reject empty labels and labels containing NUL")
    void testLabelValidation() {
        assertThatThrownBy(() -> insert("", null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> insert("se\0nd", null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should not leak records between labels sharing a prefix")
    void testLabelPrefixIsolation() throws Exception {
        // Given
        insert("send", null);
        JobRecord longer = insert("sendLater", null);

        // When
        List<JobRecord> sendLater = database.read(tx -> store.all("sendLater", tx));
        List<JobRecord> send = database.read(tx -> store.all("send", tx));

        // Then
        assertThat(sendLater).extracting(JobRecord::getId).containsExactly(longer.getId());
        assertThat(send).hasSize(1);
    }
}
