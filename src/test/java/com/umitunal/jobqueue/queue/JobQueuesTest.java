package com.umitunal.jobqueue.queue;

import com.umitunal.jobqueue.config.BackoffPolicy;
import com.umitunal.jobqueue.config.ProcessIdentity;
import com.umitunal.jobqueue.config.StorageConfig;
import com.umitunal.jobqueue.core.AttemptResult;
import com.umitunal.jobqueue.reachability.ManualReachabilitySignal;
import com.umitunal.jobqueue.storage.JobDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.*;

class JobQueuesTest {

    @TempDir
    Path tempDir;

    private JobDatabase database;
    private ManualReachabilitySignal reachability;
    private JobQueues queues;

    @BeforeEach
    void setUp() throws Exception {
        database = JobDatabase.open(StorageConfig.newBuilder(tempDir.toString())
                .withDurableWrites(false)
                .build());
        reachability = new ManualReachabilitySignal();
        queues = new JobQueues(database, ProcessIdentity.mainProcess("main-app"),
                AppReadiness.alreadyReady(), reachability);
    }

    @AfterEach
    void tearDown() {
        queues.close();
        database.close();
    }

    @Test
    @DisplayName("Should reject a second queue for the same label")
    void testDuplicateLabel() {
        // Given
        queues.register(new TestJobType("send"));

        // When / Then
        assertThatThrownBy(() -> queues.register(new TestJobType("send")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("send");
        assertThat(queues.labels()).containsExactly("send");
    }

    @Test
    @DisplayName("Should set up every registered queue and run their work independently")
    void testSetupAll() throws Exception {
        // Given
        DurableJobQueue<String> send = queues.register(new TestJobType("send"));
        DurableJobQueue<String> upload = queues.register(new TestJobType("upload"));
        database.write(tx -> {
            send.add("message", tx);
            upload.add("file", tx);
            return null;
        });

        // When
        queues.setupAll().get(5, TimeUnit.SECONDS);

        // Then
        assertThat(send.isSetup()).isTrue();
        assertThat(upload.isSetup()).isTrue();
        assertThat(queues.get("upload")).isSameAs(upload);
        assertThat(queues.get("missing")).isNull();
        await().atMost(5, TimeUnit.SECONDS).until(() ->
                send.getMetrics().getTotalJobs() == 0 && upload.getMetrics().getTotalJobs() == 0);
    }

    @Test
    @DisplayName("Should subscribe only internet-bound queues and unsubscribe on close")
    void testReachabilityFanout() throws Exception {
        // Given
        TestJobType online = new TestJobType("online");
        online.requiresInternet = true;
        online.backoff = BackoffPolicy.fixed(Duration.ofHours(1));
        online.behavior = (record, payload, attempt) ->
                attempt == 1 ? AttemptResult.failure(new IOException("offline")) : AttemptResult.success();
        DurableJobQueue<String> onlineQueue = queues.register(online);
        queues.register(new TestJobType("local"));
        queues.setupAll().get(5, TimeUnit.SECONDS);
        assertThat(reachability.getListenerCount()).isEqualTo(1);

        long id = database.write(tx -> onlineQueue.add("ping", tx)).getId();
        await().atMost(5, TimeUnit.SECONDS).until(() -> onlineQueue.getInFlightRecordIds().contains(id)
                && online.attemptsFor(id) == 1);

        // When
        await().atMost(5, TimeUnit.SECONDS).until(() -> {
            reachability.notifyReachable();
            return online.attemptsFor(id) == 2;
        });
        queues.close();

        // Then
        assertThat(reachability.getListenerCount()).isZero();
    }
}
