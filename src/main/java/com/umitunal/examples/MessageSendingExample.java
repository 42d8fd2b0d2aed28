package com.umitunal.examples;

import com.umitunal.jobqueue.config.BackoffPolicy;
import com.umitunal.jobqueue.config.ProcessIdentity;
import com.umitunal.jobqueue.config.StorageConfig;
import com.umitunal.jobqueue.core.AttemptResult;
import com.umitunal.jobqueue.core.DurableOperation;
import com.umitunal.jobqueue.core.JobType;
import com.umitunal.jobqueue.core.PermanentJobFailureException;
import com.umitunal.jobqueue.model.JobRecord;
import com.umitunal.jobqueue.queue.AppReadiness;
import com.umitunal.jobqueue.queue.DurableJobQueue;
import com.umitunal.jobqueue.queue.JobQueues;
import com.umitunal.jobqueue.reachability.ManualReachabilitySignal;
import com.umitunal.jobqueue.serialization.JsonCodec;
import com.umitunal.jobqueue.serialization.PayloadCodec;
import com.umitunal.jobqueue.storage.JobDatabase;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Message sending over a flaky network: the first attempts fail while
 * "offline", then a reachability event retries the waiting job at once.
 */
public class MessageSendingExample {

    public static class OutgoingMessage {
        public String recipient;
        public String body;

        public OutgoingMessage() {
        }

        public OutgoingMessage(String recipient, String body) {
            this.recipient = recipient;
            this.body = body;
        }
    }

    static class SendMessageJobType implements JobType<OutgoingMessage> {
        private final JsonCodec<OutgoingMessage> codec = new JsonCodec<>(OutgoingMessage.class);
        private final AtomicInteger offlineAttempts = new AtomicInteger(2);

        @Override
        public String getLabel() {
            return "send";
        }

        @Override
        public PayloadCodec<OutgoingMessage> getCodec() {
            return codec;
        }

        @Override
        public long getMaxRetries() {
            return 5;
        }

        @Override
        public boolean requiresInternet() {
            return true;
        }

        @Override
        public int getMaxConcurrentOperations() {
            return 1;
        }

        @Override
        public Duration getRetryInterval(long failureCount) {
            return BackoffPolicy.exponential(Duration.ofSeconds(2), Duration.ofMinutes(1)).retryInterval(failureCount);
        }

        @Override
        public DurableOperation<OutgoingMessage> buildOperation(JobRecord record, OutgoingMessage message) {
            if (message.recipient == null || message.recipient.isEmpty()) {
                throw new PermanentJobFailureException("Message has no recipient");
            }
            return DurableOperation.of(record, message, payload -> {
                if (offlineAttempts.getAndDecrement() > 0) {
                    throw new IOException("Network unreachable");
                }
                System.out.println("  Sent '" + payload.body + "' to " + payload.recipient);
                return AttemptResult.success();
            });
        }
    }

    public static void main(String[] args) {
        System.out.println("=== Message Sending Example ===\n");

        StorageConfig config = StorageConfig.newBuilder("/tmp/durable-jobqueue-send")
                .withDurableWrites(false)
                .build();
        ManualReachabilitySignal reachability = new ManualReachabilitySignal();
        AppReadiness readiness = new AppReadiness();

        try (JobDatabase database = JobDatabase.open(config);
             JobQueues queues = new JobQueues(database, ProcessIdentity.randomMainProcess(), readiness, reachability)) {

            DurableJobQueue<OutgoingMessage> sendQueue = queues.register(new SendMessageJobType());
            queues.setupAll().join();

            database.write(tx -> {
                sendQueue.add(new OutgoingMessage("alice", "Hello"), tx);
                sendQueue.add(new OutgoingMessage("bob", "Hi there"), tx);
                sendQueue.add(new OutgoingMessage("", "Nobody"), tx);
                return null;
            });
            System.out.println("Enqueued 3 messages while offline");

            readiness.markReady();
            Thread.sleep(500);
            System.out.println(sendQueue.getMetrics());

            System.out.println("\nNetwork is back");
            reachability.notifyReachable();
            Thread.sleep(100);
            reachability.notifyReachable();
            Thread.sleep(1000);

            System.out.println("\n" + sendQueue.getMetrics());
            System.out.println("Pruned on next start: " + sendQueue.pruneStaleJobs());

        } catch (Exception e) {
            e.printStackTrace();
        }
    }
}
