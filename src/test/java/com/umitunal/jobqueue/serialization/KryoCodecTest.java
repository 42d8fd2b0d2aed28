package com.umitunal.jobqueue.serialization;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedQueue;

import static org.assertj.core.api.Assertions.*;

class KryoCodecTest {

    @Test
    @DisplayName("Should encode and decode complex payloads")
    void testComplexPayload() {
        // Given
        KryoCodec<UploadRequest> codec = new KryoCodec<>(UploadRequest.class);
        UploadRequest original = new UploadRequest(
                "photo-17",
                3,
                new ArrayList<>(List.of("album", "shared")),
                new HashMap<>(Map.of("mime", "image/jpeg", "size", "204800"))
        );

        // When
        UploadRequest decoded = codec.decode(codec.encode(original));

        // Then
        assertThat(decoded.fileId).isEqualTo(original.fileId);
        assertThat(decoded.chunkCount).isEqualTo(original.chunkCount);
        assertThat(decoded.tags).containsExactlyElementsOf(original.tags);
        assertThat(decoded.metadata).containsAllEntriesOf(original.metadata);
    }

    @Test
    @DisplayName("Should handle circular references")
    void testCircularReferences() {
        // Given
        KryoCodec<Node> codec = new KryoCodec<>(Node.class);
        Node first = new Node("first");
        Node second = new Node("second");
        first.next = second;
        second.next = first;

        // When
        Node decoded = codec.decode(codec.encode(first));

        // Then
        assertThat(decoded.name).isEqualTo("first");
        assertThat(decoded.next.name).isEqualTo("second");
        assertThat(decoded.next.next).isSameAs(decoded);
    }

    @Test
    @DisplayName("Should require registration when classes are supplied")
    void testRegistrationRequired() {
        // Given
        KryoCodec<Node> codec = new KryoCodec<>(Node.class, List.of(String.class));
        Node original = new Node("only");

        // When
        Node decoded = codec.decode(codec.encode(original));

        // Then
        assertThat(decoded.name).isEqualTo("only");

        // And an unregistered nested type is rejected
        KryoCodec<UploadRequest> strict = new KryoCodec<>(UploadRequest.class, List.of(String.class));
        UploadRequest request = new UploadRequest("x", 1, new ArrayList<>(), null);
        assertThatThrownBy(() -> strict.encode(request))
                .isInstanceOf(PayloadCodecException.class);
    }

    @Test
    @DisplayName("Should wrap garbage input in a codec exception")
    void testGarbageInput() {
        KryoCodec<UploadRequest> codec = new KryoCodec<>(UploadRequest.class);

        assertThatThrownBy(() -> codec.decode(new byte[]{1}))
                .isInstanceOf(PayloadCodecException.class);
    }

    @Test
    @DisplayName("Should be thread-safe")
    void testThreadSafety() throws InterruptedException {
        // Given
        KryoCodec<String> codec = new KryoCodec<>(String.class);
        int threadCount = 10;
        int iterations = 100;
        Thread[] threads = new Thread[threadCount];
        ConcurrentLinkedQueue<Throwable> errors = new ConcurrentLinkedQueue<>();

        // When
        for (int i = 0; i < threadCount; i++) {
            final int threadNum = i;
            threads[i] = new Thread(() -> {
                try {
                    for (int j = 0; j < iterations; j++) {
                        String original = "Thread-" + threadNum + "-Iteration-" + j;
                        assertThat(codec.decode(codec.encode(original))).isEqualTo(original);
                    }
                } catch (Throwable t) {
                    errors.add(t);
                }
            });
            threads[i].start();
        }
        for (Thread thread : threads) {
            thread.join();
        }

        // Then
        assertThat(errors).isEmpty();
    }

    @Test
    @DisplayName("Should handle null fields")
    void testNullFields() {
        // Given
        KryoCodec<UploadRequest> codec = new KryoCodec<>(UploadRequest.class);
        UploadRequest original = new UploadRequest(null, 0, null, null);

        // When
        UploadRequest decoded = codec.decode(codec.encode(original));

        // Then
        assertThat(decoded.fileId).isNull();
        assertThat(decoded.tags).isNull();
        assertThat(decoded.metadata).isNull();
    }

    public static class UploadRequest {
        private String fileId;
        private int chunkCount;
        private List<String> tags;
        private Map<String, String> metadata;

        public UploadRequest() {}

        public UploadRequest(String fileId, int chunkCount, List<String> tags, Map<String, String> metadata) {
            this.fileId = fileId;
            this.chunkCount = chunkCount;
            this.tags = tags;
            this.metadata = metadata;
        }
    }

    public static class Node {
        private String name;
        private Node next;

        public Node() {}

        public Node(String name) {
            this.name = name;
        }
    }
}
