package com.umitunal.jobqueue.queue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class AppReadinessTest {

    @Test
    @DisplayName("Should defer tasks until ready and run them once in order")
    void testDeferredTasks() {
        // Given
        AppReadiness readiness = new AppReadiness();
        List<String> ran = new ArrayList<>();
        readiness.runNowOrWhenReady(() -> ran.add("first"));
        readiness.runNowOrWhenReady(() -> ran.add("second"));
        assertThat(ran).isEmpty();

        // When
        readiness.markReady();
        readiness.markReady();

        // Then
        assertThat(readiness.isReady()).isTrue();
        assertThat(ran).containsExactly("first", "second");
    }

    @Test
    @DisplayName("Should run tasks immediately once ready")
    void testImmediate() {
        AppReadiness readiness = AppReadiness.alreadyReady();
        List<String> ran = new ArrayList<>();

        readiness.runNowOrWhenReady(() -> ran.add("now"));

        assertThat(ran).containsExactly("now");
    }

    @Test
    @DisplayName("Should keep running deferred tasks when one fails")
    void testFailingTask() {
        AppReadiness readiness = new AppReadiness();
        List<String> ran = new ArrayList<>();
        readiness.runNowOrWhenReady(() -> {
            throw new IllegalStateException("bad task");
        });
        readiness.runNowOrWhenReady(() -> ran.add("after"));

        readiness.markReady();

        assertThat(ran).containsExactly("after");
    }
}
