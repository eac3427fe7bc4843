package io.entityjdbc.retry;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit-test")
public class ExecutionSuspensionTest {
    private ExecutorService executorService;

    @BeforeEach
    public void setUp() {
        executorService = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    public void tearDown() throws InterruptedException {
        executorService.shutdownNow();
        executorService.awaitTermination(5, TimeUnit.SECONDS);
    }

    @Test
    public void whenNestingScopes_expectPreviousStateRestored() {
        Assertions.assertFalse(ExecutionSuspension.isSuspended());

        try (ExecutionSuspension.Scope outer = ExecutionSuspension.suspend()) {
            try (ExecutionSuspension.Scope inner = ExecutionSuspension.suspend()) {
                Assertions.assertTrue(ExecutionSuspension.isSuspended());
            }
            Assertions.assertTrue(ExecutionSuspension.isSuspended());
        }

        Assertions.assertFalse(ExecutionSuspension.isSuspended());
    }

    @Test
    public void whenOtherThread_expectNotSuspended() throws Exception {
        try (ExecutionSuspension.Scope ignored = ExecutionSuspension.suspend()) {
            Assertions.assertFalse(CompletableFuture
                    .supplyAsync(ExecutionSuspension::isSuspended, executorService)
                    .get(5, TimeUnit.SECONDS));
        }
    }

    @Test
    public void whenBoundExecutorCapturedWhileSuspended_expectTasksSuspended() throws Exception {
        Executor executor;
        try (ExecutionSuspension.Scope ignored = ExecutionSuspension.suspend()) {
            executor = ExecutionSuspension.bind(executorService);
        }

        Assertions.assertTrue(CompletableFuture
                .supplyAsync(ExecutionSuspension::isSuspended, executor)
                .get(5, TimeUnit.SECONDS));
        Assertions.assertFalse(CompletableFuture
                .supplyAsync(ExecutionSuspension::isSuspended, executorService)
                .get(5, TimeUnit.SECONDS));
    }

    @Test
    public void whenSnapshotNotSuspended_expectSuspensionClearedForTask() {
        ExecutionSuspension.Snapshot snapshot = ExecutionSuspension.capture();
        Assertions.assertFalse(snapshot.isSuspended());

        try (ExecutionSuspension.Scope ignored = ExecutionSuspension.suspend()) {
            Assertions.assertFalse(snapshot.wrap(ExecutionSuspension::isSuspended).get());
            Assertions.assertTrue(ExecutionSuspension.isSuspended());
        }
    }

    @Test
    public void whenWrappedFunctionThrows_expectStateRestored() {
        ExecutionSuspension.Snapshot snapshot;
        try (ExecutionSuspension.Scope ignored = ExecutionSuspension.suspend()) {
            snapshot = ExecutionSuspension.capture();
        }

        Assertions.assertThrows(IllegalStateException.class, () -> snapshot.<Integer, Integer>wrap(value -> {
            Assertions.assertTrue(ExecutionSuspension.isSuspended());
            throw new IllegalStateException("Disturbance!");
        }).apply(1));
        Assertions.assertFalse(ExecutionSuspension.isSuspended());
    }
}
