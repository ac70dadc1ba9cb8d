package com.examkit.runtime;

import java.util.concurrent.Future;

import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkerPoolTest {

    @Test
    void shouldPropagateMdcToWorkers() throws Exception {
        try (WorkerPool pool = new WorkerPool(1)) {
            MDC.put("session", "week-4");
            Future<String> worker = pool.submit(() -> MDC.get("session"));
            Future<String> call = pool.call(() -> MDC.get("session"));

            assertEquals("week-4", worker.get());
            assertEquals("week-4", call.get());
        } finally {
            MDC.remove("session");
        }
    }

    @Test
    void shouldRunWorkersOnNamedThreads() throws Exception {
        try (WorkerPool pool = new WorkerPool(2)) {
            String name = pool.submit(() -> Thread.currentThread().getName()).get();

            assertTrue(name.startsWith("examkit-worker-"), name);
            assertEquals(2, pool.threads());
        }
    }

    @Test
    void shouldRejectEmptyPool() {
        assertThrows(IllegalArgumentException.class, () -> new WorkerPool(0));
    }
}
