package tempo.scheduler.core;

import org.junit.jupiter.api.Test;
import tempo.scheduler.model.JobKind;

import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class CancellationRegistryTest {

    private final CancellationRegistry registry = new CancellationRegistry();

    private static CancellationRegistry.Entry entry(CancellationHandle handle, UUID parentId) {
        return new CancellationRegistry.Entry("work", JobKind.TIME, handle, false, parentId);
    }

    @Test
    void cancelSignalsThenForgets() {
        UUID id = UUID.randomUUID();
        CancellationHandle handle = new CancellationHandle();
        AtomicBoolean callback = new AtomicBoolean();
        handle.onCancel(() -> callback.set(true));
        registry.register(id, entry(handle, null));

        assertTrue(registry.cancel(id));

        assertTrue(handle.isCancelled());
        assertTrue(callback.get());
        assertNull(registry.get(id));
        assertFalse(registry.cancel(id));
        assertThrows(CancellationException.class, handle::throwIfCancelled);
    }

    @Test
    void parentLookups() {
        UUID parent = UUID.randomUUID();
        UUID self = UUID.randomUUID();
        registry.register(self, entry(new CancellationHandle(), parent));

        assertTrue(registry.isParentRunning(parent));
        assertFalse(registry.isParentRunningExcludingSelf(parent, self));
        assertFalse(registry.isParentRunning(null));

        UUID sibling = UUID.randomUUID();
        registry.register(sibling, entry(new CancellationHandle(), parent));
        assertTrue(registry.isParentRunningExcludingSelf(parent, self));
        assertEquals(Set.of(self, sibling), registry.runningIds());

        registry.clear();
        assertEquals(0, registry.size());
    }

    @Test
    void cancelInterruptsTheBoundThread() throws InterruptedException {
        CancellationHandle handle = new CancellationHandle();
        CountDownLatch bound = new CountDownLatch(1);
        AtomicBoolean interrupted = new AtomicBoolean();

        Thread worker = new Thread(() -> {
            handle.bind();
            bound.countDown();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.set(true);
            } finally {
                handle.unbind();
            }
        });
        worker.start();

        assertTrue(bound.await(2, TimeUnit.SECONDS));
        handle.cancel();
        worker.join(2000);

        assertTrue(interrupted.get());
    }
}
