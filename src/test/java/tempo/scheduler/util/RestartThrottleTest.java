package tempo.scheduler.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class RestartThrottleTest {

    @Test
    void burstOfRequestsRunsOnce() throws InterruptedException {
        AtomicInteger restarts = new AtomicInteger();
        try (RestartThrottle throttle = new RestartThrottle(Duration.ofMillis(30), restarts::incrementAndGet)) {
            for (int i = 0; i < 10; i++) {
                throttle.requestRestart();
            }

            await().atMost(Duration.ofSeconds(2)).until(() -> restarts.get() == 1);
            Thread.sleep(100);
            assertEquals(1, restarts.get());
        }
    }

    @Test
    void requestsAfterCloseAreIgnored() throws InterruptedException {
        AtomicInteger restarts = new AtomicInteger();
        RestartThrottle throttle = new RestartThrottle(Duration.ofMillis(10), restarts::incrementAndGet);
        throttle.close();

        throttle.requestRestart();
        Thread.sleep(50);
        assertEquals(0, restarts.get());
    }
}
