package relay.util;

import java.time.Duration;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.fail;

/** Polls a condition until it holds or the timeout passes. */
public final class Await {

    private Await() {
    }

    public static void until(BooleanSupplier condition, String description) throws InterruptedException {
        until(Duration.ofSeconds(5), condition, description);
    }

    public static void until(Duration timeout, BooleanSupplier condition, String description)
            throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Timed out after " + timeout + " waiting for " + description);
            }
            Thread.sleep(10);
        }
    }
}
