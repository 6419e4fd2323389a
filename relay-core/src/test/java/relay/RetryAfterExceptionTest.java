package relay;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryAfterExceptionTest {

    @Test
    void messageNamesDelayAndReason() {
        RetryAfterException e = new RetryAfterException(Duration.ofSeconds(2), "global limit");

        assertEquals(Duration.ofSeconds(2), e.retryAfter());
        assertEquals("Rate limited, retry after 2000 ms: global limit", e.getMessage());
    }

    @Test
    void fractionalSecondsRoundToMillis() {
        assertEquals(Duration.ofMillis(1250), RetryAfterException.ofSeconds(1.25).retryAfter());
        assertEquals(Duration.ZERO, RetryAfterException.ofSeconds(0).retryAfter());
    }

    @Test
    void rejectsNegativeOrMissingDelay() {
        assertThrows(IllegalArgumentException.class, () -> new RetryAfterException(Duration.ofMillis(-1)));
        assertThrows(IllegalArgumentException.class, () -> RetryAfterException.ofSeconds(-0.5));
        assertThrows(IllegalArgumentException.class, () -> RetryAfterException.ofSeconds(Double.NaN));
        NullPointerException npe = assertThrows(NullPointerException.class, () -> new RetryAfterException(null));
        assertTrue(npe.getMessage().contains("retryAfter"));
    }
}
