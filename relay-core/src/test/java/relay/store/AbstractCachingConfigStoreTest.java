package relay.store;

import org.junit.jupiter.api.Test;
import relay.ConfigStoreException;
import relay.ConfigValidationException;
import relay.model.DestinationConfig;
import relay.util.MutableClock;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AbstractCachingConfigStoreTest {

    private static final String URL = "https://discord.com/api/webhooks/1/token";

    private final MutableClock clock = new MutableClock();
    private final InMemoryDestinationConfigStore store = new InMemoryDestinationConfigStore(clock);

    @Test
    void upsertPreservesCreatedAtAndBumpsUpdatedAt() {
        Instant created = clock.instant();
        store.upsert(DestinationConfig.builder("-1", URL).name("first").build());
        clock.advance(Duration.ofMinutes(5));

        DestinationConfig updated = store.upsert(DestinationConfig.builder("-1", URL).name("second").build());

        assertEquals(created, updated.createdAt());
        assertEquals(clock.instant(), updated.updatedAt());
        assertEquals("second", store.get("-1").orElseThrow().name());
    }

    @Test
    void invalidUrlLeavesStoreUnchanged() {
        DestinationConfig original = store.upsert(DestinationConfig.builder("-1", URL).build());

        ConfigValidationException ex = assertThrows(ConfigValidationException.class,
                () -> store.upsert(DestinationConfig.builder("-1", "http://example.com/hook").build()));

        assertEquals("webhookUrl", ex.field());
        assertEquals(original, store.get("-1").orElseThrow());
        assertEquals(original, store.backend().get("-1"));
    }

    @Test
    void failedDurableWriteLeavesCacheUnchanged() {
        store.failWrites(true);

        assertThrows(ConfigStoreException.class, () -> store.upsert(DestinationConfig.builder("-1", URL).build()));

        assertTrue(store.get("-1").isEmpty());
    }

    @Test
    void deleteReportsMissing() {
        store.upsert(DestinationConfig.builder("-1", URL).build());

        assertTrue(store.delete("-1"));
        assertFalse(store.delete("-1"));
        assertTrue(store.get("-1").isEmpty());
    }

    @Test
    void deleteRejectsBlankId() {
        assertThrows(ConfigValidationException.class, () -> store.delete(" "));
    }

    @Test
    void listAllIsSortedById() {
        store.upsert(DestinationConfig.builder("-3", URL).build());
        store.upsert(DestinationConfig.builder("-1", URL).build());
        store.upsert(DestinationConfig.builder("-2", URL).build());

        assertEquals("-1", store.listAll().get(0).destinationId());
        assertEquals("-3", store.listAll().get(2).destinationId());
    }

    @Test
    void reloadPicksUpExternalChangesAndRemovals() {
        store.upsert(DestinationConfig.builder("-1", URL).build());
        store.backend().remove("-1");
        store.backend().put("-9", DestinationConfig.builder("-9", URL).build());

        store.reload();

        assertTrue(store.get("-1").isEmpty());
        assertTrue(store.get("-9").isPresent());
    }

    @Test
    void upsertDuringReloadStaysVisible() {
        store.afterSnapshot(() -> store.upsert(DestinationConfig.builder("-200", URL).build()));

        store.reload();

        assertTrue(store.backend().containsKey("-200"));
        assertTrue(store.get("-200").isPresent());
    }

    @Test
    void deleteDuringReloadIsNotUndone() {
        store.upsert(DestinationConfig.builder("-1", URL).build());
        store.afterSnapshot(() -> store.delete("-1"));

        store.reload();

        assertTrue(store.get("-1").isEmpty());
        assertFalse(store.backend().containsKey("-1"));
    }

    @Test
    void reloadStillAppliesUntouchedIds() {
        store.upsert(DestinationConfig.builder("-1", URL).build());
        store.backend().put("-9", DestinationConfig.builder("-9", URL).build());
        store.afterSnapshot(() -> store.upsert(DestinationConfig.builder("-1", URL).name("during").build()));

        store.reload();

        assertEquals("during", store.get("-1").orElseThrow().name());
        assertTrue(store.get("-9").isPresent());
    }

    @Test
    void getWithNullIdIsEmpty() {
        assertTrue(store.get(null).isEmpty());
    }
}
