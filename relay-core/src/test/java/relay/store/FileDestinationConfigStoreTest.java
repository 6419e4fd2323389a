package relay.store;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import relay.ConfigValidationException;
import relay.model.DestinationConfig;
import relay.model.MessageFilters;
import relay.model.WatermarkConfig;
import relay.model.WatermarkMode;
import relay.util.MutableClock;
import relay.webhook.WebhookUrlPolicy;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileDestinationConfigStoreTest {

    private static final String URL = "https://discord.com/api/webhooks/1/token";

    @TempDir
    Path dir;

    private final MutableClock clock = new MutableClock();

    private FileDestinationConfigStore newStore() {
        return new FileDestinationConfigStore(dir,
                new DestinationConfigValidator(WebhookUrlPolicy.discord()), clock);
    }

    @Test
    void upsertWritesOneFilePerDestination() throws Exception {
        FileDestinationConfigStore store = newStore();

        store.upsert(DestinationConfig.builder("-1001", URL).build());

        Path file = dir.resolve("destination_-1001.json");
        assertTrue(Files.exists(file));
        assertTrue(Files.readString(file, StandardCharsets.UTF_8).contains("\"destination_id\" : \"-1001\""));
        try (Stream<Path> files = Files.list(dir)) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void storedDestinationsSurviveRestart() {
        WatermarkConfig watermark = WatermarkConfig.builder()
                .mode(WatermarkMode.TEXT)
                .textContent("[relayed]")
                .build();
        MessageFilters filters = new MessageFilters(3, List.of("deal"), List.of("spam"), Set.of("99"));
        DestinationConfig stored = newStore().upsert(DestinationConfig.builder("-1", URL)
                .name("deals")
                .filters(filters)
                .watermark(watermark)
                .build());

        FileDestinationConfigStore reopened = newStore();

        assertEquals(stored, reopened.get("-1").orElseThrow());
    }

    @Test
    void invalidUpsertWritesNothing() throws Exception {
        FileDestinationConfigStore store = newStore();

        assertThrows(ConfigValidationException.class,
                () -> store.upsert(DestinationConfig.builder("-1", "not-a-url").build()));

        assertTrue(store.get("-1").isEmpty());
        try (Stream<Path> files = Files.list(dir)) {
            assertEquals(0, files.count());
        }
    }

    @Test
    void deleteRemovesFile() {
        FileDestinationConfigStore store = newStore();
        store.upsert(DestinationConfig.builder("-1", URL).build());

        assertTrue(store.delete("-1"));

        assertFalse(Files.exists(store.fileFor("-1")));
        assertFalse(store.delete("-1"));
    }

    @Test
    void reloadSeesFilesWrittenByOthersAndSkipsCorruptOnes() throws Exception {
        FileDestinationConfigStore store = newStore();
        FileDestinationConfigStore other = newStore();
        other.upsert(DestinationConfig.builder("-2", URL).build());
        Files.writeString(dir.resolve("destination_broken.json"), "{not json", StandardCharsets.UTF_8);

        store.reload();

        assertTrue(store.get("-2").isPresent());
        assertEquals(1, store.listAll().size());
    }

    @Test
    void idsWithPathCharactersAreRejected() throws Exception {
        FileDestinationConfigStore store = newStore();

        ConfigValidationException e = assertThrows(ConfigValidationException.class,
                () -> store.upsert(DestinationConfig.builder("a.b", URL).build()));

        assertEquals("destinationId", e.field());
        try (Stream<Path> files = Files.list(dir)) {
            assertEquals(0, files.count());
        }
    }

    @Test
    void idsDifferingOnlyInCaseOrUnderscoreGetDistinctFiles() {
        FileDestinationConfigStore store = newStore();
        store.upsert(DestinationConfig.builder("chat_1", URL).name("lower").build());
        store.upsert(DestinationConfig.builder("Chat_1", URL).name("upper").build());
        store.upsert(DestinationConfig.builder("chat-1", URL).name("dash").build());

        FileDestinationConfigStore reopened = newStore();

        assertEquals(3, reopened.listAll().size());
        assertEquals("lower", reopened.get("chat_1").orElseThrow().name());
        assertEquals("upper", reopened.get("Chat_1").orElseThrow().name());
        assertEquals("dash", reopened.get("chat-1").orElseThrow().name());
    }

    @Test
    void fileNamesEncodeEverythingButLowerCaseDigitsAndDash() {
        FileDestinationConfigStore store = newStore();

        assertEquals(dir.resolve("destination_-1001.json"), store.fileFor("-1001"));
        assertEquals(dir.resolve("destination_a_5Fb.json"), store.fileFor("a_b"));
        assertEquals(dir.resolve("destination__41b.json"), store.fileFor("Ab"));
        assertEquals(dir.resolve("destination_a_2Fb.json"), store.fileFor("a/b"));
    }

    @Test
    void fileHoldingAnotherDestinationIsSkipped() throws Exception {
        FileDestinationConfigStore store = newStore();
        store.upsert(DestinationConfig.builder("-1", URL).build());
        Files.copy(store.fileFor("-1"), dir.resolve("destination_-7.json"));

        store.reload();

        assertEquals(1, store.listAll().size());
        assertTrue(store.get("-7").isEmpty());
    }
}
