package relay.ingest;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import relay.SourceUnavailableException;
import relay.delivery.DeliveryDispatcher;
import relay.delivery.ExponentialBackoffRetryPolicy;
import relay.model.DestinationConfig;
import relay.model.InboundMessage;
import relay.model.MessageFilters;
import relay.model.WatermarkConfig;
import relay.model.WatermarkMode;
import relay.stats.RelayStats;
import relay.store.DestinationConfigStore;
import relay.store.InMemoryDestinationConfigStore;
import relay.transform.VideoWatermarker;
import relay.transform.OverlayCache;
import relay.transform.WatermarkEngine;
import relay.util.Await;
import relay.webhook.RecordingTransport;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IngestionLoopTest {

    private static final String URL_A = "https://discord.com/api/webhooks/1/a";
    private static final String URL_B = "https://discord.com/api/webhooks/2/b";

    private final RelayStats stats = new RelayStats();
    private final InMemoryDestinationConfigStore store = new InMemoryDestinationConfigStore();
    private final QueueSourceEventStream stream = new QueueSourceEventStream();
    private final RecordingTransport transport = new RecordingTransport(204);
    private DeliveryDispatcher dispatcher;
    private IngestionLoop loop;

    @AfterEach
    void tearDown() {
        if (loop != null) {
            loop.close();
        }
        if (dispatcher != null) {
            dispatcher.close();
        }
    }

    private IngestionLoop.Builder loop(SourceEventStream source) {
        dispatcher = DeliveryDispatcher.builder()
                .transport(transport)
                .stats(stats)
                .retryPolicy(new ExponentialBackoffRetryPolicy(10, 100, 0.0))
                .drainTimeoutMs(1000)
                .build();
        return IngestionLoop.builder()
                .stream(source)
                .store(store)
                .engine(new WatermarkEngine(new OverlayCache(), new VideoWatermarker("relay-test-no-such-ffmpeg"), stats))
                .dispatcher(dispatcher)
                .stats(stats)
                .dispatchThreads(1)
                .pollTimeout(Duration.ofMillis(20))
                .stopTimeout(Duration.ofSeconds(2));
    }

    private IngestionLoop started() {
        loop = loop(stream).build();
        loop.start();
        return loop;
    }

    // ── Lifecycle ───────────────────────────────────────────────────

    @Test
    void startMovesToListeningAndStopToStopped() {
        loop = loop(stream).build();
        assertEquals(IngestionState.IDLE, loop.state());

        loop.start();
        assertEquals(IngestionState.LISTENING, loop.state());

        loop.stop();
        assertEquals(IngestionState.STOPPED, loop.state());
        loop.stop();
        assertEquals(IngestionState.STOPPED, loop.state());
    }

    @Test
    void startTwiceIsRejected() {
        started();

        assertThrows(IllegalStateException.class, () -> loop.start());
    }

    @Test
    void unreachableSourceFailsStartup() {
        SourceEventStream broken = new SourceEventStream() {
            @Override
            public void open() throws IOException {
                throw new IOException("connection refused");
            }

            @Override
            public InboundMessage poll(Duration timeout) {
                return null;
            }

            @Override
            public void close() {
            }
        };
        loop = loop(broken).build();

        SourceUnavailableException e = assertThrows(SourceUnavailableException.class, () -> loop.start());
        assertTrue(e.getCause() instanceof IOException);
        assertEquals(IngestionState.STOPPED, loop.state());
    }

    @Test
    void builderRequiresCollaborators() {
        assertThrows(NullPointerException.class, () -> IngestionLoop.builder().build());
    }

    // ── Routing ─────────────────────────────────────────────────────

    @Test
    void textMessageIsWatermarkedAndDelivered() throws Exception {
        store.upsert(DestinationConfig.builder("-100", URL_A)
                .watermark(WatermarkConfig.builder().mode(WatermarkMode.TEXT).textContent("[relayed]").build())
                .build());
        started();

        stream.publish(InboundMessage.text("-100", "1", "7", "hello"));

        Await.until(() -> stats.snapshot().messagesReplicated() == 1, "delivery");
        assertEquals(1, transport.callCount());
        assertEquals(URL_A, transport.calls().get(0).url());
        assertEquals("hello [relayed]", transport.calls().get(0).payload().text());
        assertEquals(1, stats.snapshot().messagesSeen());
        assertEquals(1, stats.snapshot().watermarksApplied());
        assertEquals(1, stats.snapshot().destination("-100").delivered());
    }

    @Test
    void disabledDestinationReceivesNothing() throws Exception {
        store.upsert(DestinationConfig.builder("-100", URL_A).enabled(false).build());
        store.upsert(DestinationConfig.builder("-200", URL_B).build());
        started();

        stream.publish(InboundMessage.text("-100", "1", "7", "hidden"));
        stream.publish(InboundMessage.text("-200", "2", "7", "visible"));

        // single dispatch thread: once the second message is delivered the first was handled
        Await.until(() -> stats.snapshot().messagesReplicated() == 1, "delivery to -200");
        assertEquals(1, transport.callCount());
        assertEquals(URL_B, transport.calls().get(0).url());
        assertEquals(2, stats.snapshot().messagesSeen());
        assertEquals(0, stats.snapshot().destination("-100").delivered());
        assertEquals(0, stats.snapshot().destination("-100").failed());
    }

    @Test
    void unmappedChatIsIgnored() throws Exception {
        store.upsert(DestinationConfig.builder("-200", URL_B).build());
        started();

        stream.publish(InboundMessage.text("-999", "1", "7", "nobody listens"));
        stream.publish(InboundMessage.text("-200", "2", "7", "visible"));

        Await.until(() -> stats.snapshot().messagesReplicated() == 1, "delivery to -200");
        assertEquals(1, transport.callCount());
        assertEquals(0, stats.snapshot().errors());
    }

    @Test
    void filteredMessageIsNotForwarded() throws Exception {
        store.upsert(DestinationConfig.builder("-100", URL_A)
                .filters(new MessageFilters(0, List.of(), List.of(), Set.of("13")))
                .build());
        started();

        stream.publish(InboundMessage.text("-100", "1", "13", "blocked sender"));
        stream.publish(InboundMessage.text("-100", "2", "7", "allowed sender"));

        Await.until(() -> stats.snapshot().messagesReplicated() == 1, "allowed delivery");
        assertEquals(1, transport.callCount());
        assertEquals("allowed sender", transport.calls().get(0).payload().text());
    }

    @Test
    void duplicateMessageIsForwardedOnce() throws Exception {
        store.upsert(DestinationConfig.builder("-100", URL_A).build());
        started();

        stream.publish(InboundMessage.text("-100", "1", "7", "first"));
        stream.publish(InboundMessage.text("-100", "1", "7", "first again"));
        stream.publish(InboundMessage.text("-100", "2", "7", "second"));

        Await.until(() -> stats.snapshot().messagesReplicated() == 2, "two deliveries");
        assertEquals(2, transport.callCount());
        assertEquals(3, stats.snapshot().messagesSeen());
    }

    // ── Failure isolation ───────────────────────────────────────────

    @Test
    void failingMessageDoesNotStopTheNextOne() throws Exception {
        store.upsert(DestinationConfig.builder("-100", URL_A).build());
        AtomicBoolean failNext = new AtomicBoolean(true);
        DestinationConfigStore flaky = new DestinationConfigStore() {
            @Override
            public Optional<DestinationConfig> get(String destinationId) {
                if (failNext.getAndSet(false)) {
                    throw new IllegalStateException("store offline");
                }
                return store.get(destinationId);
            }

            @Override
            public DestinationConfig upsert(DestinationConfig config) {
                return store.upsert(config);
            }

            @Override
            public boolean delete(String destinationId) {
                return store.delete(destinationId);
            }

            @Override
            public List<DestinationConfig> listAll() {
                return store.listAll();
            }

            @Override
            public void reload() {
                store.reload();
            }
        };
        loop = loop(stream).store(flaky).build();
        loop.start();

        stream.publish(InboundMessage.text("-100", "1", "7", "lost"));
        stream.publish(InboundMessage.text("-100", "2", "7", "delivered"));

        Await.until(() -> stats.snapshot().messagesReplicated() == 1, "second message delivered");
        assertEquals(1, transport.callCount());
        assertEquals("delivered", transport.calls().get(0).payload().text());
        assertEquals(2, stats.snapshot().messagesSeen());
        assertEquals(1, stats.snapshot().errors());
    }

    @Test
    void resolveSkipsDisabledAndFilteredDestinations() {
        store.upsert(DestinationConfig.builder("-100", URL_A).enabled(false).build());
        store.upsert(DestinationConfig.builder("-200", URL_B)
                .filters(new MessageFilters(10, List.of(), List.of(), Set.of()))
                .build());
        loop = loop(stream).build();

        assertTrue(loop.resolve(InboundMessage.text("-100", "1", "7", "hello world")).isEmpty());
        assertTrue(loop.resolve(InboundMessage.text("-200", "1", "7", "short")).isEmpty());
        assertEquals(1, loop.resolve(InboundMessage.text("-200", "2", "7", "long enough text")).size());
    }
}
