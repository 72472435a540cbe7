package maestro.coordinator.server;

import com.fasterxml.jackson.databind.JsonNode;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import maestro.coordinator.core.DomainEvent;
import maestro.coordinator.core.DomainEvents;
import maestro.coordinator.model.WorkQueue;
import maestro.coordinator.util.Jsons;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WebSocketObserverTest {

    private EmbeddedChannel channel;
    private WebSocketObserver observer;

    @BeforeEach
    void setUp() {
        channel = new EmbeddedChannel();
        observer = new WebSocketObserver(channel);
    }

    @AfterEach
    void tearDown() {
        channel.finishAndReleaseAll();
    }

    private static DomainEvent event(String name, Object payload) {
        return new DomainEvent(name, payload, Instant.ofEpochMilli(1_700_000_000_000L));
    }

    @Test
    void frameCarriesNameDataAndTimestamp() throws Exception {
        observer.onEvent(event(DomainEvents.TASK_DELETED, new DomainEvents.Deleted("task_1")));

        TextWebSocketFrame frame = channel.readOutbound();
        try {
            JsonNode json = Jsons.mapper().readTree(frame.text());
            assertEquals("task:deleted", json.get("type").asText());
            assertEquals("task:deleted", json.get("event").asText());
            assertEquals("task_1", json.get("data").get("id").asText());
            assertEquals(1_700_000_000_000L, json.get("timestamp").asLong());
        } finally {
            frame.release();
        }
    }

    @Test
    void unfilteredObserverAcceptsEverything() {
        assertTrue(observer.accepts(event(DomainEvents.QUEUE_ITEM_PUSHED,
                new DomainEvents.QueueItemChange("sess_1", "task_1", null))));
        assertTrue(observer.accepts(event(DomainEvents.PROJECT_CREATED, "anything")));
    }

    @Test
    @DisplayName("Session filter drops other sessions but keeps events without a session")
    void sessionFilter() {
        observer.subscribe(List.of("sess_1"));

        assertTrue(observer.accepts(event(DomainEvents.QUEUE_ITEM_CLAIMED,
                new DomainEvents.QueueItemChange("sess_1", "task_1", null))));
        assertFalse(observer.accepts(event(DomainEvents.QUEUE_ITEM_CLAIMED,
                new DomainEvents.QueueItemChange("sess_2", "task_1", null))));
        assertFalse(observer.accepts(event(DomainEvents.QUEUE_CREATED,
                WorkQueue.create("sess_2", List.of(), Instant.now()))));
        assertFalse(observer.accepts(event(DomainEvents.SESSION_DELETED, new DomainEvents.Deleted("sess_2"))));
        assertTrue(observer.accepts(event(DomainEvents.TASK_DELETED, new DomainEvents.Deleted("task_9"))));
        assertTrue(observer.accepts(event(DomainEvents.TASK_SESSION_ADDED,
                new DomainEvents.Link("task_1", "sess_2"))));

        observer.unsubscribe();
        assertTrue(observer.sessionFilter().isEmpty());
        assertTrue(observer.accepts(event(DomainEvents.QUEUE_ITEM_CLAIMED,
                new DomainEvents.QueueItemChange("sess_2", "task_1", null))));
    }

    @Test
    void filteredEventIsNotWritten() {
        observer.subscribe(List.of("sess_1"));
        observer.onEvent(event(DomainEvents.SESSION_TASK_ADDED, new DomainEvents.Link("task_1", "sess_2")));
        assertNull(channel.readOutbound());
    }

    @Test
    void closedChannelReportsClosed() {
        assertTrue(observer.isOpen());
        assertTrue(observer.id().startsWith("ws-"));
        channel.close();
        assertFalse(observer.isOpen());
    }
}
