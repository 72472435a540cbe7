package maestro.coordinator.server;

import io.netty.channel.Channel;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import maestro.coordinator.core.DomainEvent;
import maestro.coordinator.core.DomainEvents;
import maestro.coordinator.core.Observer;
import maestro.coordinator.model.Session;
import maestro.coordinator.model.WorkQueue;
import maestro.coordinator.util.Jsons;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Observer writing events as JSON text frames to one WebSocket connection.
 * <p>
 * A client may narrow the stream to a set of sessions; session-scoped
 * events of other sessions are then dropped. Events that belong to no
 * session always pass.
 */
public class WebSocketObserver implements Observer {

    private final Channel channel;
    private volatile Set<String> sessionFilter = Set.of();

    public WebSocketObserver(Channel channel) {
        this.channel = channel;
    }

    @Override
    public String id() {
        return "ws-" + channel.id().asShortText();
    }

    @Override
    public boolean isOpen() {
        return channel.isActive();
    }

    public void subscribe(Collection<String> sessionIds) {
        this.sessionFilter = sessionIds == null ? Set.of() : Set.copyOf(sessionIds);
    }

    public void unsubscribe() {
        this.sessionFilter = Set.of();
    }

    public Set<String> sessionFilter() {
        return sessionFilter;
    }

    @Override
    public void onEvent(DomainEvent event) {
        if (!accepts(event)) {
            return;
        }
        channel.writeAndFlush(new TextWebSocketFrame(Jsons.toJson(frame(event))));
    }

    boolean accepts(DomainEvent event) {
        Set<String> filter = sessionFilter;
        if (filter.isEmpty()) {
            return true;
        }
        String sessionId = sessionOf(event);
        return sessionId == null || filter.contains(sessionId);
    }

    /** Frame layout: {@code {type, event, data, timestamp}}. */
    static Map<String, Object> frame(DomainEvent event) {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("type", event.name());
        frame.put("event", event.name());
        frame.put("data", event.payload());
        frame.put("timestamp", event.timestamp().toEpochMilli());
        return frame;
    }

    static String sessionOf(DomainEvent event) {
        Object payload = event.payload();
        if (payload instanceof Session session) {
            return session.id();
        }
        if (payload instanceof WorkQueue queue) {
            return queue.sessionId();
        }
        if (payload instanceof DomainEvents.QueueItemChange change) {
            return change.sessionId();
        }
        if (payload instanceof DomainEvents.Notification notification) {
            return notification.sessionId();
        }
        if (payload instanceof DomainEvents.Link link && event.name().startsWith("session:")) {
            return link.sessionId();
        }
        if (payload instanceof DomainEvents.Deleted deleted
                && (event.name().startsWith("session:") || event.name().startsWith("queue:"))) {
            return deleted.id();
        }
        return null;
    }
}
