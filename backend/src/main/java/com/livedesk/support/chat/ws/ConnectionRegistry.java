package com.livedesk.support.chat.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.livedesk.support.chat.notify.Notification;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Live channels per (audience, identity).
 *
 * <p>Each entry holds an immutable list that is only ever replaced through {@code compute}/{@code computeIfPresent},
 * so a send iterates a stable snapshot while connects and disconnects race with it. An identity with no channels
 * has no entry.
 */
@Component
public class ConnectionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final ObjectMapper objectMapper;
    private final WsProperties properties;
    private final Counter sendFailures;

    private final Map<ChannelAudience, ConcurrentHashMap<String, List<Connection>>> entries =
            new EnumMap<>(ChannelAudience.class);

    public ConnectionRegistry(ObjectMapper objectMapper, WsProperties properties, MeterRegistry meterRegistry) {
        this.objectMapper = objectMapper;
        this.properties = properties;
        for (var audience : ChannelAudience.values()) {
            entries.put(audience, new ConcurrentHashMap<>());
            Gauge.builder("livedesk.ws.connections", this, r -> r.connectionCount(audience))
                    .description("Live channels per audience")
                    .tag("audience", audience.wireName())
                    .register(meterRegistry);
        }
        this.sendFailures = Counter.builder("livedesk.ws.send_failures")
                .description("Channel sends that failed and pruned the channel")
                .register(meterRegistry);
    }

    /**
     * Acknowledges the channel with a {@code channel_ready} frame, then registers it.
     * A channel whose acknowledgement cannot be sent is closed and never registered.
     *
     * @return whether the channel was registered
     */
    public boolean connect(ChannelAudience audience, String identity, WebSocketSession channel) {
        if (channel == null) return false;
        if (identity == null || identity.isBlank()) {
            log.warn("ws_connect_rejected audience={} channel={} reason=blank_identity", audience.wireName(), channel.getId());
            closeQuietly(channel, CloseStatus.POLICY_VIOLATION);
            return false;
        }

        WebSocketSession decorated = new ConcurrentWebSocketSessionDecorator(
                channel,
                properties.sendTimeLimitMs(),
                properties.bufferSizeLimitBytes()
        );

        try {
            ObjectNode ready = objectMapper.createObjectNode();
            ready.put("type", "channel_ready");
            ready.put("audience", audience.wireName());
            ready.put("identity", identity);
            ready.put("channel_id", channel.getId());
            decorated.sendMessage(new TextMessage(objectMapper.writeValueAsString(ready)));
        } catch (IOException | RuntimeException ex) {
            log.warn("ws_handshake_failed audience={} identity={} channel={} error={}",
                    audience.wireName(), identity, channel.getId(), ex.toString());
            closeQuietly(channel, CloseStatus.SERVER_ERROR);
            return false;
        }

        var connection = new Connection(audience, identity, decorated, Instant.now());
        map(audience).compute(identity, (key, current) -> {
            var next = new ArrayList<Connection>(current == null ? 1 : current.size() + 1);
            if (current != null) {
                for (var c : current) {
                    if (!c.channelId().equals(connection.channelId())) next.add(c);
                }
            }
            next.add(connection);
            return List.copyOf(next);
        });

        log.info("ws_connected audience={} identity={} channel={}", audience.wireName(), identity, channel.getId());
        return true;
    }

    /**
     * Removes one channel. Unknown identities and channels are ignored.
     */
    public void disconnect(ChannelAudience audience, String identity, WebSocketSession channel) {
        if (identity == null || channel == null) return;
        var channelId = channel.getId();
        var removed = new AtomicBoolean(false);

        map(audience).computeIfPresent(identity, (key, current) -> {
            var next = new ArrayList<Connection>(current.size());
            for (var c : current) {
                if (c.channelId().equals(channelId)) {
                    removed.set(true);
                } else {
                    next.add(c);
                }
            }
            return next.isEmpty() ? null : List.copyOf(next);
        });

        if (removed.get()) {
            log.info("ws_disconnected audience={} identity={} channel={}", audience.wireName(), identity, channelId);
        } else {
            log.debug("ws_disconnect_noop audience={} identity={} channel={}", audience.wireName(), identity, channelId);
        }
    }

    /**
     * Sends to every live channel of one identity. Channels that fail are pruned after the pass.
     *
     * @return number of channels the frame was written to
     */
    public int sendToIdentity(ChannelAudience audience, String identity, Notification notification) {
        if (identity == null || identity.isBlank()) return 0;
        return sendPayload(audience, identity, serialize(notification));
    }

    /**
     * Sends to every identity currently connected in the audience.
     *
     * @return number of channels the frame was written to
     */
    public int broadcast(ChannelAudience audience, Notification notification) {
        var message = serialize(notification);
        int delivered = 0;
        for (var identity : map(audience).keySet()) {
            delivered += sendPayload(audience, identity, message);
        }
        return delivered;
    }

    public Set<String> identities(ChannelAudience audience) {
        return Set.copyOf(map(audience).keySet());
    }

    public List<Connection> connections(ChannelAudience audience, String identity) {
        if (identity == null) return List.of();
        return map(audience).getOrDefault(identity, List.of());
    }

    public int connectionCount(ChannelAudience audience) {
        int n = 0;
        for (var list : map(audience).values()) {
            n += list.size();
        }
        return n;
    }

    @PreDestroy
    public void shutdown() {
        for (var audience : ChannelAudience.values()) {
            var map = map(audience);
            for (var list : map.values()) {
                for (var c : list) {
                    closeQuietly(c.channel(), CloseStatus.GOING_AWAY);
                }
            }
            map.clear();
        }
        log.info("ws_registry_shutdown");
    }

    private int sendPayload(ChannelAudience audience, String identity, TextMessage message) {
        var snapshot = map(audience).get(identity);
        if (snapshot == null || snapshot.isEmpty()) {
            log.debug("ws_send_dropped audience={} identity={} reason=offline", audience.wireName(), identity);
            return 0;
        }

        int delivered = 0;
        List<Connection> failed = null;
        for (var c : snapshot) {
            if (!c.channel().isOpen()) {
                if (failed == null) failed = new ArrayList<>();
                failed.add(c);
                continue;
            }
            try {
                c.channel().sendMessage(message);
                delivered++;
            } catch (IOException | RuntimeException ex) {
                sendFailures.increment();
                log.warn("ws_send_failed audience={} identity={} channel={} error={}",
                        audience.wireName(), identity, c.channelId(), ex.toString());
                if (failed == null) failed = new ArrayList<>();
                failed.add(c);
            }
        }

        if (failed != null) {
            for (var c : failed) {
                disconnect(audience, identity, c.channel());
                if (c.channel().isOpen()) {
                    closeQuietly(c.channel(), CloseStatus.SESSION_NOT_RELIABLE);
                }
            }
        }
        return delivered;
    }

    private TextMessage serialize(Notification notification) {
        try {
            return new TextMessage(objectMapper.writerFor(Notification.class).writeValueAsString(notification));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("notification_not_serializable", ex);
        }
    }

    private ConcurrentHashMap<String, List<Connection>> map(ChannelAudience audience) {
        return entries.get(audience);
    }

    private static void closeQuietly(WebSocketSession channel, CloseStatus status) {
        try {
            channel.close(status);
        } catch (IOException | RuntimeException ex) {
            log.debug("ws_close_failed channel={} error={}", channel.getId(), ex.toString());
        }
    }
}
