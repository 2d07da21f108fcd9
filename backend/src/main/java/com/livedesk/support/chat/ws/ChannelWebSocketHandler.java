package com.livedesk.support.chat.ws;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

/**
 * One handler per audience. The identity is the last path segment, e.g. {@code /ws/agent/A1}.
 * Channels are push-only; inbound frames are ignored.
 */
public class ChannelWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(ChannelWebSocketHandler.class);

    private final ChannelAudience audience;
    private final ConnectionRegistry registry;

    public ChannelWebSocketHandler(ChannelAudience audience, ConnectionRegistry registry) {
        this.audience = audience;
        this.registry = registry;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        registry.connect(audience, identityOf(session), session);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        log.debug("ws_inbound_ignored audience={} channel={} length={}",
                audience.wireName(), session.getId(), message.getPayloadLength());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.info("ws_transport_error audience={} channel={} error={}",
                audience.wireName(), session.getId(), exception.toString());
        registry.disconnect(audience, identityOf(session), session);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        registry.disconnect(audience, identityOf(session), session);
    }

    static String identityOf(WebSocketSession session) {
        return identityFromUri(session.getUri());
    }

    static String identityFromUri(URI uri) {
        if (uri == null) return null;
        var path = uri.getRawPath();
        if (path == null || path.isBlank()) return null;
        var trimmed = path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
        var idx = trimmed.lastIndexOf('/');
        var raw = idx >= 0 ? trimmed.substring(idx + 1) : trimmed;
        if (raw.isBlank()) return null;
        return URLDecoder.decode(raw, StandardCharsets.UTF_8).trim();
    }
}
