package com.livedesk.support.chat.ws;

import org.springframework.web.socket.WebSocketSession;

import java.time.Instant;

/**
 * One live channel owned by an (audience, identity) pair.
 */
public record Connection(ChannelAudience audience, String identity, WebSocketSession channel, Instant connectedAt) {

    public String channelId() {
        return channel.getId();
    }
}
