package com.livedesk.support.common.config;

import com.livedesk.support.chat.ws.ChannelAudience;
import com.livedesk.support.chat.ws.ChannelWebSocketHandler;
import com.livedesk.support.chat.ws.ConnectionRegistry;
import com.livedesk.support.chat.ws.WsProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final ConnectionRegistry connectionRegistry;
    private final WsProperties properties;

    public WebSocketConfig(ConnectionRegistry connectionRegistry, WsProperties properties) {
        this.connectionRegistry = connectionRegistry;
        this.properties = properties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        var origins = properties.allowedOrigins().toArray(String[]::new);
        registry.addHandler(new ChannelWebSocketHandler(ChannelAudience.CUSTOMER, connectionRegistry), "/ws/customer/*")
                .setAllowedOriginPatterns(origins);
        registry.addHandler(new ChannelWebSocketHandler(ChannelAudience.AGENT, connectionRegistry), "/ws/agent/*")
                .setAllowedOriginPatterns(origins);
    }
}
