package com.livedesk.support.chat.ws;

public enum ChannelAudience {
    CUSTOMER("customer"),
    AGENT("agent");

    private final String wireName;

    ChannelAudience(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
