package com.livedesk.support.common.api;

public class NotFoundException extends RuntimeException {
    public NotFoundException(String code) {
        super(code);
    }
}
