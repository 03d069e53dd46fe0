package com.acme.notification.core;

public record HandlerResult(boolean success) {

    private static final HandlerResult SUCCESS = new HandlerResult(true);
    private static final HandlerResult FAILURE = new HandlerResult(false);

    public static HandlerResult ok() {
        return SUCCESS;
    }

    public static HandlerResult failed() {
        return FAILURE;
    }
}
