package com.acme.notification.core;

import java.util.Map;

public record RetryDecision(String targetQueue, Map<String, Object> headers) {}
