package com.acme.notification.sample;

public record Contact(String type, String value) {}
