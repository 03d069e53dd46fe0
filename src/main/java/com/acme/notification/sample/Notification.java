package com.acme.notification.sample;

import java.util.List;

public record Notification(
    String id,
    String subject,
    String message,
    List<Contact> contacts
) {}
