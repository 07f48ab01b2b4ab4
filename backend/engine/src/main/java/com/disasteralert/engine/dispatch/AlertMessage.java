package com.disasteralert.engine.dispatch;

public record AlertMessage(String subject, String body) {
}
