package com.disasteralert.engine.dispatch;

public record DeliveryResult(String recipient, boolean success, String message) {
    public static DeliveryResult success(String recipient) {
        return new DeliveryResult(recipient, true, "delivered");
    }

    public static DeliveryResult failure(String recipient, String message) {
        return new DeliveryResult(recipient, false, message);
    }
}
