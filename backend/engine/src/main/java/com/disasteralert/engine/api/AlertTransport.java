package com.disasteralert.engine.api;

public interface AlertTransport {
    /**
     * @return true if the message was handed off successfully
     */
    boolean send(String recipient, String subject, String body);
}
