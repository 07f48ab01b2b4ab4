package com.disasteralert.core.model;

public record Subscription(String location, String email) {
}
