package com.cryptobot.backend.service.execution;

public record FillNotification(String orderId, double price, double quantity) {}
