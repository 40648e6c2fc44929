package com.cryptobot.backend.service.execution;

import java.util.concurrent.CompletableFuture;

public record OrderHandle(String orderId, CompletableFuture<FillNotification> fill) {}
