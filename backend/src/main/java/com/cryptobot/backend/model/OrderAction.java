package com.cryptobot.backend.model;

public enum OrderAction {
    OPEN,
    CLOSE
}
