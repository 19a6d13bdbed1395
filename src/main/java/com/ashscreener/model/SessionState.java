package com.ashscreener.model;

public enum SessionState {
    IDLE,
    RUNNING,
    COMPLETED,
    FAILED
}
