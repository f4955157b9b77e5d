package com.marketpulse.core.model;

public enum SessionStatus {
    ACTIVE,
    COMPLETED,
    FAILED
}
