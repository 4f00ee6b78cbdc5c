package com.metering.fetch.storage.jpa;

public enum RecoveryStatus {
    PENDING,
    RECOVERED,
    ABANDONED
}
