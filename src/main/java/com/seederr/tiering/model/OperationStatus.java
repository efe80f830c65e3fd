package com.seederr.tiering.model;

public enum OperationStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED
}
