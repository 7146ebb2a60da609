package com.example.automation.model;

/**
 * 投递状态。PENDING 之外均为终态。
 */
public enum DeliveryStatus {
    PENDING,
    SUCCESS,
    FAILED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
