package com.example.automation.model;

/**
 * 调度触发结果。
 */
public enum RunStatus {
    COMPLETED,
    FAILED
}
