package com.example.automation.model;

/**
 * 执行记录的触发来源。
 */
public enum TriggerSource {
    SCHEDULED,
    MANUAL
}
