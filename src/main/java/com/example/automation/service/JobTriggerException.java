package com.example.automation.service;

/**
 * 任务触发失败。
 */
public class JobTriggerException extends Exception {

    public JobTriggerException(String message) {
        super(message);
    }

    public JobTriggerException(String message, Throwable cause) {
        super(message, cause);
    }
}
