package com.example.automation.exception;

/**
 * 与现有数据冲突（409）。
 */
public class ConflictException extends RuntimeException {

    public ConflictException(String message) {
        super(message);
    }
}
