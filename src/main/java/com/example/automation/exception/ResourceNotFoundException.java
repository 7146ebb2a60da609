package com.example.automation.exception;

/**
 * 资源不存在（404）。
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
