package com.example.automation.exception;

/**
 * 请求参数不合法（400），例如无效的时区或超出范围的日期。
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
