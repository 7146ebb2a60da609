package com.example.automation.exception;

import com.example.automation.service.JobTriggerException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 全局异常处理逻辑。
 * 业务异常映射为对应状态码；未预期的异常只记录日志，不向调用方泄露堆栈信息。
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(ResourceNotFoundException e, HttpServletRequest request) {
        log.debug("[NotFound] Path: {}, {}", request.getRequestURI(), e.getMessage());
        return error(HttpStatus.NOT_FOUND, e.getMessage(), request);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNoResource(NoResourceFoundException e, HttpServletRequest request) {
        log.debug("[ResourceNotFound] Path: {}", request.getRequestURI());
        return error(HttpStatus.NOT_FOUND, "Resource not found", request);
    }

    @ExceptionHandler({InvalidRequestException.class, MissingRequestHeaderException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception e, HttpServletRequest request) {
        log.info("[BadRequest] Path: {}, {}", request.getRequestURI(), e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e.getMessage(), request);
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<Map<String, Object>> handleConflict(ConflictException e, HttpServletRequest request) {
        log.info("[Conflict] Path: {}, {}", request.getRequestURI(), e.getMessage());
        return error(HttpStatus.CONFLICT, e.getMessage(), request);
    }

    /**
     * 手动运行时任务无法启动（无可用目标或已有任务在运行）。
     */
    @ExceptionHandler(JobTriggerException.class)
    public ResponseEntity<Map<String, Object>> handleTriggerFailure(JobTriggerException e, HttpServletRequest request) {
        log.info("[TriggerFailed] Path: {}, {}", request.getRequestURI(), e.getMessage());
        return error(HttpStatus.CONFLICT, e.getMessage(), request);
    }

    /**
     * 兜底处理所有未捕获异常。
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleException(Exception e, HttpServletRequest request) {
        log.error("[GlobalException] Path: {}, Error: {}", request.getRequestURI(), e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred. Please contact administrator.", request);
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String message, HttpServletRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("message", message);
        body.put("path", request.getRequestURI());
        return new ResponseEntity<>(body, status);
    }
}
