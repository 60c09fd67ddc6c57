package com.example.tracepipeline.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 全局异常处理逻辑
 * 所有未捕获的异常都以 JSON 返回，不向调用方泄露堆栈信息。
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(NoResourceFoundException e, HttpServletRequest request) {
        log.debug("[ResourceNotFound] Path: {}", request.getRequestURI());
        return error(HttpStatus.NOT_FOUND, "Resource not found.", request);
    }

    /**
     * 请求参数非法（未知任务类型、通道、负数选项等）
     */
    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception e, HttpServletRequest request) {
        log.debug("[BadRequest] Path: {}, Error: {}", request.getRequestURI(), e.getMessage());
        String message = e instanceof HttpMessageNotReadableException ? "Malformed JSON request body" : e.getMessage();
        return error(HttpStatus.BAD_REQUEST, message, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleException(Exception e, HttpServletRequest request) {
        log.error("[GlobalException] Path: {}, Error: {}", request.getRequestURI(), e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred. Please contact administrator.", request);
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message,
                                                             HttpServletRequest request) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("status", status.value());
        error.put("error", status.getReasonPhrase());
        error.put("message", message);
        error.put("path", request.getRequestURI());
        return new ResponseEntity<>(error, status);
    }
}
