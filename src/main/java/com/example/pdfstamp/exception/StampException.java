package com.example.pdfstamp.exception;

/**
 * 盖章流程异常的基类
 */
public class StampException extends RuntimeException {

    public StampException(String message) {
        super(message);
    }

    public StampException(String message, Throwable cause) {
        super(message, cause);
    }
}
