package com.example.pdfstamp.exception;

/**
 * 资源错误：PDF无法读取、图章图片无法解码
 */
public class ResourceException extends StampException {

    public ResourceException(String message) {
        super(message);
    }

    public ResourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
