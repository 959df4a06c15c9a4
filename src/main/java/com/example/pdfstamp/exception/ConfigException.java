package com.example.pdfstamp.exception;

/**
 * 参数错误：缩放比例不大于0、页码为0、DPI不大于0等
 * 在任何状态修改和文件写入之前抛出
 */
public class ConfigException extends StampException {

    public ConfigException(String message) {
        super(message);
    }
}
