package com.example.pdfstamp.model;

/**
 * 预览画布上的指针事件
 */
public enum PointerEventType {
    DOWN,
    MOVE,
    UP
}
