package com.example.pdfstamp.core;

/**
 * 摆放状态变化后请求重绘
 */
@FunctionalInterface
public interface RedrawListener {

    void redrawRequested();
}
