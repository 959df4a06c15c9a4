package com.example.pdfstamp.splice;

/**
 * 拼接步骤开始时回调
 */
@FunctionalInterface
public interface SpliceProgressListener {

    SpliceProgressListener NONE = step -> { };

    void stepStarted(SpliceStep step);
}
