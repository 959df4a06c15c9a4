package com.example.pdfstamp.model;

import lombok.Builder;
import lombok.Getter;

import java.nio.file.Path;

/**
 * 一次盖章任务的参数
 * stampDpi为null表示从图章元数据读取
 */
@Getter
@Builder(toBuilder = true)
public class StampJob {
    private final Path input;
    private final Path stamp;
    private final Double stampDpi;
    @Builder.Default
    private final int page = 1;
    @Builder.Default
    private final double x = 0.0;
    @Builder.Default
    private final double y = 0.0;
    @Builder.Default
    private final double scale = 1.0;
    private final Path output;
}
