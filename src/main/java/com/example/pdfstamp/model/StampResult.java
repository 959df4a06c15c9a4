package com.example.pdfstamp.model;

import lombok.Getter;

import java.util.List;

/**
 * 盖章结果
 * 包含输出文件名、实际盖章的页码、图章分辨率和提示信息
 */
@Getter
public class StampResult {
    private final String fileName;
    private final int pageNumber;
    private final StampResolution resolution;
    private final List<String> warnings;
    private final long totalTime;

    public StampResult(String fileName, int pageNumber, StampResolution resolution,
                       List<String> warnings, long totalTime) {
        this.fileName = fileName;
        this.pageNumber = pageNumber;
        this.resolution = resolution;
        this.warnings = warnings;
        this.totalTime = totalTime;
    }
}
