package com.example.pdfstamp.splice;

/**
 * 页面拼接流程的各个步骤
 */
public enum SpliceStep {
    EXTRACT_TARGET("提取目标页"),
    RENDER_OVERLAY("绘制图章层"),
    MERGE_OVERLAY("合并图章层"),
    EXTRACT_PRE("提取目标页之前的页面"),
    EXTRACT_POST("提取目标页之后的页面"),
    CONCATENATE("拼接输出文档"),
    MOVE_INTO_PLACE("写入输出文件");

    private final String description;

    SpliceStep(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
