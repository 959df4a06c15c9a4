package com.example.pdfstamp.model;

import lombok.Getter;

/**
 * 图章分辨率
 * 启动时解析一次，之后不再变化
 */
@Getter
public class StampResolution {
    private final double densityPerInch;
    private final DensitySource source;

    public StampResolution(double densityPerInch, DensitySource source) {
        if (!(densityPerInch > 0) || Double.isInfinite(densityPerInch)) {
            throw new IllegalArgumentException("DPI必须为正数: " + densityPerInch);
        }
        this.densityPerInch = densityPerInch;
        this.source = source;
    }

    /**
     * 是否使用了默认DPI(图章元数据缺失或无法解析)，此时图章的物理尺寸可能与预期不符
     */
    public boolean isDegraded() {
        return source == DensitySource.FALLBACK;
    }

    @Override
    public String toString() {
        return String.format("%.1f dpi (%s)", densityPerInch, source);
    }
}
