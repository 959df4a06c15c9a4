package com.example.pdfstamp.model;

import lombok.Getter;

import java.awt.geom.Point2D;

/**
 * 绘制目标画布
 * 每次渲染时新建，用完即弃
 */
@Getter
public class RenderTarget {
    private final double densityPerInch;
    private final double originX;
    private final double originY;

    public RenderTarget(double densityPerInch, double originX, double originY) {
        this.densityPerInch = densityPerInch;
        this.originX = originX;
        this.originY = originY;
    }

    /**
     * 预览画布：页面左上角即画布原点
     */
    public static RenderTarget preview(double densityPerInch) {
        return new RenderTarget(densityPerInch, 0.0, 0.0);
    }

    /**
     * 最终合成画布：页面单位(72/英寸)，原点取自页面偏移
     */
    public static RenderTarget page(PageGeometry geometry) {
        Point2D origin = geometry.getOriginOffset();
        return new RenderTarget(72.0, origin.getX(), origin.getY());
    }
}
