package com.example.pdfstamp.model;

import lombok.Getter;

/**
 * 某一时刻的图章摆放状态(不可变)
 * 位置单位为毫米，相对页面左上角，x向右、y向下
 */
@Getter
public class PlacementSnapshot {
    private final double xMM;
    private final double yMM;
    private final double dragDxMM;
    private final double dragDyMM;
    private final double scale;

    public PlacementSnapshot(double xMM, double yMM, double dragDxMM, double dragDyMM, double scale) {
        this.xMM = xMM;
        this.yMM = yMM;
        this.dragDxMM = dragDxMM;
        this.dragDyMM = dragDyMM;
        this.scale = scale;
    }

    public static PlacementSnapshot at(double xMM, double yMM, double scale) {
        return new PlacementSnapshot(xMM, yMM, 0.0, 0.0, scale);
    }

    /**
     * 当前位置 = 已提交位置 + 拖拽偏移
     */
    public double getCurrentXMM() {
        return xMM + dragDxMM;
    }

    public double getCurrentYMM() {
        return yMM + dragDyMM;
    }

    public boolean hasDragOffset() {
        return dragDxMM != 0.0 || dragDyMM != 0.0;
    }
}
