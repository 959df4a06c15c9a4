package com.example.pdfstamp.core;

import lombok.extern.slf4j.Slf4j;

/**
 * 拖拽状态机
 *
 * IDLE --按下--> DRAGGING --移动--> DRAGGING --抬起--> IDLE
 *
 * 锚点记录在预览画布像素坐标中，移动时按预览DPI换算成毫米写入摆放状态。
 * 拖拽中再次按下会被忽略，避免重复设置锚点。
 */
@Slf4j
public class DragStateMachine {

    public enum Phase {
        IDLE,
        DRAGGING
    }

    private final PlacementState placement;
    private final double previewDensity;
    private final RedrawListener redrawListener;

    private Phase phase = Phase.IDLE;
    private double anchorX;
    private double anchorY;

    public DragStateMachine(PlacementState placement, double previewDensity, RedrawListener redrawListener) {
        UnitConversions.checkDensity(previewDensity);
        this.placement = placement;
        this.previewDensity = previewDensity;
        this.redrawListener = redrawListener;
    }

    public Phase getPhase() {
        return phase;
    }

    /**
     * @return 事件是否被接受
     */
    public boolean pointerDown(double x, double y) {
        if (phase == Phase.DRAGGING) {
            log.debug("拖拽进行中，忽略按下事件 ({}, {})", x, y);
            return false;
        }
        anchorX = x;
        anchorY = y;
        placement.beginDrag();
        phase = Phase.DRAGGING;
        return true;
    }

    public boolean pointerMove(double x, double y) {
        if (phase != Phase.DRAGGING) {
            return false;
        }
        double dxMM = UnitConversions.pixelsToMM(x - anchorX, previewDensity);
        double dyMM = UnitConversions.pixelsToMM(y - anchorY, previewDensity);
        placement.updateDrag(dxMM, dyMM);
        redrawListener.redrawRequested();
        return true;
    }

    public boolean pointerUp() {
        if (phase != Phase.DRAGGING) {
            return false;
        }
        placement.commitDrag();
        phase = Phase.IDLE;
        redrawListener.redrawRequested();
        return true;
    }
}
