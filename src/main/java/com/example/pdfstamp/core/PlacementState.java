package com.example.pdfstamp.core;

import com.example.pdfstamp.exception.ConfigException;
import com.example.pdfstamp.model.PlacementSnapshot;

/**
 * 图章摆放状态
 *
 * 只有一个写入方(拖拽状态机或程序化设置)，读取方通过{@link #snapshot()}获得
 * 完整的快照。拖拽偏移只在拖拽进行中非零，提交时并入位置并清零。
 */
public class PlacementState {

    private volatile PlacementSnapshot current;

    public PlacementState(double xMM, double yMM, double scale) {
        checkScale(scale);
        this.current = PlacementSnapshot.at(xMM, yMM, scale);
    }

    public PlacementSnapshot snapshot() {
        return current;
    }

    public double[] currentPosition() {
        PlacementSnapshot s = current;
        return new double[]{s.getCurrentXMM(), s.getCurrentYMM()};
    }

    public double getScale() {
        return current.getScale();
    }

    public synchronized void beginDrag() {
        PlacementSnapshot s = current;
        current = new PlacementSnapshot(s.getXMM(), s.getYMM(), 0.0, 0.0, s.getScale());
    }

    public synchronized void updateDrag(double dxMM, double dyMM) {
        PlacementSnapshot s = current;
        current = new PlacementSnapshot(s.getXMM(), s.getYMM(), dxMM, dyMM, s.getScale());
    }

    public synchronized void commitDrag() {
        PlacementSnapshot s = current;
        if (!s.hasDragOffset()) {
            return;
        }
        current = PlacementSnapshot.at(s.getCurrentXMM(), s.getCurrentYMM(), s.getScale());
    }

    public synchronized void setScale(double scale) {
        checkScale(scale);
        PlacementSnapshot s = current;
        current = new PlacementSnapshot(s.getXMM(), s.getYMM(), s.getDragDxMM(), s.getDragDyMM(), scale);
    }

    public synchronized void setPosition(double xMM, double yMM) {
        PlacementSnapshot s = current;
        current = new PlacementSnapshot(xMM, yMM, s.getDragDxMM(), s.getDragDyMM(), s.getScale());
    }

    private static void checkScale(double scale) {
        if (!(scale > 0) || Double.isInfinite(scale)) {
            throw new ConfigException("缩放比例必须大于0: " + scale);
        }
    }
}
