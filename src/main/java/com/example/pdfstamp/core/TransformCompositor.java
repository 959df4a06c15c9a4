package com.example.pdfstamp.core;

import com.example.pdfstamp.model.PlacementSnapshot;
import com.example.pdfstamp.model.RenderTarget;
import com.example.pdfstamp.model.StampResolution;

import java.awt.geom.AffineTransform;

/**
 * 计算图章像素坐标到目标画布像素坐标的仿射变换
 *
 * 预览画布和最终合成画布使用完全相同的推导，只有画布DPI和原点偏移不同，
 * 以保证预览与输出一致。
 */
public final class TransformCompositor {

    private TransformCompositor() {
    }

    /**
     * @param placement  摆放状态快照
     * @param target     目标画布
     * @param resolution 图章分辨率
     * @return 先平移、后等比缩放的变换，作用于图章原始像素
     */
    public static AffineTransform computeTransform(
            PlacementSnapshot placement,
            RenderTarget target,
            StampResolution resolution) {

        double targetDpi = target.getDensityPerInch();
        UnitConversions.checkDensity(targetDpi);

        double drawScale = effectiveScale(placement, target, resolution);
        double tx = UnitConversions.mmToPixels(placement.getCurrentXMM(), targetDpi) + target.getOriginX();
        double ty = UnitConversions.mmToPixels(placement.getCurrentYMM(), targetDpi) + target.getOriginY();

        AffineTransform at = AffineTransform.getTranslateInstance(tx, ty);
        at.scale(drawScale, drawScale);
        return at;
    }

    /**
     * 图章像素到画布像素的缩放系数
     */
    public static double effectiveScale(
            PlacementSnapshot placement,
            RenderTarget target,
            StampResolution resolution) {
        return placement.getScale() * (1.0 / resolution.getDensityPerInch()) * target.getDensityPerInch();
    }
}
