package com.example.pdfstamp.core;

/**
 * 坐标单位换算
 *
 * 涉及三种长度单位：
 *   页面单位(PU)：PDF内部单位，72/英寸
 *   毫米(MM)：用户输入的物理长度
 *   像素：给定DPI下的像素，图章图片、预览画布各自有自己的DPI
 */
public final class UnitConversions {

    public static final double MM_PER_INCH = 25.4;
    public static final double PU_PER_INCH = 72.0;

    private UnitConversions() {
    }

    public static double mmToPU(double mm) {
        return mm / MM_PER_INCH * PU_PER_INCH;
    }

    public static double puToMM(double pu) {
        return pu / PU_PER_INCH * MM_PER_INCH;
    }

    public static double mmToPixels(double mm, double densityPerInch) {
        checkDensity(densityPerInch);
        return mm / MM_PER_INCH * densityPerInch;
    }

    public static double pixelsToMM(double pixels, double densityPerInch) {
        checkDensity(densityPerInch);
        return pixels * MM_PER_INCH / densityPerInch;
    }

    /**
     * DPI必须为有限正数，否则属于调用方的编程错误
     */
    public static void checkDensity(double densityPerInch) {
        if (!(densityPerInch > 0) || Double.isInfinite(densityPerInch)) {
            throw new IllegalArgumentException("DPI必须为有限正数: " + densityPerInch);
        }
    }
}
