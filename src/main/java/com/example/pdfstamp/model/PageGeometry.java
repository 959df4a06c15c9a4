package com.example.pdfstamp.model;

import com.example.pdfstamp.core.UnitConversions;
import lombok.Getter;
import org.apache.pdfbox.pdmodel.common.PDRectangle;

import java.awt.geom.Point2D;

/**
 * 页面几何信息
 * 页面宽高(页面单位，72/英寸)以及页面相对文档坐标原点的偏移
 */
@Getter
public class PageGeometry {
    private final float left;
    private final float bottom;
    private final float width;
    private final float height;
    private final double widthMM;
    private final double heightMM;

    public PageGeometry(float left, float bottom, float width, float height) {
        this.left = left;
        this.bottom = bottom;
        this.width = width;
        this.height = height;
        this.widthMM = UnitConversions.puToMM(width);
        this.heightMM = UnitConversions.puToMM(height);
    }

    public static PageGeometry of(PDRectangle mediaBox) {
        return new PageGeometry(
                mediaBox.getLowerLeftX(),
                mediaBox.getLowerLeftY(),
                mediaBox.getWidth(),
                mediaBox.getHeight());
    }

    public float getTop() {
        return bottom + height;
    }

    /**
     * 合成画布(y轴向下)中页面左上角的位置
     */
    public Point2D getOriginOffset() {
        return new Point2D.Double(left, height - getTop());
    }

    public PDRectangle toMediaBox() {
        return new PDRectangle(left, bottom, width, height);
    }
}
