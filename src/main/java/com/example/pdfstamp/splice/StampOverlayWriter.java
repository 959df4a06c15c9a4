package com.example.pdfstamp.splice;

import com.example.pdfstamp.core.TransformCompositor;
import com.example.pdfstamp.model.PageGeometry;
import com.example.pdfstamp.model.PlacementSnapshot;
import com.example.pdfstamp.model.RenderTarget;
import com.example.pdfstamp.model.StampResolution;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.pdfbox.util.Matrix;
import org.springframework.stereotype.Component;

import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 * 生成只含图章的单页叠加文档，页面尺寸与目标页一致
 */
@Slf4j
@Component
public class StampOverlayWriter {

    public void write(
            PageGeometry geometry,
            PlacementSnapshot placement,
            StampResolution resolution,
            BufferedImage stamp,
            Path output) throws IOException {

        try (PDDocument doc = new PDDocument()) {
            PDPage page = new PDPage(geometry.toMediaBox());
            doc.addPage(page);

            PDImageXObject image = LosslessFactory.createFromImage(doc, stamp);
            AffineTransform at = imageMatrix(geometry, placement, resolution, stamp.getWidth(), stamp.getHeight());

            try (PDPageContentStream contentStream = new PDPageContentStream(doc, page)) {
                contentStream.drawImage(image, new Matrix(at));
            }

            doc.save(output.toFile());
        }
        log.debug("图章层已生成 ({}×{} pt) -> {}", geometry.getWidth(), geometry.getHeight(), output.getFileName());
    }

    /**
     * PDF中图片绘制在单位正方形内，y轴向上；合成画布y轴向下。
     * 结果 = 画布到PDF的翻转 × 图章变换 × 单位正方形到图章像素
     */
    static AffineTransform imageMatrix(
            PageGeometry geometry,
            PlacementSnapshot placement,
            StampResolution resolution,
            int pixelWidth,
            int pixelHeight) {

        AffineTransform at = new AffineTransform(1, 0, 0, -1, 0, geometry.getHeight());
        at.concatenate(TransformCompositor.computeTransform(placement, RenderTarget.page(geometry), resolution));
        at.concatenate(new AffineTransform(pixelWidth, 0, 0, -pixelHeight, 0, pixelHeight));
        return at;
    }
}
