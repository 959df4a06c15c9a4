package com.example.pdfstamp.service;

import com.example.pdfstamp.core.TransformCompositor;
import com.example.pdfstamp.core.UnitConversions;
import com.example.pdfstamp.exception.ResourceException;
import com.example.pdfstamp.model.PageGeometry;
import com.example.pdfstamp.model.PlacementSnapshot;
import com.example.pdfstamp.model.RenderTarget;
import com.example.pdfstamp.model.StampResolution;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;

/**
 * 预览渲染
 * 页面底图只渲染一次，每次重绘在底图副本上按当前摆放状态画出图章
 */
@Slf4j
@Service
public class PreviewRenderService {

    @Value("${stamp.preview.max-width-px:1536}")
    private int maxWidthPx;

    @Value("${stamp.preview.max-height-px:864}")
    private int maxHeightPx;

    /**
     * 使整页能放入预览区域的最大整数DPI，至少为1
     */
    public int previewDensity(PageGeometry geometry) {
        return previewDensity(geometry, maxWidthPx, maxHeightPx);
    }

    public static int previewDensity(PageGeometry geometry, int maxWidthPx, int maxHeightPx) {
        double dpiWidth = maxWidthPx / (geometry.getWidthMM() / UnitConversions.MM_PER_INCH);
        double dpiHeight = maxHeightPx / (geometry.getHeightMM() / UnitConversions.MM_PER_INCH);
        return Math.max(1, (int) Math.min(dpiWidth, dpiHeight));
    }

    public BufferedImage renderPage(Path document, int pageNumber, int density) {
        try (PDDocument doc = PDDocument.load(document.toFile())) {
            PDFRenderer renderer = new PDFRenderer(doc);
            renderer.setSubsamplingAllowed(false);
            BufferedImage image = renderer.renderImageWithDPI(pageNumber - 1, density, ImageType.RGB);
            log.debug("预览底图渲染完成: 第 {} 页 (DPI: {}, {}×{})",
                    pageNumber, density, image.getWidth(), image.getHeight());
            return image;
        } catch (IOException e) {
            throw new ResourceException("渲染预览失败: " + document.getFileName(), e);
        }
    }

    /**
     * 在底图副本上绘制图章，变换与最终合成使用同一推导
     */
    public BufferedImage compose(
            BufferedImage pageImage,
            BufferedImage stamp,
            PlacementSnapshot placement,
            StampResolution resolution,
            int density) {

        BufferedImage canvas = new BufferedImage(
                pageImage.getWidth(), pageImage.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = canvas.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(pageImage, 0, 0, null);
            g.drawImage(stamp,
                    TransformCompositor.computeTransform(placement, RenderTarget.preview(density), resolution),
                    null);
        } finally {
            g.dispose();
        }
        return canvas;
    }

    public byte[] toPng(BufferedImage image) {
        ByteArrayOutputStream baos = new ByteArrayOutputStream(256 * 1024);
        try {
            ImageIO.write(image, "PNG", baos);
        } catch (IOException e) {
            throw new IllegalStateException("PNG编码失败", e);
        }
        return baos.toByteArray();
    }
}
