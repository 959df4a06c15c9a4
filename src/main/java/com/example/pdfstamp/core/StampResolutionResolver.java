package com.example.pdfstamp.core;

import com.example.pdfstamp.exception.ConfigException;
import com.example.pdfstamp.exception.ResourceException;
import com.example.pdfstamp.model.DensitySource;
import com.example.pdfstamp.model.StampResolution;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.NodeList;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.metadata.IIOMetadataFormatImpl;
import javax.imageio.metadata.IIOMetadataNode;
import javax.imageio.stream.ImageInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.OptionalDouble;

/**
 * 图章DPI解析
 *
 * 优先级：显式指定 > 图片元数据 > 默认72 DPI。
 * 元数据缺失或格式错误时使用默认值，并以警告形式报告，不作为错误抛出。
 */
@Slf4j
@Component
public class StampResolutionResolver {

    public static final double FALLBACK_DENSITY = 72.0;

    /**
     * @param stamp    图章文件
     * @param override 显式指定的DPI，null表示未指定
     */
    public StampResolution resolve(Path stamp, Double override) {
        if (override != null) {
            if (!(override > 0) || override.isInfinite()) {
                throw new ConfigException("图章DPI必须大于0: " + override);
            }
            log.info("使用指定的图章DPI: {}", String.format("%.1f", override));
            return new StampResolution(override, DensitySource.EXPLICIT);
        }

        if (stamp == null || !Files.isReadable(stamp)) {
            throw new ResourceException("图章文件不可读: " + stamp);
        }

        OptionalDouble probed = probeDensity(stamp);
        if (probed.isPresent()) {
            log.info("图章DPI(元数据): {}", String.format("%.1f", probed.getAsDouble()));
            return new StampResolution(probed.getAsDouble(), DensitySource.METADATA);
        }

        log.warn("图章未包含有效的DPI信息，使用默认值 {}，图章的实际尺寸可能不符合预期", FALLBACK_DENSITY);
        return new StampResolution(FALLBACK_DENSITY, DensitySource.FALLBACK);
    }

    /**
     * 读取标准元数据中的HorizontalPixelSize(毫米/像素)并换算成DPI
     */
    OptionalDouble probeDensity(Path stamp) {
        try (ImageInputStream iis = ImageIO.createImageInputStream(stamp.toFile())) {
            if (iis == null) {
                throw new ResourceException("无法打开图章文件: " + stamp);
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(iis);
            if (!readers.hasNext()) {
                throw new ResourceException("不支持的图章图片格式: " + stamp);
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(iis);
                IIOMetadata meta = reader.getImageMetadata(0);
                return densityFromMetadata(meta);
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            log.debug("读取图章元数据失败: {}", e.getMessage());
            return OptionalDouble.empty();
        }
    }

    static OptionalDouble densityFromMetadata(IIOMetadata meta) {
        if (meta == null || !meta.isStandardMetadataFormatSupported()) {
            return OptionalDouble.empty();
        }
        IIOMetadataNode root = (IIOMetadataNode) meta.getAsTree(IIOMetadataFormatImpl.standardMetadataFormatName);
        return densityFromTree(root);
    }

    static OptionalDouble densityFromTree(IIOMetadataNode root) {
        NodeList nodes = root.getElementsByTagName("HorizontalPixelSize");
        if (nodes.getLength() == 0) {
            return OptionalDouble.empty();
        }
        String value = ((IIOMetadataNode) nodes.item(0)).getAttribute("value");
        try {
            double mmPerPixel = Double.parseDouble(value);
            double dpi = UnitConversions.MM_PER_INCH / mmPerPixel;
            if (!(dpi > 0) || Double.isInfinite(dpi)) {
                log.debug("图章元数据中的像素尺寸无效: {}", value);
                return OptionalDouble.empty();
            }
            return OptionalDouble.of(dpi);
        } catch (NumberFormatException e) {
            log.debug("图章元数据中的像素尺寸无法解析: {}", value);
            return OptionalDouble.empty();
        }
    }
}
