package com.example.pdfstamp.core;

import com.example.pdfstamp.exception.ResourceException;
import lombok.extern.slf4j.Slf4j;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 图章图片解码
 */
@Slf4j
public final class StampImageLoader {

    private StampImageLoader() {
    }

    /**
     * @throws ResourceException 文件不可读、格式无法识别或图片尺寸为0
     */
    public static BufferedImage load(Path stamp) {
        if (stamp == null || !Files.isReadable(stamp)) {
            throw new ResourceException("图章文件不可读: " + stamp);
        }
        BufferedImage image;
        try {
            image = ImageIO.read(stamp.toFile());
        } catch (IOException e) {
            throw new ResourceException("图章图片解码失败: " + stamp, e);
        }
        if (image == null) {
            throw new ResourceException("不支持的图章图片格式: " + stamp);
        }
        if (image.getWidth() <= 0 || image.getHeight() <= 0) {
            throw new ResourceException("图章图片尺寸为0: " + stamp);
        }
        log.debug("图章已加载: {} ({}×{})", stamp.getFileName(), image.getWidth(), image.getHeight());
        return image;
    }
}
