package com.example.pdfstamp.splice;

import com.example.pdfstamp.exception.CollaboratorException;
import com.example.pdfstamp.exception.ConfigException;
import com.example.pdfstamp.exception.ResourceException;
import com.example.pdfstamp.model.PageGeometry;
import com.example.pdfstamp.model.PlacementSnapshot;
import com.example.pdfstamp.model.StampResolution;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * 页面拼接
 *
 * 流程：
 *   1. 提取目标页为单页文档
 *   2. 生成同尺寸的图章层
 *   3. 将图章层合并到目标页
 *   4. 多页文档：提取目标页前后的页面，按 [前, 盖章页, 后] 拼接
 *
 * 中间文件放在临时目录中，任一步骤失败都会删除；输出先写到目标旁的临时文件，
 * 全部成功后再移动到目标路径，失败时不会留下不完整的输出。
 */
@Slf4j
@Component
public class PageSpliceOrchestrator {

    private final PagedDocumentEngine engine;
    private final StampOverlayWriter overlayWriter;

    public PageSpliceOrchestrator(PagedDocumentEngine engine, StampOverlayWriter overlayWriter) {
        this.engine = engine;
        this.overlayWriter = overlayWriter;
    }

    /**
     * 页码从1开始；负数从末尾倒数，按 numPages - |page| 换算(-1对应倒数第二页)
     *
     * @throws ConfigException 页码为0或换算后超出范围
     */
    public static int resolvePageNumber(int page, int numPages) {
        if (page == 0) {
            throw new ConfigException("页码不能为0");
        }
        int pageNum = page > 0 ? page : numPages - Math.abs(page);
        if (pageNum < 1 || pageNum > numPages) {
            throw new ConfigException(String.format("页码 %d 超出范围，文档共 %d 页", page, numPages));
        }
        return pageNum;
    }

    public int pageCount(Path document) {
        int numPages;
        try {
            numPages = engine.pageCount(document);
        } catch (IOException e) {
            throw new ResourceException("无法读取PDF文件: " + document.getFileName(), e);
        }
        if (numPages < 1) {
            throw new ResourceException("PDF文件为空: " + document.getFileName());
        }
        return numPages;
    }

    public PageGeometry pageGeometry(Path document, int pageNumber) {
        try {
            return engine.pageGeometry(document, pageNumber);
        } catch (IOException e) {
            throw new ResourceException("无法读取PDF页面尺寸: " + document.getFileName(), e);
        }
    }

    /**
     * 将图章盖到指定页，输出完整文档
     *
     * @param document   原始文档
     * @param page       页码(见{@link #resolvePageNumber})
     * @param placement  开始拼接时读取的摆放状态快照
     * @param resolution 图章分辨率
     * @param stamp      图章图片
     * @param output     输出路径
     * @param listener   步骤进度回调
     * @return 实际盖章的页码
     */
    public int splicePage(
            Path document,
            int page,
            PlacementSnapshot placement,
            StampResolution resolution,
            BufferedImage stamp,
            Path output,
            SpliceProgressListener listener) {

        int numPages = pageCount(document);
        int pageNum = resolvePageNumber(page, numPages);
        PageGeometry geometry = pageGeometry(document, pageNum);

        log.info("开始拼接: 第 {}/{} 页, 位置 ({}, {}) mm, 缩放 {}",
                pageNum, numPages,
                String.format("%.1f", placement.getCurrentXMM()),
                String.format("%.1f", placement.getCurrentYMM()),
                String.format("%.3f", placement.getScale()));

        Path staging = output.toAbsolutePath().resolveSibling(
                "." + output.getFileName() + "." + UUID.randomUUID() + ".tmp");

        try (SpliceWorkspace workspace = openWorkspace()) {
            Path targetPage = workspace.file("page.pdf");
            Path overlay = workspace.file("overlay.pdf");
            Path stamped = numPages == 1 ? staging : workspace.file("stamped.pdf");

            run(SpliceStep.EXTRACT_TARGET, listener,
                    () -> engine.extractRange(document, pageNum, pageNum, targetPage));
            run(SpliceStep.RENDER_OVERLAY, listener,
                    () -> overlayWriter.write(geometry, placement, resolution, stamp, overlay));
            run(SpliceStep.MERGE_OVERLAY, listener,
                    () -> engine.mergeOverlay(targetPage, overlay, stamped));

            if (numPages > 1) {
                List<Path> parts = new ArrayList<>();
                if (pageNum > 1) {
                    Path pre = workspace.file("pre.pdf");
                    run(SpliceStep.EXTRACT_PRE, listener,
                            () -> engine.extractRange(document, 1, pageNum - 1, pre));
                    parts.add(pre);
                }
                parts.add(stamped);
                if (pageNum < numPages) {
                    Path post = workspace.file("post.pdf");
                    run(SpliceStep.EXTRACT_POST, listener,
                            () -> engine.extractRange(document, pageNum + 1, numPages, post));
                    parts.add(post);
                }
                run(SpliceStep.CONCATENATE, listener,
                        () -> engine.concatenate(parts, staging));
            }

            run(SpliceStep.MOVE_INTO_PLACE, listener, () -> moveIntoPlace(staging, output));
        } finally {
            deleteFile(staging);
        }

        log.info("拼接完成: {}", output.getFileName());
        return pageNum;
    }

    private SpliceWorkspace openWorkspace() {
        try {
            return new SpliceWorkspace();
        } catch (IOException e) {
            throw new ResourceException("无法创建临时目录", e);
        }
    }

    private void run(SpliceStep step, SpliceProgressListener listener, StepAction action) {
        listener.stepStarted(step);
        long start = System.currentTimeMillis();
        try {
            action.run();
        } catch (IOException | RuntimeException e) {
            log.error("拼接步骤失败: {}", step.getDescription(), e);
            throw new CollaboratorException(step, e);
        }
        log.debug("  - {} 完成: {}ms", step.getDescription(), System.currentTimeMillis() - start);
    }

    private static void moveIntoPlace(Path staging, Path output) throws IOException {
        try {
            Files.move(staging, output, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(staging, output, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteFile(Path path) {
        try {
            if (Files.deleteIfExists(path)) {
                log.trace("临时文件已删除: {}", path);
            }
        } catch (IOException e) {
            log.warn("删除文件失败: {}", path, e);
        }
    }

    @FunctionalInterface
    private interface StepAction {
        void run() throws IOException;
    }
}
