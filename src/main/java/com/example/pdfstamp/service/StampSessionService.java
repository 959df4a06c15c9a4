package com.example.pdfstamp.service;

import com.example.pdfstamp.core.InvocationSerializer;
import com.example.pdfstamp.core.PlacementState;
import com.example.pdfstamp.core.StampImageLoader;
import com.example.pdfstamp.core.StampResolutionResolver;
import com.example.pdfstamp.exception.ConfigException;
import com.example.pdfstamp.exception.ResourceException;
import com.example.pdfstamp.exception.StampException;
import com.example.pdfstamp.model.Invocation;
import com.example.pdfstamp.model.PageGeometry;
import com.example.pdfstamp.model.PlacementSnapshot;
import com.example.pdfstamp.model.PointerEventType;
import com.example.pdfstamp.model.StampResolution;
import com.example.pdfstamp.model.StampResult;
import com.example.pdfstamp.splice.PageSpliceOrchestrator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;
import org.springframework.web.multipart.MultipartFile;

import javax.annotation.PreDestroy;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 交互式盖章会话管理
 *
 * 每个会话持有自己的摆放状态；预览、指针事件、缩放、保存都在会话锁内执行，
 * 保存时读取的是开始保存那一刻的快照。输出文件写在会话自己的 output 目录下，
 * 不同会话即使原文件同名也不会互相覆盖。
 */
@Service
@Slf4j
public class StampSessionService {

    private static final String OUTPUT_DIR = "output";

    @Value("${stamp.session.max-sessions:16}")
    private int maxSessions;

    private final Map<String, StampSession> sessions = new ConcurrentHashMap<>();

    // 已创建和正在创建的会话数，创建前先占位
    private final AtomicInteger reserved = new AtomicInteger();

    @Autowired
    private PdfStampService pdfStampService;

    @Autowired
    private StampResolutionResolver resolutionResolver;

    @Autowired
    private PageSpliceOrchestrator spliceOrchestrator;

    @Autowired
    private PreviewRenderService previewRenderService;

    @Autowired
    private ProgressService progressService;

    /**
     * 创建会话：保存上传文件、解析图章DPI、渲染预览底图
     */
    public StampSession create(
            MultipartFile file,
            MultipartFile stamp,
            Double stampDpi,
            int page,
            double x,
            double y,
            double scale) throws IOException {

        if (page == 0) {
            throw new ConfigException("页码不能为0");
        }
        PlacementState placement = new PlacementState(x, y, scale);

        if (reserved.incrementAndGet() > maxSessions) {
            reserved.decrementAndGet();
            throw new StampException("会话数量已达上限: " + maxSessions);
        }

        String id = UUID.randomUUID().toString();
        Path directory = pdfStampService.getUploadPath().resolve("session_" + id);
        try {
            Files.createDirectories(directory.resolve(OUTPUT_DIR));
            Path input = directory.resolve("input.pdf");
            Path stampPath = directory.resolve("stamp" + PdfStampService.extractExtension(stamp.getOriginalFilename()));
            file.transferTo(input.toFile());
            stamp.transferTo(stampPath.toFile());

            StampResolution resolution = resolutionResolver.resolve(stampPath, stampDpi);
            BufferedImage stampImage = StampImageLoader.load(stampPath);

            int numPages = spliceOrchestrator.pageCount(input);
            int pageNumber = PageSpliceOrchestrator.resolvePageNumber(page, numPages);
            PageGeometry geometry = spliceOrchestrator.pageGeometry(input, pageNumber);
            int density = previewRenderService.previewDensity(geometry);
            BufferedImage pageImage = previewRenderService.renderPage(input, pageNumber, density);

            StampSession session = new StampSession(
                    id, directory, input, stampPath,
                    displayName(file.getOriginalFilename(), "input.pdf"),
                    displayName(stamp.getOriginalFilename(), "stamp.png"),
                    stampImage, resolution, page, pageNumber, geometry, density, pageImage, placement);
            sessions.put(id, session);

            log.info("会话已创建: {} (第 {}/{} 页, 页面 {}×{} mm, 预览DPI {}, 图章 {})",
                    id, pageNumber, numPages,
                    String.format("%.1f", geometry.getWidthMM()),
                    String.format("%.1f", geometry.getHeightMM()),
                    density, resolution);
            if (resolution.isDegraded()) {
                progressService.sendWarning(PdfStampService.FALLBACK_WARNING);
            }
            return session;
        } catch (RuntimeException | IOException e) {
            reserved.decrementAndGet();
            deleteDirectory(directory);
            throw e;
        }
    }

    public StampSession get(String id) {
        StampSession session = sessions.get(id);
        if (session == null) {
            throw new ResourceException("会话不存在: " + id);
        }
        return session;
    }

    public byte[] preview(String id) {
        StampSession session = get(id);
        BufferedImage image;
        synchronized (session) {
            image = previewRenderService.compose(
                    session.getPageImage(),
                    session.getStampImage(),
                    session.getPlacement().snapshot(),
                    session.getResolution(),
                    session.getPreviewDensity());
        }
        return previewRenderService.toPng(image);
    }

    /**
     * 转发指针事件到拖拽状态机
     *
     * @return 事件处理后的摆放状态
     */
    public PlacementSnapshot pointer(String id, PointerEventType type, double x, double y) {
        if (type == null) {
            throw new ConfigException("缺少指针事件类型");
        }
        StampSession session = get(id);
        synchronized (session) {
            boolean accepted;
            switch (type) {
                case DOWN:
                    accepted = session.getDragStateMachine().pointerDown(x, y);
                    break;
                case MOVE:
                    accepted = session.getDragStateMachine().pointerMove(x, y);
                    break;
                case UP:
                    accepted = session.getDragStateMachine().pointerUp();
                    break;
                default:
                    throw new ConfigException("未知的指针事件: " + type);
            }
            log.trace("会话 {} 指针事件 {} ({}, {}) 接受: {}", id, type, x, y, accepted);
            return session.getPlacement().snapshot();
        }
    }

    public PlacementSnapshot setScale(String id, double scale) {
        StampSession session = get(id);
        synchronized (session) {
            session.getPlacement().setScale(scale);
            session.getPreviewVersion().incrementAndGet();
            log.debug("会话 {} 缩放比例: {}", id, String.format("%.3f", scale));
            return session.getPlacement().snapshot();
        }
    }

    public PlacementSnapshot setPosition(String id, double xMM, double yMM) {
        StampSession session = get(id);
        synchronized (session) {
            session.getPlacement().setPosition(xMM, yMM);
            session.getPreviewVersion().incrementAndGet();
            return session.getPlacement().snapshot();
        }
    }

    /**
     * 按当前摆放状态保存
     *
     * @param fileName 输出文件名，为空时使用上次保存的文件名或 "原文件名_sig.pdf"
     */
    public StampResult save(String id, String fileName) {
        StampSession session = get(id);
        synchronized (session) {
            long startTime = System.currentTimeMillis();
            String outputName = fileName != null && !fileName.isBlank()
                    ? outputName(fileName)
                    : session.getLastOutput() != null
                    ? session.getLastOutput()
                    : session.getInputName() + "_sig.pdf";
            Path output = outputDirectory(session).resolve(outputName);

            PlacementSnapshot snapshot = session.getPlacement().snapshot();
            int pageNumber = spliceOrchestrator.splicePage(
                    session.getInput(), session.getPage(), snapshot,
                    session.getResolution(), session.getStampImage(), output,
                    progressService.spliceListener(outputName));
            session.setLastOutput(outputName);

            List<String> warnings = new ArrayList<>();
            if (session.getResolution().isDegraded()) {
                warnings.add(PdfStampService.FALLBACK_WARNING);
            }
            long totalTime = System.currentTimeMillis() - startTime;
            log.info("会话 {} 已保存: {} ({}ms)", id, outputName, totalTime);
            return new StampResult(outputName, pageNumber, session.getResolution(), warnings, totalTime);
        }
    }

    /**
     * 加载会话最近一次保存的输出
     */
    public Resource loadOutput(String id) throws Exception {
        StampSession session = get(id);
        String outputName = session.getLastOutput();
        if (outputName == null) {
            throw new ResourceException("会话尚未保存: " + id);
        }
        return pdfStampService.loadFileAsResource(outputDirectory(session), outputName);
    }

    /**
     * 输出可复现当前会话的命令行参数
     */
    public Invocation invocation(String id) {
        StampSession session = get(id);
        synchronized (session) {
            return InvocationSerializer.serialize(
                    Paths.get(session.getInputName()),
                    Paths.get(session.getStampName()),
                    session.getResolution(),
                    session.getPage(),
                    session.getPlacement().snapshot(),
                    session.getLastOutput() == null ? null : Paths.get(session.getLastOutput()));
        }
    }

    public void close(String id) {
        StampSession session = sessions.remove(id);
        if (session == null) {
            throw new ResourceException("会话不存在: " + id);
        }
        reserved.decrementAndGet();
        synchronized (session) {
            deleteDirectory(session.getDirectory());
        }
        log.info("会话已关闭: {}", id);
    }

    public int sessionCount() {
        return sessions.size();
    }

    @PreDestroy
    public void closeAll() {
        for (String id : new ArrayList<>(sessions.keySet())) {
            StampSession session = sessions.remove(id);
            if (session != null) {
                reserved.decrementAndGet();
                deleteDirectory(session.getDirectory());
            }
        }
        log.info("所有会话已关闭");
    }

    private static Path outputDirectory(StampSession session) {
        return session.getDirectory().resolve(OUTPUT_DIR);
    }

    /**
     * 只取文件名部分，"/"、".." 这类没有文件名的输入视为参数错误
     */
    static String outputName(String fileName) {
        Path name;
        try {
            name = Paths.get(fileName).getFileName();
        } catch (InvalidPathException e) {
            throw new ConfigException("非法文件名: " + fileName);
        }
        if (name == null || name.toString().isBlank()
                || name.toString().equals(".") || name.toString().equals("..")) {
            throw new ConfigException("非法文件名: " + fileName);
        }
        return name.toString();
    }

    private static String displayName(String originalFileName, String defaultName) {
        if (originalFileName == null || originalFileName.isBlank()) {
            return defaultName;
        }
        return Paths.get(originalFileName).getFileName().toString();
    }

    private void deleteDirectory(Path directory) {
        try {
            FileSystemUtils.deleteRecursively(directory);
        } catch (IOException e) {
            log.warn("删除会话目录失败: {}", directory, e);
        }
    }
}
