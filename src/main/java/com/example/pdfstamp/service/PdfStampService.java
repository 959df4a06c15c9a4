package com.example.pdfstamp.service;

import com.example.pdfstamp.core.PlacementState;
import com.example.pdfstamp.core.StampImageLoader;
import com.example.pdfstamp.core.StampResolutionResolver;
import com.example.pdfstamp.exception.ConfigException;
import com.example.pdfstamp.exception.ResourceException;
import com.example.pdfstamp.model.PageGeometry;
import com.example.pdfstamp.model.StampJob;
import com.example.pdfstamp.model.StampResolution;
import com.example.pdfstamp.model.StampResult;
import com.example.pdfstamp.splice.PageSpliceOrchestrator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.UrlResource;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import javax.annotation.PostConstruct;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * PDF盖章服务
 *
 * 批处理流程：
 *   参数校验 → 图章DPI解析 → 图章解码 → 页面拼接
 * 参数错误和资源错误都在写任何文件之前抛出。
 */
@Service
@Slf4j
public class PdfStampService {

    public static final String FALLBACK_WARNING = "图章未包含有效的DPI信息，已使用默认值72 DPI，图章实际尺寸可能与预期不符";

    @Value("${file.upload-dir:uploads}")
    private String uploadDir;

    private Path uploadPath;

    @Autowired
    private StampResolutionResolver resolutionResolver;

    @Autowired
    private PageSpliceOrchestrator spliceOrchestrator;

    @Autowired
    private ProgressService progressService;

    @PostConstruct
    public void init() {
        uploadPath = Paths.get(uploadDir).toAbsolutePath().normalize();
        try {
            Files.createDirectories(uploadPath);
            log.info("上传目录创建成功: {}", uploadPath);
        } catch (Exception e) {
            throw new RuntimeException("无法创建上传目录: " + uploadPath, e);
        }
    }

    public Path getUploadPath() {
        return uploadPath;
    }

    /**
     * 执行一次盖章
     *
     * @param job 盖章参数，output为空时输出到输入文件旁的 "文件名_sig.pdf"
     * @return 盖章结果
     */
    public StampResult stamp(StampJob job) {
        long startTime = System.currentTimeMillis();
        log.info("========== 开始盖章 ==========");
        log.info("输入文件: {}, 图章: {}", job.getInput(), job.getStamp());

        // 1. 参数校验
        if (job.getPage() == 0) {
            throw new ConfigException("页码不能为0");
        }
        PlacementState placement = new PlacementState(job.getX(), job.getY(), job.getScale());
        Path output = resolveOutput(job);

        // 2. 图章DPI与图片
        StampResolution resolution = resolutionResolver.resolve(job.getStamp(), job.getStampDpi());
        BufferedImage stampImage = StampImageLoader.load(job.getStamp());
        List<String> warnings = new ArrayList<>();
        if (resolution.isDegraded()) {
            warnings.add(FALLBACK_WARNING);
            progressService.sendWarning(FALLBACK_WARNING);
        }

        // 3. 页面信息
        if (!Files.isReadable(job.getInput())) {
            throw new ResourceException("PDF文件不可读: " + job.getInput());
        }
        int numPages = spliceOrchestrator.pageCount(job.getInput());
        int pageNum = PageSpliceOrchestrator.resolvePageNumber(job.getPage(), numPages);
        PageGeometry geometry = spliceOrchestrator.pageGeometry(job.getInput(), pageNum);
        log.info("PDF page size is W {} mm, H {} mm",
                String.format("%1.1f", geometry.getWidthMM()),
                String.format("%1.1f", geometry.getHeightMM()));

        // 4. 拼接
        progressService.sendProgress("开始盖章: 第 " + pageNum + " 页, 共 " + numPages + " 页");
        spliceOrchestrator.splicePage(
                job.getInput(), job.getPage(), placement.snapshot(), resolution, stampImage, output,
                progressService.spliceListener(output.getFileName().toString()));

        long totalTime = System.currentTimeMillis() - startTime;
        log.info("========== 盖章完成 ==========");
        log.info("总耗时: {}秒", String.format("%.2f", totalTime / 1000.0));
        log.info("输出文件: {}", output);
        progressService.sendProgress("处理完成");

        return new StampResult(output.getFileName().toString(), pageNum, resolution, warnings, totalTime);
    }

    /**
     * 上传文件盖章，结果保存在上传目录
     */
    public StampResult stampUpload(
            MultipartFile file,
            MultipartFile stamp,
            Double stampDpi,
            int page,
            double x,
            double y,
            double scale) throws IOException {

        log.info("文件名: {}, 图章: {}", file.getOriginalFilename(), stamp.getOriginalFilename());
        log.info("文件大小: {} KB", file.getSize() / 1024);

        String baseName = extractBaseName(file.getOriginalFilename());
        Path tempInput = uploadPath.resolve("temp_input_" + UUID.randomUUID() + ".pdf");
        Path tempStamp = uploadPath.resolve("temp_stamp_" + UUID.randomUUID() + extractExtension(stamp.getOriginalFilename()));
        Path output = uploadPath.resolve(baseName + "_stamped_" + UUID.randomUUID() + ".pdf");

        try {
            file.transferTo(tempInput.toFile());
            stamp.transferTo(tempStamp.toFile());
            log.debug("临时文件已创建: {}, {}", tempInput, tempStamp);

            StampJob job = StampJob.builder()
                    .input(tempInput)
                    .stamp(tempStamp)
                    .stampDpi(stampDpi)
                    .page(page)
                    .x(x)
                    .y(y)
                    .scale(scale)
                    .output(output)
                    .build();
            return stamp(job);
        } finally {
            deleteFile(tempInput);
            deleteFile(tempStamp);
        }
    }

    /**
     * 未指定输出时使用 "输入文件名_sig.pdf"，且不覆盖已有文件
     */
    Path resolveOutput(StampJob job) {
        if (job.getOutput() != null) {
            return job.getOutput();
        }
        Path auto = autoOutputFile(job.getInput());
        if (Files.exists(auto)) {
            throw new ConfigException("未指定输出文件，且不覆盖已存在的文件: " + auto);
        }
        return auto;
    }

    public static Path autoOutputFile(Path input) {
        return input.resolveSibling(input.getFileName() + "_sig.pdf");
    }

    public Resource loadFileAsResource(String fileName) throws Exception {
        return loadFileAsResource(uploadPath, fileName);
    }

    /**
     * 从指定目录加载文件，文件名不能跳出该目录
     */
    public Resource loadFileAsResource(Path directory, String fileName) throws Exception {
        Path filePath = directory.resolve(fileName).normalize();
        if (!filePath.startsWith(directory)) {
            throw new ConfigException("非法文件名: " + fileName);
        }
        Resource resource = new UrlResource(filePath.toUri());

        if (!resource.exists()) {
            throw new ResourceException("文件未找到: " + fileName);
        }

        log.debug("文件资源已加载: {}", fileName);
        return resource;
    }

    static String extractBaseName(String fileName) {
        if (fileName == null) return "output";
        String name = Paths.get(fileName).getFileName().toString();
        int idx = name.lastIndexOf('.');
        return idx > 0 ? name.substring(0, idx) : name;
    }

    static String extractExtension(String fileName) {
        if (fileName == null) return "";
        String name = Paths.get(fileName).getFileName().toString();
        int idx = name.lastIndexOf('.');
        return idx > 0 ? name.substring(idx) : "";
    }

    private void deleteFile(Path path) {
        if (path != null) {
            try {
                Files.deleteIfExists(path);
                log.trace("临时文件已删除: {}", path);
            } catch (Exception e) {
                log.warn("删除文件失败: {}", path, e);
            }
        }
    }
}
