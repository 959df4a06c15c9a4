package com.example.pdfstamp.controller;

import com.example.pdfstamp.model.Invocation;
import com.example.pdfstamp.model.PlacementSnapshot;
import com.example.pdfstamp.model.PointerEventType;
import com.example.pdfstamp.model.StampResult;
import com.example.pdfstamp.service.PdfStampService;
import com.example.pdfstamp.service.StampSession;
import com.example.pdfstamp.service.StampSessionService;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 交互式盖章：前端只转发指针事件并按需拉取预览，摆放状态由服务端持有
 */
@Slf4j
@RestController
@RequestMapping("/api/stamp/sessions")
@CrossOrigin(origins = "*")
public class StampSessionController {

    @Autowired
    private StampSessionService sessionService;

    @PostMapping
    public ResponseEntity<?> createSession(
            @RequestParam("file") MultipartFile file,
            @RequestParam("stamp") MultipartFile stamp,
            @RequestParam(value = "stampDpi", required = false) Double stampDpi,
            @RequestParam(value = "page", defaultValue = "1") int page,
            @RequestParam(value = "x", defaultValue = "0") double x,
            @RequestParam(value = "y", defaultValue = "0") double y,
            @RequestParam(value = "scale", defaultValue = "1") double scale) {
        try {
            if (file.isEmpty() || stamp.isEmpty()) {
                return ResponseEntity.badRequest().body(error("文件不能为空"));
            }
            StampSession session = sessionService.create(file, stamp, stampDpi, page, x, y, scale);

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("success", true);
            body.put("sessionId", session.getId());
            body.put("pageNumber", session.getPageNumber());
            body.put("pageWidthMM", session.getGeometry().getWidthMM());
            body.put("pageHeightMM", session.getGeometry().getHeightMM());
            body.put("previewDpi", session.getPreviewDensity());
            body.put("stampDpi", session.getResolution().getDensityPerInch());
            body.put("dpiSource", session.getResolution().getSource().name());
            body.put("warnings", session.getResolution().isDegraded()
                    ? List.of(PdfStampService.FALLBACK_WARNING) : List.of());
            body.put("placement", placement(session.getPlacement().snapshot(), session.getPreviewVersion().get()));
            return ResponseEntity.ok(body);
        } catch (Exception e) {
            log.error("创建会话失败", e);
            return ResponseEntity.status(PdfStampController.statusOf(e)).body(error("创建会话失败: " + e.getMessage()));
        }
    }

    @GetMapping(value = "/{id}/preview", produces = MediaType.IMAGE_PNG_VALUE)
    public ResponseEntity<byte[]> preview(@PathVariable String id) {
        try {
            byte[] png = sessionService.preview(id);
            return ResponseEntity.ok()
                    .contentType(MediaType.IMAGE_PNG)
                    .header("preview-version", Long.toString(sessionService.get(id).getPreviewVersion().get()))
                    .body(png);
        } catch (Exception e) {
            log.error("预览失败: {}", id, e);
            return ResponseEntity.status(PdfStampController.statusOf(e)).build();
        }
    }

    @PostMapping("/{id}/pointer")
    public ResponseEntity<?> pointer(@PathVariable String id, @RequestBody PointerRequest request) {
        try {
            StampSession session = sessionService.get(id);
            long before = session.getPreviewVersion().get();
            PlacementSnapshot snapshot = sessionService.pointer(id, request.getType(), request.getX(), request.getY());
            long after = session.getPreviewVersion().get();

            Map<String, Object> body = placement(snapshot, after);
            body.put("redraw", after != before);
            body.put("phase", session.getDragStateMachine().getPhase().name());
            return ResponseEntity.ok(body);
        } catch (Exception e) {
            return ResponseEntity.status(PdfStampController.statusOf(e)).body(error(e.getMessage()));
        }
    }

    @PutMapping("/{id}/scale")
    public ResponseEntity<?> scale(@PathVariable String id, @RequestBody ScaleRequest request) {
        try {
            PlacementSnapshot snapshot = sessionService.setScale(id, request.getScale());
            return ResponseEntity.ok(placement(snapshot, sessionService.get(id).getPreviewVersion().get()));
        } catch (Exception e) {
            return ResponseEntity.status(PdfStampController.statusOf(e)).body(error(e.getMessage()));
        }
    }

    @PutMapping("/{id}/position")
    public ResponseEntity<?> position(@PathVariable String id, @RequestBody PositionRequest request) {
        try {
            PlacementSnapshot snapshot = sessionService.setPosition(id, request.getX(), request.getY());
            return ResponseEntity.ok(placement(snapshot, sessionService.get(id).getPreviewVersion().get()));
        } catch (Exception e) {
            return ResponseEntity.status(PdfStampController.statusOf(e)).body(error(e.getMessage()));
        }
    }

    @PostMapping("/{id}/save")
    public ResponseEntity<?> save(@PathVariable String id,
                                  @RequestParam(value = "fileName", required = false) String fileName) {
        try {
            StampResult result = sessionService.save(id, fileName);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("success", true);
            body.put("fileName", result.getFileName());
            body.put("pageNumber", result.getPageNumber());
            body.put("warnings", result.getWarnings());
            return ResponseEntity.ok(body);
        } catch (Exception e) {
            log.error("保存失败: {}", id, e);
            return ResponseEntity.status(PdfStampController.statusOf(e)).body(error("保存失败: " + e.getMessage()));
        }
    }

    @GetMapping("/{id}/download")
    public ResponseEntity<Resource> download(@PathVariable String id) {
        try {
            Resource resource = sessionService.loadOutput(id);
            String encodedFileName = URLEncoder.encode(resource.getFilename(), StandardCharsets.UTF_8);
            return ResponseEntity.ok()
                    .contentType(MediaType.APPLICATION_PDF)
                    .header(HttpHeaders.CONTENT_DISPOSITION,
                            "attachment; filename*=UTF-8''" + encodedFileName)
                    .body(resource);
        } catch (Exception e) {
            log.error("下载失败: {}", id, e);
            return ResponseEntity.status(PdfStampController.statusOf(e)).build();
        }
    }

    @GetMapping("/{id}/invocation")
    public ResponseEntity<?> invocation(@PathVariable String id) {
        try {
            Invocation invocation = sessionService.invocation(id);
            log.info("{}", invocation.toCommandLine());
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("args", invocation.toArgs());
            body.put("commandLine", invocation.toCommandLine());
            return ResponseEntity.ok(body);
        } catch (Exception e) {
            return ResponseEntity.status(PdfStampController.statusOf(e)).body(error(e.getMessage()));
        }
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<?> close(@PathVariable String id) {
        try {
            sessionService.close(id);
            return ResponseEntity.noContent().build();
        } catch (Exception e) {
            return ResponseEntity.status(PdfStampController.statusOf(e)).body(error(e.getMessage()));
        }
    }

    private static Map<String, Object> placement(PlacementSnapshot snapshot, long previewVersion) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("x", snapshot.getCurrentXMM());
        body.put("y", snapshot.getCurrentYMM());
        body.put("scale", snapshot.getScale());
        body.put("previewVersion", previewVersion);
        return body;
    }

    private static Map<String, Object> error(String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("message", message);
        return body;
    }

    @Getter
    @Setter
    public static class PointerRequest {
        private PointerEventType type;
        private double x;
        private double y;
    }

    @Getter
    @Setter
    public static class ScaleRequest {
        private double scale;
    }

    @Getter
    @Setter
    public static class PositionRequest {
        private double x;
        private double y;
    }
}
