package com.example.pdfstamp.controller;

import com.example.pdfstamp.exception.ConfigException;
import com.example.pdfstamp.exception.ResourceException;
import com.example.pdfstamp.model.StampResult;
import com.example.pdfstamp.service.PdfStampService;
import com.example.pdfstamp.service.ProgressService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/pdf")
@CrossOrigin(origins = "*")
public class PdfStampController {

    @Autowired
    private PdfStampService pdfStampService;

    @Autowired
    private ProgressService progressService;

    @PostMapping("/stamp")
    public ResponseEntity<StampResponse> uploadAndStamp(
            @RequestParam("file") MultipartFile file,
            @RequestParam("stamp") MultipartFile stamp,
            @RequestParam(value = "stampDpi", required = false) Double stampDpi,
            @RequestParam(value = "page", defaultValue = "1") int page,
            @RequestParam(value = "x", defaultValue = "0") double x,
            @RequestParam(value = "y", defaultValue = "0") double y,
            @RequestParam(value = "scale", defaultValue = "1") double scale) {
        try {
            if (file.isEmpty() || stamp.isEmpty()) {
                return ResponseEntity.badRequest().body(StampResponse.failure("文件不能为空"));
            }

            String fileName = file.getOriginalFilename();
            if (fileName == null || !fileName.toLowerCase().endsWith(".pdf")) {
                return ResponseEntity.badRequest().body(StampResponse.failure("只支持PDF文件"));
            }

            StampResult result = pdfStampService.stampUpload(file, stamp, stampDpi, page, x, y, scale);
            return ResponseEntity.ok(StampResponse.success("盖章成功", result));

        } catch (Exception e) {
            log.error("盖章失败", e);
            return ResponseEntity.status(statusOf(e)).body(StampResponse.failure("处理失败: " + e.getMessage()));
        }
    }

    @GetMapping("/download/{fileName}")
    public ResponseEntity<Resource> downloadStampedPdf(@PathVariable String fileName) {
        try {
            Resource resource = pdfStampService.loadFileAsResource(fileName);

            String encodedFileName = URLEncoder.encode(resource.getFilename(), StandardCharsets.UTF_8);
            return ResponseEntity.ok()
                    .contentType(MediaType.APPLICATION_PDF)
                    .header(HttpHeaders.CONTENT_DISPOSITION,
                            "attachment; filename*=UTF-8''" + encodedFileName)
                    .body(resource);

        } catch (Exception e) {
            log.error("下载失败: {}", fileName, e);
            return ResponseEntity.status(statusOf(e))
                    .header("error-message", URLEncoder.encode(String.valueOf(e.getMessage()), StandardCharsets.UTF_8))
                    .build();
        }
    }

    @GetMapping(value = "/progress", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter progress() {
        return progressService.createEmitter();
    }

    /**
     * 参数错误 400，资源错误 422，其余 500
     */
    static HttpStatus statusOf(Exception e) {
        if (e instanceof ConfigException) {
            return HttpStatus.BAD_REQUEST;
        }
        if (e instanceof ResourceException) {
            return HttpStatus.UNPROCESSABLE_ENTITY;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    static class StampResponse {
        private boolean success;
        private String message;
        private String fileName;
        private Integer pageNumber;
        private Double stampDpi;
        private String dpiSource;
        private List<String> warnings;

        static StampResponse success(String message, StampResult result) {
            StampResponse r = new StampResponse();
            r.success = true;
            r.message = message;
            r.fileName = result.getFileName();
            r.pageNumber = result.getPageNumber();
            r.stampDpi = result.getResolution().getDensityPerInch();
            r.dpiSource = result.getResolution().getSource().name();
            r.warnings = result.getWarnings();
            return r;
        }

        static StampResponse failure(String message) {
            StampResponse r = new StampResponse();
            r.success = false;
            r.message = message;
            r.warnings = new ArrayList<>();
            return r;
        }

        public boolean isSuccess() {
            return success;
        }

        public String getMessage() {
            return message;
        }

        public String getFileName() {
            return fileName;
        }

        public Integer getPageNumber() {
            return pageNumber;
        }

        public Double getStampDpi() {
            return stampDpi;
        }

        public String getDpiSource() {
            return dpiSource;
        }

        public List<String> getWarnings() {
            return warnings;
        }
    }
}
