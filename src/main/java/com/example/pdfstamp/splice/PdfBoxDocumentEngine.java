package com.example.pdfstamp.splice;

import com.example.pdfstamp.model.PageGeometry;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.io.MemoryUsageSetting;
import org.apache.pdfbox.multipdf.Overlay;
import org.apache.pdfbox.multipdf.PDFMergerUtility;
import org.apache.pdfbox.multipdf.Splitter;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;

/**
 * 基于PDFBox的分页文档操作
 */
@Slf4j
@Component
public class PdfBoxDocumentEngine implements PagedDocumentEngine {

    @Override
    public int pageCount(Path document) throws IOException {
        try (PDDocument doc = PDDocument.load(document.toFile())) {
            return doc.getNumberOfPages();
        }
    }

    @Override
    public PageGeometry pageGeometry(Path document, int pageNumber) throws IOException {
        try (PDDocument doc = PDDocument.load(document.toFile())) {
            checkRange(doc, pageNumber, pageNumber);
            PDPage page = doc.getPage(pageNumber - 1);
            return PageGeometry.of(page.getMediaBox());
        }
    }

    @Override
    public void extractRange(Path document, int firstPage, int lastPage, Path output) throws IOException {
        try (PDDocument doc = PDDocument.load(document.toFile())) {
            checkRange(doc, firstPage, lastPage);

            Splitter splitter = new Splitter();
            splitter.setStartPage(firstPage);
            splitter.setEndPage(lastPage);
            splitter.setSplitAtPage(lastPage - firstPage + 1);

            List<PDDocument> parts = splitter.split(doc);
            try {
                parts.get(0).save(output.toFile());
            } finally {
                for (PDDocument part : parts) {
                    part.close();
                }
            }
        }
        log.debug("已提取页面 {}-{} -> {}", firstPage, lastPage, output.getFileName());
    }

    @Override
    public void concatenate(List<Path> documents, Path output) throws IOException {
        PDFMergerUtility merger = new PDFMergerUtility();
        for (Path document : documents) {
            merger.addSource(document.toFile());
        }
        merger.setDestinationFileName(output.toString());
        merger.mergeDocuments(MemoryUsageSetting.setupMainMemoryOnly());
        log.debug("已拼接 {} 个文档 -> {}", documents.size(), output.getFileName());
    }

    @Override
    public void mergeOverlay(Path baseDocument, Path overlayDocument, Path output) throws IOException {
        try (PDDocument base = PDDocument.load(baseDocument.toFile());
             PDDocument layer = PDDocument.load(overlayDocument.toFile())) {

            Overlay overlay = new Overlay();
            try {
                overlay.setInputPDF(base);
                overlay.setDefaultOverlayPDF(layer);
                overlay.setOverlayPosition(Overlay.Position.FOREGROUND);

                PDDocument result = overlay.overlay(new HashMap<>());
                result.save(output.toFile());
            } finally {
                overlay.close();
            }
        }
        log.debug("图章层已合并 -> {}", output.getFileName());
    }

    private static void checkRange(PDDocument doc, int firstPage, int lastPage) throws IOException {
        int numPages = doc.getNumberOfPages();
        if (firstPage < 1 || lastPage > numPages || firstPage > lastPage) {
            throw new IOException(String.format("页码范围 %d-%d 超出文档页数 %d", firstPage, lastPage, numPages));
        }
    }
}
