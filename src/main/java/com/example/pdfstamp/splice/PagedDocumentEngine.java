package com.example.pdfstamp.splice;

import com.example.pdfstamp.model.PageGeometry;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * 分页文档操作：按页范围提取、拼接、叠加
 * 页码从1开始，范围包含首尾
 */
public interface PagedDocumentEngine {

    int pageCount(Path document) throws IOException;

    PageGeometry pageGeometry(Path document, int pageNumber) throws IOException;

    void extractRange(Path document, int firstPage, int lastPage, Path output) throws IOException;

    void concatenate(List<Path> documents, Path output) throws IOException;

    /**
     * 将单页叠加文档盖在底层文档的每一页上
     */
    void mergeOverlay(Path baseDocument, Path overlayDocument, Path output) throws IOException;
}
