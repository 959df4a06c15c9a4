package com.example.pdfstamp.splice;

import com.example.pdfstamp.TestDocuments;
import com.example.pdfstamp.model.PageGeometry;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PdfBoxDocumentEngineTest {

    @TempDir
    Path tempDir;

    private final PdfBoxDocumentEngine engine = new PdfBoxDocumentEngine();

    @Test
    void readsPageGeometryIncludingOffset() throws Exception {
        Path pdf = TestDocuments.createPdf(tempDir.resolve("in.pdf"),
                PDRectangle.A4, new PDRectangle(20f, 30f, 300f, 400f));

        assertThat(engine.pageCount(pdf)).isEqualTo(2);

        PageGeometry geometry = engine.pageGeometry(pdf, 2);
        assertThat(geometry.getLeft()).isEqualTo(20f);
        assertThat(geometry.getBottom()).isEqualTo(30f);
        assertThat(geometry.getWidth()).isEqualTo(300f);
        assertThat(geometry.getTop()).isEqualTo(430f);
    }

    @Test
    void extractsAndConcatenatesRanges() throws Exception {
        Path pdf = TestDocuments.createPdf(tempDir.resolve("in.pdf"),
                new PDRectangle(100, 100), new PDRectangle(200, 100), new PDRectangle(300, 100));

        Path head = tempDir.resolve("head.pdf");
        Path tail = tempDir.resolve("tail.pdf");
        engine.extractRange(pdf, 1, 2, head);
        engine.extractRange(pdf, 3, 3, tail);
        assertThat(engine.pageCount(head)).isEqualTo(2);
        assertThat(engine.pageCount(tail)).isEqualTo(1);

        Path joined = tempDir.resolve("joined.pdf");
        engine.concatenate(List.of(tail, head), joined);

        try (PDDocument doc = PDDocument.load(joined.toFile())) {
            assertThat(doc.getNumberOfPages()).isEqualTo(3);
            assertThat(doc.getPage(0).getMediaBox().getWidth()).isEqualTo(300f);
            assertThat(doc.getPage(1).getMediaBox().getWidth()).isEqualTo(100f);
            assertThat(doc.getPage(2).getMediaBox().getWidth()).isEqualTo(200f);
        }
    }

    @Test
    void rejectsRangeOutsideDocument() throws Exception {
        Path pdf = TestDocuments.createPdf(tempDir.resolve("in.pdf"), 2);

        assertThatThrownBy(() -> engine.extractRange(pdf, 2, 3, tempDir.resolve("x.pdf")))
                .isInstanceOf(IOException.class);
        assertThatThrownBy(() -> engine.pageGeometry(pdf, 0))
                .isInstanceOf(IOException.class);
    }

    @Test
    void unreadableDocumentFails() throws Exception {
        Path broken = Files.writeString(tempDir.resolve("broken.pdf"), "not a pdf");

        assertThatThrownBy(() -> engine.pageCount(broken)).isInstanceOf(IOException.class);
    }
}
