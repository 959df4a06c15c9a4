package com.example.pdfstamp.service;

import com.example.pdfstamp.TestDocuments;
import com.example.pdfstamp.core.StampResolutionResolver;
import com.example.pdfstamp.exception.ConfigException;
import com.example.pdfstamp.exception.ResourceException;
import com.example.pdfstamp.model.DensitySource;
import com.example.pdfstamp.model.StampJob;
import com.example.pdfstamp.model.StampResult;
import com.example.pdfstamp.splice.PageSpliceOrchestrator;
import com.example.pdfstamp.splice.PdfBoxDocumentEngine;
import com.example.pdfstamp.splice.StampOverlayWriter;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PdfStampServiceTest {

    @TempDir
    Path tempDir;

    private PdfStampService service;
    private Path input;
    private Path stamp;

    @BeforeEach
    void setUp() throws Exception {
        service = new PdfStampService();
        ReflectionTestUtils.setField(service, "uploadDir", tempDir.resolve("uploads").toString());
        ReflectionTestUtils.setField(service, "resolutionResolver", new StampResolutionResolver());
        ReflectionTestUtils.setField(service, "spliceOrchestrator",
                new PageSpliceOrchestrator(new PdfBoxDocumentEngine(), new StampOverlayWriter()));
        ReflectionTestUtils.setField(service, "progressService", new ProgressService());
        service.init();

        input = TestDocuments.createPdf(tempDir.resolve("contract.pdf"), 3);
        stamp = TestDocuments.createStamp(tempDir.resolve("sig.png"), 60, 30);
    }

    @Test
    void writesNextToInputWhenNoOutputGiven() throws Exception {
        StampResult result = service.stamp(StampJob.builder().input(input).stamp(stamp).page(-1).x(10).y(20).build());

        Path expected = tempDir.resolve("contract.pdf_sig.pdf");
        assertThat(result.getFileName()).isEqualTo("contract.pdf_sig.pdf");
        assertThat(result.getPageNumber()).isEqualTo(2);
        assertThat(expected).exists();
        try (PDDocument doc = PDDocument.load(expected.toFile())) {
            assertThat(doc.getNumberOfPages()).isEqualTo(3);
        }
    }

    @Test
    void refusesToOverwriteAutomaticOutput() throws Exception {
        Path existing = Files.writeString(tempDir.resolve("contract.pdf_sig.pdf"), "keep");

        assertThatThrownBy(() -> service.stamp(StampJob.builder().input(input).stamp(stamp).build()))
                .isInstanceOf(ConfigException.class);
        assertThat(existing).hasContent("keep");
    }

    @Test
    void reportsFallbackDensityAsWarning() {
        StampResult result = service.stamp(StampJob.builder()
                .input(input).stamp(stamp).output(tempDir.resolve("out.pdf")).build());

        assertThat(result.getResolution().getSource()).isEqualTo(DensitySource.FALLBACK);
        assertThat(result.getWarnings()).containsExactly(PdfStampService.FALLBACK_WARNING);
    }

    @Test
    void explicitDensityHasNoWarning() {
        StampResult result = service.stamp(StampJob.builder()
                .input(input).stamp(stamp).stampDpi(300.0).output(tempDir.resolve("out.pdf")).build());

        assertThat(result.getResolution().getDensityPerInch()).isEqualTo(300.0);
        assertThat(result.getWarnings()).isEmpty();
    }

    @Test
    void invalidParametersFailBeforeAnyFileIsWritten() {
        Path output = tempDir.resolve("out.pdf");

        assertThatThrownBy(() -> service.stamp(StampJob.builder()
                .input(input).stamp(stamp).scale(0).output(output).build()))
                .isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> service.stamp(StampJob.builder()
                .input(input).stamp(stamp).page(0).output(output).build()))
                .isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> service.stamp(StampJob.builder()
                .input(input).stamp(stamp).page(9).output(output).build()))
                .isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> service.stamp(StampJob.builder()
                .input(tempDir.resolve("missing.pdf")).stamp(stamp).output(output).build()))
                .isInstanceOf(ResourceException.class);

        assertThat(output).doesNotExist();
    }

    @Test
    void uploadedFilesAreStampedIntoUploadDirectory() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "contract.pdf", "application/pdf",
                Files.readAllBytes(input));
        MockMultipartFile image = new MockMultipartFile("stamp", "sig.png", "image/png",
                Files.readAllBytes(stamp));

        StampResult result = service.stampUpload(file, image, 150.0, 1, 5, 5, 0.5);

        assertThat(result.getFileName()).startsWith("contract_stamped_").endsWith(".pdf");
        assertThat(service.loadFileAsResource(result.getFileName()).exists()).isTrue();
        try (Stream<Path> files = Files.list(service.getUploadPath())) {
            assertThat(files).allMatch(p -> !p.getFileName().toString().startsWith("temp_"));
        }
    }

    @Test
    void downloadRejectsPathTraversal() {
        assertThatThrownBy(() -> service.loadFileAsResource("../contract.pdf"))
                .isInstanceOf(ConfigException.class);
    }
}
