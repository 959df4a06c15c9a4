package com.example.pdfstamp.controller;

import com.example.pdfstamp.TestDocuments;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "file.upload-dir=target/test-uploads")
@AutoConfigureMockMvc
class PdfStampControllerTest {

    @TempDir
    Path tempDir;

    @Autowired
    private MockMvc mockMvc;

    @Test
    void stampsUploadedPdfAndServesDownload() throws Exception {
        MockMultipartFile file = pdf("contract.pdf", 2);
        MockMultipartFile stamp = png();

        MvcResult result = mockMvc.perform(multipart("/api/pdf/stamp")
                        .file(file)
                        .file(stamp)
                        .param("page", "2")
                        .param("x", "10")
                        .param("y", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.pageNumber").value(2))
                .andExpect(jsonPath("$.dpiSource").value("FALLBACK"))
                .andExpect(jsonPath("$.warnings").isNotEmpty())
                .andExpect(jsonPath("$.fileName").value(startsWith("contract_stamped_")))
                .andReturn();

        String fileName = JsonPath.read(result.getResponse().getContentAsString(), "$.fileName");
        mockMvc.perform(get("/api/pdf/download/" + fileName))
                .andExpect(status().isOk())
                .andExpect(content().contentType("application/pdf"));
    }

    @Test
    void invalidScaleIsBadRequest() throws Exception {
        mockMvc.perform(multipart("/api/pdf/stamp")
                        .file(pdf("contract.pdf", 1))
                        .file(png())
                        .param("scale", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void nonPdfUploadIsRejected() throws Exception {
        mockMvc.perform(multipart("/api/pdf/stamp")
                        .file(new MockMultipartFile("file", "notes.txt", "text/plain", new byte[]{1}))
                        .file(png()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("只支持PDF文件"));
    }

    @Test
    void sessionWorkflow() throws Exception {
        MvcResult created = mockMvc.perform(multipart("/api/stamp/sessions")
                        .file(pdf("contract.pdf", 3))
                        .file(png())
                        .param("stampDpi", "150")
                        .param("page", "-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pageNumber").value(2))
                .andExpect(jsonPath("$.dpiSource").value("EXPLICIT"))
                .andReturn();
        String id = JsonPath.read(created.getResponse().getContentAsString(), "$.sessionId");
        String base = "/api/stamp/sessions/" + id;

        mockMvc.perform(get(base + "/preview"))
                .andExpect(status().isOk())
                .andExpect(content().contentType("image/png"));

        mockMvc.perform(post(base + "/pointer")
                        .contentType("application/json")
                        .content("{\"type\":\"DOWN\",\"x\":0,\"y\":0}"))
                .andExpect(jsonPath("$.phase").value("DRAGGING"))
                .andExpect(jsonPath("$.redraw").value(false));

        mockMvc.perform(post(base + "/pointer")
                        .contentType("application/json")
                        .content("{\"x\":5,\"y\":5}"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(put(base + "/scale")
                        .contentType("application/json")
                        .content("{\"scale\":-1}"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post(base + "/save"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.fileName").value("contract.pdf_sig.pdf"));

        mockMvc.perform(get(base + "/download"))
                .andExpect(status().isOk())
                .andExpect(content().contentType("application/pdf"));

        mockMvc.perform(get(base + "/invocation"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.args", hasItem("--page")))
                .andExpect(jsonPath("$.commandLine").value(startsWith("--input contract.pdf --stamp sig.png")));

        mockMvc.perform(delete(base))
                .andExpect(status().isNoContent());
        mockMvc.perform(get(base + "/preview"))
                .andExpect(status().isUnprocessableEntity());
    }

    private MockMultipartFile pdf(String name, int pages) throws Exception {
        Path pdf = TestDocuments.createPdf(tempDir.resolve(name), pages);
        return new MockMultipartFile("file", name, "application/pdf", Files.readAllBytes(pdf));
    }

    private MockMultipartFile png() throws Exception {
        Path png = TestDocuments.createStamp(tempDir.resolve("sig.png"), 30, 15);
        return new MockMultipartFile("stamp", "sig.png", "image/png", Files.readAllBytes(png));
    }
}
