package com.example.pdfmerge.interfaces.api;

import com.example.pdfmerge.support.TestDocuments;
import com.jayway.jsonpath.JsonPath;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End-to-end tests running uploads through the full application context and a temporary storage root.
 */
@SpringBootTest
@AutoConfigureMockMvc
class MergeFlowIntegrationTests {

    @TempDir
    static Path storageRoot;

    @Autowired
    private MockMvc mockMvc;

    @DynamicPropertySource
    static void storage(DynamicPropertyRegistry registry) {
        registry.add("pdfmerge.storage.upload-dir", () -> storageRoot.resolve("uploads").toString());
        registry.add("pdfmerge.storage.output-dir", () -> storageRoot.resolve("output").toString());
    }

    /**
     * Uploads an image and a document, then downloads the merged result.
     *
     * @throws Exception when the request fails or the result cannot be parsed
     */
    @Test
    void uploadThenDownload() throws Exception {
        MvcResult upload = mockMvc.perform(multipart("/upload")
                        .file(new MockMultipartFile("files", "scan.png", MediaType.IMAGE_PNG_VALUE, TestDocuments.png(300, 500)))
                        .file(new MockMultipartFile("files", "report.pdf", MediaType.APPLICATION_PDF_VALUE,
                                TestDocuments.pdf("First", "Second"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.pageCount").value(3))
                .andReturn();

        String downloadUrl = JsonPath.read(upload.getResponse().getContentAsString(), "$.downloadUrl");
        String filename = JsonPath.read(upload.getResponse().getContentAsString(), "$.filename");
        assertThat(downloadUrl).isEqualTo("/download/" + filename);

        byte[] merged = mockMvc.perform(get(downloadUrl))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_PDF))
                .andReturn().getResponse().getContentAsByteArray();

        try (PDDocument document = Loader.loadPDF(merged)) {
            assertThat(document.getNumberOfPages()).isEqualTo(3);
        }
        assertThat(listNames(storageRoot.resolve("uploads"))).isEmpty();
        assertThat(listNames(storageRoot.resolve("output"))).contains(filename);
    }

    /**
     * A bad file among good ones fails the request and leaves no files behind.
     *
     * @throws Exception when the request fails
     */
    @Test
    void unsupportedFileAmongValidOnesLeavesNothing() throws Exception {
        List<String> outputsBefore = listNames(storageRoot.resolve("output"));

        mockMvc.perform(multipart("/upload")
                        .file(new MockMultipartFile("files", "a.pdf", MediaType.APPLICATION_PDF_VALUE, TestDocuments.pdf("A")))
                        .file(new MockMultipartFile("files", "b.gif", "image/gif", "GIF89a".getBytes(StandardCharsets.US_ASCII))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("UNSUPPORTED_FORMAT"));

        assertThat(listNames(storageRoot.resolve("uploads"))).isEmpty();
        assertThat(listNames(storageRoot.resolve("output"))).containsExactlyInAnyOrderElementsOf(outputsBefore);
    }

    @Test
    void corruptImageFailsWithDecodeError() throws Exception {
        List<String> outputsBefore = listNames(storageRoot.resolve("output"));

        mockMvc.perform(multipart("/upload")
                        .file(new MockMultipartFile("files", "a.pdf", MediaType.APPLICATION_PDF_VALUE, TestDocuments.pdf("A")))
                        .file(new MockMultipartFile("files", "b.jpg", MediaType.IMAGE_JPEG_VALUE,
                                "not a jpeg".getBytes(StandardCharsets.US_ASCII))))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("DECODE_ERROR"));

        assertThat(listNames(storageRoot.resolve("output"))).containsExactlyInAnyOrderElementsOf(outputsBefore);
    }

    @Test
    void downloadOfUnknownFileIsNotFound() throws Exception {
        mockMvc.perform(get("/download/{filename}", "merged_19700101_000000_00000000.pdf"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("OUTPUT_NOT_FOUND"));
    }

    private static List<String> listNames(Path directory) throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            return files.map(path -> path.getFileName().toString()).toList();
        }
    }
}
