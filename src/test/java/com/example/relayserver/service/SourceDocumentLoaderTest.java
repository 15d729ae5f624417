package com.example.relayserver.service;

import com.example.relayserver.model.SourceDocument;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class SourceDocumentLoaderTest {

    @TempDir
    Path tempDir;

    private final SourceDocumentLoader loader = new SourceDocumentLoader();

    @Test
    void textFileGetsChecksumAndSample() throws Exception {
        Path file = tempDir.resolve("00-MF-12.S40");
        Files.write(file, "abc".getBytes(StandardCharsets.US_ASCII));

        SourceDocument doc = loader.load(file);

        assertThat(doc.getChecksum()).isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
        assertThat(doc.getSize()).isEqualTo(3);
        assertThat(doc.getPageCount()).isEqualTo(1);
        assertThat(doc.getContentSample()).isEqualTo("abc");
        assertThat(doc.getExtension()).isEqualTo(".S40");
        assertThat(doc.isPdf()).isFalse();
    }

    @Test
    void sampleIsLimited() throws Exception {
        Path file = tempDir.resolve("big.txt");
        Files.write(file, new byte[SourceDocumentLoader.SAMPLE_BYTES * 2]);

        assertThat(loader.load(file).getContentSample()).hasSize(SourceDocumentLoader.SAMPLE_BYTES);
    }

    @Test
    void pdfSampleIsFirstPageText() throws Exception {
        Path file = tempDir.resolve("relay.PDF");
        try (PDDocument pdf = new PDDocument()) {
            for (String text : new String[]{"MiCOM P122 Settings", "0104: Line CT primary"}) {
                PDPage page = new PDPage();
                pdf.addPage(page);
                try (PDPageContentStream cs = new PDPageContentStream(pdf, page)) {
                    cs.beginText();
                    cs.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
                    cs.newLineAtOffset(50, 700);
                    cs.showText(text);
                    cs.endText();
                }
            }
            pdf.save(file.toFile());
        }

        SourceDocument doc = loader.load(file);

        assertThat(doc.isPdf()).isTrue();
        assertThat(doc.getPageCount()).isEqualTo(2);
        assertThat(doc.getContentSample()).contains("MiCOM P122").doesNotContain("0104");
    }
}
