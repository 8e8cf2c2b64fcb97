package com.corpusindex.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.encryption.AccessPermission;
import org.apache.pdfbox.pdmodel.encryption.StandardProtectionPolicy;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSystemDocumentLoaderTest {

    @TempDir
    Path tempDir;

    private static PDDocument singlePagePdf(String line) throws Exception {
        PDDocument pdf = new PDDocument();
        PDPage page = new PDPage();
        pdf.addPage(page);
        try (PDPageContentStream content = new PDPageContentStream(pdf, page)) {
            content.beginText();
            content.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
            content.newLineAtOffset(72, 700);
            content.showText(line);
            content.endText();
        }
        return pdf;
    }

    @Test
    void shouldLoadSupportedFilesInNameOrderWithRelativeNames() throws Exception {
        Files.createDirectories(tempDir.resolve("b"));
        Files.writeString(tempDir.resolve("b/second.MD"), "second document\n");
        Files.writeString(tempDir.resolve("a.txt"), "  first document, leading spaces kept");
        Files.writeString(tempDir.resolve("skip.docx"), "binary");

        DocumentLoadResult result = new FileSystemDocumentLoader(tempDir, List.of(".md", ".txt")).loadAll();

        assertEquals(List.of("a.txt", "b/second.MD"), result.documents().stream().map(Document::name).toList());
        assertEquals("  first document, leading spaces kept", result.documents().get(0).text());
        assertTrue(result.failures().isEmpty());
    }

    @Test
    void shouldReportEmptyDocumentsAsLoadFailures() throws Exception {
        Files.writeString(tempDir.resolve("empty.md"), "");
        Files.writeString(tempDir.resolve("ok.md"), "content");

        DocumentLoadResult result = new FileSystemDocumentLoader(tempDir, List.of(".md")).loadAll();

        assertEquals(1, result.documents().size());
        assertEquals(1, result.failures().size());
        assertEquals("empty.md", result.failures().get(0).documentName());
        assertTrue(result.failures().get(0).reason().startsWith("Empty content"));
    }

    @Test
    void shouldFailWhenSourceDirectoryIsMissing() {
        FileSystemDocumentLoader loader = new FileSystemDocumentLoader(tempDir.resolve("missing"), List.of(".md"));

        assertThrows(DocumentLoadException.class, loader::loadAll);
    }

    @Test
    void shouldExtractTextFromPdf() throws Exception {
        try (PDDocument pdf = singlePagePdf("Badges are issued at the front desk")) {
            pdf.save(tempDir.resolve("guide.pdf").toFile());
        }

        DocumentLoadResult result = new FileSystemDocumentLoader(tempDir, List.of(".pdf")).loadAll();

        assertTrue(result.failures().isEmpty(), result.failures().toString());
        assertEquals("guide.pdf", result.documents().get(0).name());
        assertTrue(result.documents().get(0).text().contains("Badges are issued at the front desk"));
    }

    @Test
    void shouldReportUnreadableAndEncryptedPdfsAsLoadFailures() throws Exception {
        Files.writeString(tempDir.resolve("broken.pdf"), "not a pdf at all");
        try (PDDocument pdf = singlePagePdf("secret")) {
            StandardProtectionPolicy policy = new StandardProtectionPolicy("owner-password", "", new AccessPermission());
            policy.setEncryptionKeyLength(128);
            pdf.protect(policy);
            pdf.save(tempDir.resolve("locked.pdf").toFile());
        }
        Files.writeString(tempDir.resolve("notes.md"), "plain notes");

        DocumentLoadResult result = new FileSystemDocumentLoader(tempDir, List.of(".md", ".pdf")).loadAll();

        assertEquals(List.of("notes.md"), result.documents().stream().map(Document::name).toList());
        assertEquals(List.of("broken.pdf", "locked.pdf"),
                result.failures().stream().map(DocumentFailure::documentName).toList());
        assertTrue(result.failures().stream().allMatch(failure -> failure.stage() == DocumentFailure.Stage.LOAD));
        assertTrue(result.failures().get(1).reason().startsWith("Encrypted PDF"));
    }

    @Test
    void shouldWrapListingErrorsInDocumentLoadException() throws Exception {
        Path sealed = tempDir.resolve("sealed");
        Files.createDirectories(sealed);
        Files.writeString(sealed.resolve("inside.md"), "hidden");
        Files.writeString(tempDir.resolve("visible.md"), "visible");
        try {
            Files.setPosixFilePermissions(sealed, PosixFilePermissions.fromString("---------"));
        } catch (UnsupportedOperationException e) {
            Assumptions.abort("POSIX permissions not supported");
        }
        try {
            Assumptions.assumeFalse(Files.isReadable(sealed), "running with permission to read every directory");

            DocumentLoadException thrown = assertThrows(DocumentLoadException.class,
                    () -> new FileSystemDocumentLoader(tempDir, List.of(".md")).loadAll());
            assertTrue(thrown.getMessage().startsWith("Unable to list"));
        } finally {
            Files.setPosixFilePermissions(sealed, PosixFilePermissions.fromString("rwx------"));
        }
    }
}
