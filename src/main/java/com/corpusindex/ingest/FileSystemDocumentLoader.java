package com.corpusindex.ingest;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads UTF-8 text documents and the text layer of PDF files from a directory tree. Document names are paths relative to the source
 * directory with forward slashes, so they are stable across platforms.
 */
public class FileSystemDocumentLoader implements DocumentLoader {
    private static final Logger log = LoggerFactory.getLogger(FileSystemDocumentLoader.class);
    static final String PDF_EXTENSION = ".pdf";

    private final Path sourceDir;
    private final List<String> extensions;

    public FileSystemDocumentLoader(Path sourceDir, List<String> extensions) {
        this.sourceDir = sourceDir;
        this.extensions = extensions.stream().map(ext -> ext.toLowerCase(Locale.ROOT)).toList();
    }

    @Override
    public DocumentLoadResult loadAll() throws IOException {
        if (!Files.isDirectory(sourceDir)) {
            throw new DocumentLoadException(sourceDir.toString(),
                    "Source directory not found: " + sourceDir.toAbsolutePath().normalize());
        }
        List<Path> files;
        try (Stream<Path> walk = Files.walk(sourceDir)) {
            files = walk.filter(Files::isRegularFile).sorted().toList();
        } catch (UncheckedIOException e) {
            throw new DocumentLoadException(sourceDir.toString(),
                    "Unable to list " + sourceDir + ": " + e.getCause().getMessage(), e.getCause());
        }

        List<Document> documents = new ArrayList<>();
        List<DocumentFailure> failures = new ArrayList<>();
        for (Path file : files) {
            String name = documentName(file);
            if (!isSupported(file)) {
                log.warn("documents.skip name={} reason=unsupported-extension", name);
                continue;
            }
            try {
                documents.add(load(file));
            } catch (DocumentLoadException e) {
                log.warn("documents.load.failed name={} reason={}", name, e.getMessage());
                failures.add(new DocumentFailure(name, DocumentFailure.Stage.LOAD, e.getMessage()));
            }
        }
        log.info("documents.loaded dir={} loaded={} failed={}", sourceDir, documents.size(), failures.size());
        return new DocumentLoadResult(documents, failures);
    }

    public Document load(Path file) throws DocumentLoadException {
        String name = documentName(file);
        String text;
        try {
            text = isPdf(file) ? readPdf(file, name) : Files.readString(file, StandardCharsets.UTF_8);
        } catch (DocumentLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new DocumentLoadException(name, "Unable to read " + name + ": " + e, e);
        }
        if (text.isBlank()) {
            throw new DocumentLoadException(name, "Empty content for " + name);
        }
        return new Document(name, text, file.toAbsolutePath().normalize().toString());
    }

    private static String readPdf(Path file, String name) throws IOException {
        try (PDDocument pdf = Loader.loadPDF(file.toFile())) {
            if (pdf.isEncrypted()) {
                throw new DocumentLoadException(name, "Encrypted PDF not supported: " + name);
            }
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            String text = stripper.getText(pdf);
            log.debug("documents.pdf name={} pages={} chars={}", name, pdf.getNumberOfPages(), text.length());
            return text;
        }
    }

    private static boolean isPdf(Path file) {
        return file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(PDF_EXTENSION);
    }

    private boolean isSupported(Path file) {
        String fileName = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return extensions.stream().anyMatch(fileName::endsWith);
    }

    private String documentName(Path file) {
        return sourceDir.relativize(file).toString().replace('\\', '/');
    }
}
