package com.ragguard.service;

import com.ragguard.backend.ObjectStore;
import com.ragguard.exception.PdfSplitException;
import com.ragguard.exception.ValidationException;
import com.ragguard.model.PdfChunk;
import com.ragguard.model.SplitReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.multipdf.Splitter;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Splits staged PDFs into fixed-size page windows so each part stays within the
 * knowledge base's per-document limits
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PdfSplitService {

    static final String PDF_CONTENT_TYPE = "application/pdf";

    private final ObjectStore objectStore;

    @Value("${pdf.max-pages-per-chunk:20}")
    private int maxPagesPerChunk;

    @Value("${pdf.input-prefix:input/}")
    private String inputPrefix;

    @Value("${pdf.output-prefix:output/}")
    private String outputPrefix;

    @Value("${pdf.processed-prefix:processed/}")
    private String processedPrefix;

    /**
     * Consecutive windows of at most {@code maxPagesPerChunk} pages. A document at or
     * below the limit comes back as one chunk holding the original bytes.
     *
     * @throws PdfSplitException when the bytes are not a readable PDF
     */
    public List<PdfChunk> split(byte[] pdfContent) {
        try (PDDocument document = Loader.loadPDF(pdfContent)) {
            int pageCount = document.getNumberOfPages();
            if (pageCount <= maxPagesPerChunk) {
                return List.of(new PdfChunk(1, 1, pageCount, pdfContent));
            }

            Splitter splitter = new Splitter();
            splitter.setSplitAtPage(maxPagesPerChunk);
            List<PDDocument> parts = splitter.split(document);

            List<PdfChunk> chunks = new ArrayList<>();
            int startPage = 1;
            try {
                for (int i = 0; i < parts.size(); i++) {
                    PDDocument part = parts.get(i);
                    int endPage = startPage + part.getNumberOfPages() - 1;
                    log.info("Creating chunk {}: pages {}-{}", i + 1, startPage, endPage);

                    ByteArrayOutputStream out = new ByteArrayOutputStream();
                    part.save(out);
                    chunks.add(new PdfChunk(i + 1, startPage, endPage, out.toByteArray()));
                    startPage = endPage + 1;
                }
            } finally {
                for (PDDocument part : parts) {
                    part.close();
                }
            }
            return chunks;

        } catch (IOException e) {
            throw new PdfSplitException("Could not read PDF: " + e.getMessage(), e);
        }
    }

    /**
     * Splits a stored PDF. Large documents are written as
     * {@code output/<name>_part_<n>.pdf}; small ones are moved to {@code processed/}.
     */
    public SplitReport splitObject(String objectKey) {
        if (objectKey == null || objectKey.isBlank()) {
            throw new ValidationException("Object key is required");
        }
        String key = objectKey.startsWith(inputPrefix) ? objectKey : inputPrefix + objectKey;
        if (!key.toLowerCase(Locale.ROOT).endsWith(".pdf")) {
            throw new ValidationException("Only PDF objects can be split: " + objectKey);
        }
        String baseName = key.substring(inputPrefix.length(), key.length() - ".pdf".length());

        try {
            byte[] content = objectStore.get(key);
            List<PdfChunk> chunks = split(content);
            int pageCount = chunks.get(chunks.size() - 1).getEndPage();
            log.info("PDF {} has {} pages", key, pageCount);

            if (chunks.size() == 1) {
                String processedKey = processedPrefix + baseName + ".pdf";
                objectStore.put(processedKey, content, PDF_CONTENT_TYPE, Collections.emptyMap());
                objectStore.delete(key);
                log.info("Moved PDF to: {}", processedKey);
                return new SplitReport(key, pageCount, false, List.of(processedKey));
            }

            List<String> outputKeys = new ArrayList<>();
            for (PdfChunk chunk : chunks) {
                String outputKey = outputPrefix + baseName + "_part_" + chunk.getIndex() + ".pdf";
                objectStore.put(outputKey, chunk.getContent(), PDF_CONTENT_TYPE, Map.of(
                        "source_key", key,
                        "start_page", String.valueOf(chunk.getStartPage()),
                        "end_page", String.valueOf(chunk.getEndPage())));
                outputKeys.add(outputKey);
                log.info("Uploaded chunk to: {}", outputKey);
            }
            log.info("Successfully split {} into {} parts", key, chunks.size());
            return new SplitReport(key, pageCount, true, outputKeys);

        } catch (IOException e) {
            throw new PdfSplitException("Object store error while splitting " + key + ": " + e.getMessage(), e);
        }
    }
}
