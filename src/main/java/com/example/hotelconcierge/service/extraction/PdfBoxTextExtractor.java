package com.example.hotelconcierge.service.extraction;

import com.example.hotelconcierge.model.rag.ExtractedText;
import com.example.hotelconcierge.model.rag.PageBoundary;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Texto pagina a pagina con PDFBox. Cada pagina acaba en '\n' y su rango [inicio, fin]
 * cubre el texto de la pagina sin ese salto.
 */
@Component
public class PdfBoxTextExtractor implements TextExtractor {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxTextExtractor.class);

    @Override
    public Set<String> extensions() {
        return Set.of("pdf");
    }

    @Override
    public ExtractedText extract(Path file, String originalFilename) {
        try (PDDocument pdf = Loader.loadPDF(file.toFile())) {
            PDFTextStripper stripper = new PDFTextStripper();
            StringBuilder text = new StringBuilder();
            List<PageBoundary> pages = new ArrayList<>();

            int pageCount = pdf.getNumberOfPages();
            for (int page = 1; page <= pageCount; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                String pageText = stripper.getText(pdf);

                int start = text.length();
                text.append(pageText).append('\n');
                pages.add(new PageBoundary(page, start, start + pageText.length()));
            }

            log.debug("PDF extraido file={} pages={} chars={}", originalFilename, pageCount, text.length());
            return new ExtractedText(text.toString(), List.copyOf(pages));
        } catch (IOException e) {
            log.error("Fallo PDFBox file={}: {}", originalFilename, e.getMessage());
            throw new DocumentExtractionException(originalFilename, "No se pudo leer el PDF: " + e.getMessage(), e);
        }
    }
}
