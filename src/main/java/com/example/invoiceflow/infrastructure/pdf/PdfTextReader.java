package com.example.invoiceflow.infrastructure.pdf;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Infrastructure service that reads the text of a PDF page by page with PDFBox.
 * Hides the PDFBox loading and stripping details from the application layer.
 */
@Service
public class PdfTextReader {

    /**
     * Opens the PDF and extracts the text of every page in page order.
     *
     * @param pdfFile local PDF file
     * @return page texts, one entry per page, trailing whitespace removed
     * @throws IOException when PDFBox cannot open or read the document
     */
    public PdfPages readPages(Path pdfFile) throws IOException {
        try (PDDocument document = Loader.loadPDF(pdfFile.toFile())) {
            int pageCount = document.getNumberOfPages();
            List<String> pages = new ArrayList<>(pageCount);
            PDFTextStripper stripper = new PDFTextStripper();
            configureStripper(stripper);
            for (int pageNumber = 1; pageNumber <= pageCount; pageNumber++) {
                stripper.setStartPage(pageNumber);
                stripper.setEndPage(pageNumber);
                pages.add(stripper.getText(document).stripTrailing());
            }
            return new PdfPages(pages);
        }
    }

    /**
     * Applies the stripper configuration shared by every page.
     *
     * @param stripper stripper to configure
     */
    private void configureStripper(PDFTextStripper stripper) {
        stripper.setSortByPosition(true);
        stripper.setShouldSeparateByBeads(true);
        stripper.setSuppressDuplicateOverlappingText(false);
        stripper.setLineSeparator("\n");
    }

    /**
     * Page texts of one document.
     */
    public record PdfPages(List<String> pages) {

        public PdfPages {
            pages = List.copyOf(pages);
        }

        public int pageCount() {
            return pages.size();
        }

        /**
         * @return page texts joined by a single newline; empty for a document without pages
         */
        public String joinedText() {
            return String.join("\n", pages);
        }
    }
}
