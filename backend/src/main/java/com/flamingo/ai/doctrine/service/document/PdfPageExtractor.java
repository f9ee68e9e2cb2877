package com.flamingo.ai.doctrine.service.document;

import com.flamingo.ai.doctrine.exception.DocumentProcessingException;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

/** Loads a PDF into a {@link Document}, one entry per page, using PDFBox. */
@Service
@Slf4j
public class PdfPageExtractor {

  public Document extract(String fileName, InputStream inputStream) {
    try {
      byte[] bytes = inputStream.readAllBytes();
      try (PDDocument pdf = Loader.loadPDF(bytes)) {
        return new Document(fileName, extractPages(pdf));
      }
    } catch (IOException e) {
      log.error("PDF parsing failed for {}: {}", fileName, e.getMessage());
      throw new DocumentProcessingException(fileName, "Failed to parse PDF: " + e.getMessage(), e);
    }
  }

  private List<String> extractPages(PDDocument pdf) throws IOException {
    PDFTextStripper stripper = new PDFTextStripper();
    int pageCount = pdf.getNumberOfPages();
    List<String> pages = new ArrayList<>(pageCount);
    for (int page = 1; page <= pageCount; page++) {
      stripper.setStartPage(page);
      stripper.setEndPage(page);
      pages.add(stripper.getText(pdf));
    }
    log.debug("Extracted {} pages", pageCount);
    return pages;
  }
}
