package com.flamingo.ai.doctrine.service.document;

import java.util.List;

/**
 * An ingested document as an ordered list of page texts.
 *
 * @param name display name, usually the file name
 * @param pages page texts in reading order
 */
public record Document(String name, List<String> pages) {

  /** Separator placed between pages when the document is flattened. */
  public static final String PAGE_SEPARATOR = "\n\f\n";

  public Document {
    pages = pages == null ? List.of() : List.copyOf(pages);
  }

  public static Document ofText(String name, String text) {
    return new Document(name, List.of(text == null ? "" : text));
  }

  public String fullText() {
    return String.join(PAGE_SEPARATOR, pages);
  }

  public boolean isBlank() {
    return pages.stream().allMatch(String::isBlank);
  }
}
