package com.flamingo.ai.doctrine.service.document;

import com.flamingo.ai.doctrine.service.ingest.model.Chapter;
import java.util.List;

/** Splits a document into chapters for extraction. */
public interface ChapterSplitter {

  /**
   * Splits the document.
   *
   * @param document the document
   * @return chapters in reading order, empty for a blank document
   */
  List<Chapter> split(Document document);
}
