package com.flamingo.ai.doctrine.service.ingest.model;

/**
 * A slice of a chapter's raw text sent to the model in one request.
 *
 * @param chapterIndex owning chapter
 * @param chunkIndex 0-based position inside the chapter
 * @param text chunk content
 */
public record TextChunk(int chapterIndex, int chunkIndex, String text) {}
