package it.aw.annotator.llm;

import it.aw.annotator.model.DocumentDigest;

public interface DocumentSummarizer {

    DocumentDigest summarize(String fullText);
}
