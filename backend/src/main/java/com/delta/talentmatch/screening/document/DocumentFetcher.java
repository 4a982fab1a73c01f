package com.delta.talentmatch.screening.document;

import com.delta.talentmatch.screening.model.DocumentFetchResult;

/**
 * Retrieves the raw bytes behind a remote résumé reference. Implementations report failures through
 * {@link DocumentFetchResult#errorCode()} or a non-2xx status instead of throwing.
 */
public interface DocumentFetcher {
    DocumentFetchResult fetch(String url);
}
