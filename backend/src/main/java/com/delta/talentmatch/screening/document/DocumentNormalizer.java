package com.delta.talentmatch.screening.document;

import com.delta.talentmatch.config.ScreeningProperties;
import com.delta.talentmatch.screening.model.DocumentFetchResult;
import com.delta.talentmatch.screening.model.DocumentFormat;
import com.delta.talentmatch.screening.model.NormalizedDocument;
import com.delta.talentmatch.screening.util.FailureReasonClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns a résumé reference into bounded, whitespace-normalized plain text.
 *
 * <p>Never throws for bad input: fetch and extraction failures come back as
 * {@link NormalizedDocument#failed(DocumentFormat, String)} with a reason code.
 */
@Service
public class DocumentNormalizer {
    private static final Logger log = LoggerFactory.getLogger(DocumentNormalizer.class);

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\p{Cntrl}&&[^\\n\\t]]");
    private static final Pattern HORIZONTAL_SPACE = Pattern.compile("[ \\t\\u00a0\\u2000-\\u200b]+");
    private static final Pattern SPACE_AROUND_NEWLINE = Pattern.compile(" *\\n *");
    private static final Pattern BLANK_LINES = Pattern.compile("\\n{3,}");

    private final ScreeningProperties properties;
    private final DocumentFetcher fetcher;
    private final DocumentTextExtractor extractor;
    private final ResumeReferenceResolver referenceResolver;

    public DocumentNormalizer(
        ScreeningProperties properties,
        DocumentFetcher fetcher,
        DocumentTextExtractor extractor,
        ResumeReferenceResolver referenceResolver
    ) {
        this.properties = properties;
        this.fetcher = fetcher;
        this.extractor = extractor;
        this.referenceResolver = referenceResolver;
    }

    public NormalizedDocument normalize(String resumeReference) {
        if (resumeReference == null || resumeReference.isBlank()) {
            return NormalizedDocument.failed(DocumentFormat.UNKNOWN, FailureReasonClassifier.NO_RESUME_FIELD);
        }
        if (!referenceResolver.isRemote(resumeReference)) {
            return finish(resumeReference, DocumentFormat.PLAIN_TEXT);
        }
        String url = referenceResolver.toDownloadUrl(resumeReference);
        try {
            DocumentFetchResult fetched = fetchOrThrow(url);
            return normalizeBytes(fetched.bodyBytes(), fetched.contentType(), fileNameOf(fetched));
        } catch (DocumentFetchException e) {
            log.warn("Résumé fetch failed ({}): {}", e.getReasonCode(), e.getMessage());
            return NormalizedDocument.failed(DocumentFormat.UNKNOWN, e.getReasonCode());
        }
    }

    public NormalizedDocument normalizeBytes(byte[] content, String contentType, String fileName) {
        DocumentFormat format = extractor.detectFormat(content, contentType, fileName);
        try {
            String raw = extractor.extract(content, format);
            return finish(raw, format);
        } catch (DocumentExtractException e) {
            log.warn("Document extraction failed for format {} ({}): {}", format, e.getReasonCode(), e.getMessage());
            return NormalizedDocument.failed(format, e.getReasonCode());
        } catch (RuntimeException e) {
            log.warn("Document extraction failed for format {}: {}", format, e.toString());
            return NormalizedDocument.failed(format, FailureReasonClassifier.EXTRACTION_FAILED);
        }
    }

    public String clean(String raw) {
        if (raw == null) {
            return "";
        }
        String text = raw.replace("\r\n", "\n").replace('\r', '\n');
        text = CONTROL_CHARS.matcher(text).replaceAll("");
        text = HORIZONTAL_SPACE.matcher(text).replaceAll(" ");
        text = SPACE_AROUND_NEWLINE.matcher(text).replaceAll("\n");
        text = BLANK_LINES.matcher(text).replaceAll("\n\n");
        text = text.strip();
        int maxChars = properties.getDocument().getMaxTextChars();
        if (text.length() > maxChars) {
            text = text.substring(0, maxChars).strip();
        }
        return text;
    }

    private NormalizedDocument finish(String raw, DocumentFormat format) {
        String text = clean(raw);
        if (text.length() < properties.getDocument().getMinTextChars()) {
            log.warn("Extracted {} text is near-empty ({} chars)", format, text.length());
            return NormalizedDocument.failed(format, FailureReasonClassifier.TEXT_TOO_SHORT);
        }
        return NormalizedDocument.success(text, format);
    }

    private DocumentFetchResult fetchOrThrow(String url) {
        DocumentFetchResult result = fetcher.fetch(url);
        if (result == null) {
            throw new DocumentFetchException(FailureReasonClassifier.UNKNOWN, "No fetch result for " + url);
        }
        if (result.errorCode() != null) {
            throw new DocumentFetchException(
                FailureReasonClassifier.fromErrorCode(result.errorCode(), result.errorMessage()),
                result.errorCode() + " fetching " + url
            );
        }
        if (!result.isSuccessful()) {
            throw new DocumentFetchException(
                FailureReasonClassifier.fromHttpStatus(result.statusCode()),
                "HTTP " + result.statusCode() + " fetching " + url
            );
        }
        return result;
    }

    private String fileNameOf(DocumentFetchResult result) {
        String disposition = result.contentDisposition();
        if (disposition != null) {
            int idx = disposition.toLowerCase(Locale.ROOT).indexOf("filename=");
            if (idx >= 0) {
                String name = disposition.substring(idx + "filename=".length()).trim();
                int semicolon = name.indexOf(';');
                if (semicolon >= 0) {
                    name = name.substring(0, semicolon);
                }
                return name.replace("\"", "").trim();
            }
        }
        String path = result.finalUri() != null ? result.finalUri().getPath() : null;
        return path == null ? null : path.substring(path.lastIndexOf('/') + 1);
    }
}
