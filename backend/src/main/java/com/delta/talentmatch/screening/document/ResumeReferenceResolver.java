package com.delta.talentmatch.screening.document;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides whether a résumé reference points at a remote document or is the résumé text itself,
 * and rewrites Google Drive sharing links to their direct-download form.
 */
@Component
public class ResumeReferenceResolver {
    static final String DRIVE_DOWNLOAD_PREFIX = "https://drive.google.com/uc?export=download&id=";

    private static final Pattern DRIVE_FILE_PATH = Pattern.compile("drive\\.google\\.com/file/d/([A-Za-z0-9_-]+)");
    private static final Pattern DRIVE_ID_PARAM = Pattern.compile("drive\\.google\\.com/(?:open|uc)\\?(?:[^#]*&)?id=([A-Za-z0-9_-]+)");
    private static final Pattern BARE_DRIVE_ID = Pattern.compile("^[A-Za-z0-9_-]{25,}$");

    public boolean isRemote(String reference) {
        if (reference == null || reference.isBlank()) {
            return false;
        }
        String trimmed = reference.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return !containsWhitespace(trimmed);
        }
        return BARE_DRIVE_ID.matcher(trimmed).matches();
    }

    /**
     * Returns the URL to download for a remote reference. Callers check {@link #isRemote(String)} first.
     */
    public String toDownloadUrl(String reference) {
        String trimmed = reference.trim();
        if (BARE_DRIVE_ID.matcher(trimmed).matches()) {
            return DRIVE_DOWNLOAD_PREFIX + trimmed;
        }
        Matcher filePath = DRIVE_FILE_PATH.matcher(trimmed);
        if (filePath.find()) {
            return DRIVE_DOWNLOAD_PREFIX + filePath.group(1);
        }
        Matcher idParam = DRIVE_ID_PARAM.matcher(trimmed);
        if (idParam.find()) {
            return DRIVE_DOWNLOAD_PREFIX + idParam.group(1);
        }
        return trimmed;
    }

    private boolean containsWhitespace(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (Character.isWhitespace(value.charAt(i))) {
                return true;
            }
        }
        return false;
    }
}
