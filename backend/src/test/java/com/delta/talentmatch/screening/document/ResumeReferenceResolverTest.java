package com.delta.talentmatch.screening.document;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResumeReferenceResolverTest {
    private static final String FILE_ID = "1AbCdEfGhIjKlMnOpQrStUvWxYz012345";

    private final ResumeReferenceResolver resolver = new ResumeReferenceResolver();

    @Test
    void driveSharingLinksBecomeDirectDownloads() {
        String expected = ResumeReferenceResolver.DRIVE_DOWNLOAD_PREFIX + FILE_ID;
        assertEquals(expected, resolver.toDownloadUrl("https://drive.google.com/file/d/" + FILE_ID + "/view?usp=sharing"));
        assertEquals(expected, resolver.toDownloadUrl("https://drive.google.com/open?id=" + FILE_ID));
        assertEquals(expected, resolver.toDownloadUrl(FILE_ID));
    }

    @Test
    void otherUrlsAreKept() {
        assertEquals("https://cv.example.com/jane.pdf", resolver.toDownloadUrl(" https://cv.example.com/jane.pdf "));
    }

    @Test
    void inlineTextIsNotRemote() {
        assertTrue(resolver.isRemote("https://cv.example.com/jane.pdf"));
        assertTrue(resolver.isRemote(FILE_ID));
        assertFalse(resolver.isRemote("https://example.com is where my portfolio lives"));
        assertFalse(resolver.isRemote("Jane Doe, backend engineer"));
        assertFalse(resolver.isRemote(null));
    }
}
