package com.delta.talentmatch.screening.document;

import com.delta.talentmatch.config.ScreeningProperties;
import com.delta.talentmatch.screening.model.DocumentFormat;
import com.delta.talentmatch.screening.util.FailureReasonClassifier;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Format detection and per-format text extraction for résumés and uploaded job descriptions.
 */
@Component
public class DocumentTextExtractor {
    private static final String DOCX_BODY_ENTRY = "word/document.xml";
    private static final int SNIFF_CHARS = 4096;
    private static final int READ_BUFFER_BYTES = 8192;

    private final ScreeningProperties properties;

    public DocumentTextExtractor(ScreeningProperties properties) {
        this.properties = properties;
    }

    public DocumentFormat detectFormat(byte[] content, String contentType, String fileName) {
        if (content == null || content.length == 0) {
            return DocumentFormat.UNKNOWN;
        }
        String mt = contentType == null ? "" : contentType.toLowerCase(Locale.ROOT);
        String fn = fileName == null ? "" : fileName.toLowerCase(Locale.ROOT);

        if (startsWith(content, "%PDF") || mt.contains("application/pdf") || fn.endsWith(".pdf")) {
            return DocumentFormat.PDF;
        }
        if (startsWith(content, "PK") && (mt.contains("wordprocessingml") || fn.endsWith(".docx") || hasZipEntry(content, DOCX_BODY_ENTRY))) {
            return DocumentFormat.DOCX;
        }
        if (mt.contains("text/html") || mt.contains("application/xhtml") || fn.endsWith(".html") || fn.endsWith(".htm")
            || looksLikeHtml(content)) {
            return DocumentFormat.HTML;
        }
        if (mt.startsWith("text/") || fn.endsWith(".txt") || fn.endsWith(".md") || looksLikeText(content)) {
            return DocumentFormat.PLAIN_TEXT;
        }
        return DocumentFormat.UNKNOWN;
    }

    public String extract(byte[] content, DocumentFormat format) {
        if (content == null || content.length == 0) {
            throw new DocumentExtractException(FailureReasonClassifier.EXTRACTION_FAILED, "Empty document body");
        }
        return switch (format) {
            case PDF -> extractPdf(content);
            case DOCX -> extractDocx(content);
            case HTML -> extractHtml(content);
            case PLAIN_TEXT -> decodeText(content);
            case UNKNOWN -> throw new DocumentExtractException(FailureReasonClassifier.UNSUPPORTED_FORMAT, "Unsupported document format");
        };
    }

    private String extractPdf(byte[] content) {
        try (PDDocument doc = Loader.loadPDF(content)) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            return stripper.getText(doc);
        } catch (IOException e) {
            throw new DocumentExtractException(FailureReasonClassifier.EXTRACTION_FAILED, "PDF extraction failed: " + e.getMessage(), e);
        }
    }

    private String extractDocx(byte[] content) {
        String xml = readZipEntry(content, DOCX_BODY_ENTRY);
        if (xml == null) {
            throw new DocumentExtractException(FailureReasonClassifier.EXTRACTION_FAILED, "DOCX body part missing");
        }
        Document doc = Jsoup.parse(xml, "", Parser.xmlParser());
        StringBuilder out = new StringBuilder();
        for (Element paragraph : doc.select("w|p")) {
            StringBuilder line = new StringBuilder();
            for (Element run : paragraph.select("w|t, w|tab, w|br")) {
                String tag = run.tagName();
                if (tag.endsWith("tab")) {
                    line.append('\t');
                } else if (tag.endsWith("br")) {
                    line.append('\n');
                } else {
                    line.append(run.wholeText());
                }
            }
            out.append(line).append('\n');
        }
        return out.toString();
    }

    private String extractHtml(byte[] content) {
        Document doc = Jsoup.parse(decodeText(content));
        doc.select("script, style, noscript, nav, header, footer").remove();
        StringBuilder out = new StringBuilder();
        for (Element block : doc.select("h1, h2, h3, h4, h5, h6, p, li, td, th, pre, dt, dd")) {
            String text = block.text();
            if (!text.isBlank()) {
                out.append(text).append('\n');
            }
        }
        if (out.length() == 0 && doc.body() != null) {
            return doc.body().text();
        }
        return out.toString();
    }

    private String decodeText(byte[] content) {
        Charset charset = StandardCharsets.UTF_8;
        int offset = 0;
        if (content.length >= 2) {
            int b0 = content[0] & 0xFF;
            int b1 = content[1] & 0xFF;
            if (b0 == 0xFE && b1 == 0xFF) {
                charset = StandardCharsets.UTF_16BE;
                offset = 2;
            } else if (b0 == 0xFF && b1 == 0xFE) {
                charset = StandardCharsets.UTF_16LE;
                offset = 2;
            }
        }
        if (offset == 0 && content.length >= 3
            && (content[0] & 0xFF) == 0xEF && (content[1] & 0xFF) == 0xBB && (content[2] & 0xFF) == 0xBF) {
            offset = 3;
        }
        return new String(content, offset, content.length - offset, charset);
    }

    private boolean looksLikeHtml(byte[] content) {
        String head = sniff(content).stripLeading().toLowerCase(Locale.ROOT);
        return head.startsWith("<!doctype html") || head.startsWith("<html") || head.contains("<body");
    }

    private boolean looksLikeText(byte[] content) {
        String head = sniff(content);
        if (head.isEmpty()) {
            return false;
        }
        int control = 0;
        for (int i = 0; i < head.length(); i++) {
            char c = head.charAt(i);
            if (c == 0) {
                return false;
            }
            if (Character.isISOControl(c) && c != '\n' && c != '\r' && c != '\t') {
                control++;
            }
            if (c == '�') {
                control++;
            }
        }
        return control * 20 < head.length();
    }

    private String sniff(byte[] content) {
        int length = Math.min(content.length, SNIFF_CHARS);
        return new String(content, 0, length, StandardCharsets.UTF_8);
    }

    private boolean startsWith(byte[] content, String magic) {
        if (content.length < magic.length()) {
            return false;
        }
        for (int i = 0; i < magic.length(); i++) {
            if (content[i] != (byte) magic.charAt(i)) {
                return false;
            }
        }
        return true;
    }

    private boolean hasZipEntry(byte[] content, String entryName) {
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(content))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                if (entryName.equals(entry.getName())) {
                    return true;
                }
            }
            return false;
        } catch (IOException e) {
            return false;
        }
    }

    private String readZipEntry(byte[] content, String entryName) {
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(content))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                if (entryName.equals(entry.getName())) {
                    return new String(readBounded(zip, properties.getDocument().getMaxUnpackedBytes()), StandardCharsets.UTF_8);
                }
            }
            return null;
        } catch (IOException e) {
            throw new DocumentExtractException(FailureReasonClassifier.EXTRACTION_FAILED, "Corrupt DOCX archive: " + e.getMessage(), e);
        }
    }

    private byte[] readBounded(ZipInputStream zip, int maxBytes) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buffer = new byte[READ_BUFFER_BYTES];
        int total = 0;
        int read;
        while ((read = zip.read(buffer)) != -1) {
            total += read;
            if (total > maxBytes) {
                throw new DocumentExtractException(
                    FailureReasonClassifier.TOO_LARGE,
                    "DOCX body part exceeds " + maxBytes + " unpacked bytes"
                );
            }
            out.write(buffer, 0, read);
        }
        return out.toByteArray();
    }
}
