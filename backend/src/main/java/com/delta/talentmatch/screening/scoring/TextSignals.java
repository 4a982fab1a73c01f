package com.delta.talentmatch.screening.scoring;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tokenizing and term-matching helpers shared by the scorers and modifiers. All methods are pure.
 */
public final class TextSignals {
    private static final Pattern TOKEN = Pattern.compile("[a-z0-9][a-z0-9+#]*(?:\\.[a-z0-9]+)*");
    private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+|\\n+");
    private static final int FREE_TEXT_MIN_WORDS = 3;
    private static final Map<String, Pattern> TERM_PATTERNS = new ConcurrentHashMap<>();

    public static final Set<String> STOPWORDS = Set.of(
        "a", "an", "and", "are", "as", "at", "be", "been", "but", "by", "can", "do", "for", "from", "has", "have",
        "he", "her", "his", "how", "i", "if", "in", "into", "is", "it", "its", "job", "me", "my", "no", "not",
        "of", "on", "or", "our", "ours", "role", "she", "so", "such", "than", "that", "the", "their", "them",
        "then", "there", "these", "they", "this", "those", "to", "us", "was", "we", "were", "what", "when",
        "where", "which", "who", "why", "will", "with", "work", "would", "you", "your", "yours", "also", "about",
        "all", "any", "each", "other", "some", "very", "more", "most", "must", "should", "may", "able", "etc",
        "using", "use", "looking", "join", "new", "well", "strong", "good", "great", "including", "within"
    );

    private TextSignals() {
    }

    public static String lower(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }

    public static List<String> tokens(String text) {
        List<String> out = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(lower(text));
        while (matcher.find()) {
            out.add(matcher.group());
        }
        return out;
    }

    /**
     * Distinct stemmed tokens of at least three characters, stopwords removed, in first-seen order.
     */
    public static Set<String> contentTerms(String text) {
        Set<String> out = new LinkedHashSet<>();
        for (String token : tokens(text)) {
            if (token.length() < 3 || STOPWORDS.contains(token) || isNumeric(token)) {
                continue;
            }
            out.add(stem(token));
        }
        return out;
    }

    public static Set<String> stems(String text) {
        Set<String> out = new LinkedHashSet<>();
        for (String token : tokens(text)) {
            out.add(stem(token));
        }
        return out;
    }

    public static Set<String> stemAll(Collection<String> terms) {
        Set<String> out = new LinkedHashSet<>();
        for (String term : terms) {
            out.add(stem(term));
        }
        return out;
    }

    /** Light suffix stripping so "optimize", "optimized" and "optimizing" meet on one stem. */
    public static String stem(String token) {
        if (token == null) {
            return "";
        }
        String t = token.toLowerCase(Locale.ROOT);
        if (t.length() <= 3 || !Character.isLetter(t.charAt(t.length() - 1))) {
            return t;
        }
        String base = stripSuffix(t);
        if (base.length() > 4 && base.endsWith("e")) {
            base = base.substring(0, base.length() - 1);
        }
        return base;
    }

    private static String stripSuffix(String t) {
        if ((t.endsWith("ies") || t.endsWith("ied")) && t.length() > 4) {
            return t.substring(0, t.length() - 3) + "y";
        }
        if (t.endsWith("ing") && t.length() > 5) {
            return undouble(t.substring(0, t.length() - 3));
        }
        if (t.endsWith("ed") && t.length() > 4) {
            return undouble(t.substring(0, t.length() - 2));
        }
        if (t.length() > 4 && (t.endsWith("sses") || t.endsWith("xes") || t.endsWith("ches") || t.endsWith("shes"))) {
            return t.substring(0, t.length() - 2);
        }
        if (t.endsWith("s") && !t.endsWith("ss") && !t.endsWith("us") && !t.endsWith("is")) {
            return t.substring(0, t.length() - 1);
        }
        return t;
    }

    /** True when {@code term} occurs in {@code lowerText} not glued to other letters or digits. */
    public static boolean containsTerm(String lowerText, String term) {
        if (lowerText == null || lowerText.isEmpty() || term == null || term.isBlank()) {
            return false;
        }
        return termPattern(term).matcher(lowerText).find();
    }

    public static int countOccurrences(String lowerText, String term) {
        if (lowerText == null || lowerText.isEmpty() || term == null || term.isBlank()) {
            return 0;
        }
        Matcher matcher = termPattern(term).matcher(lowerText);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    public static int countDistinctTerms(String lowerText, Collection<String> terms) {
        int count = 0;
        for (String term : terms) {
            if (containsTerm(lowerText, term)) {
                count++;
            }
        }
        return count;
    }

    public static List<String> sentences(String text) {
        List<String> out = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return out;
        }
        for (String part : SENTENCE_BREAK.split(text.strip())) {
            String trimmed = part.strip();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

    /**
     * Answers that read as prose: at least three words and not a bare link, address or number.
     */
    public static List<String> freeTextAnswers(Map<String, String> answers) {
        List<String> out = new ArrayList<>();
        if (answers == null) {
            return out;
        }
        for (String value : answers.values()) {
            if (value == null) {
                continue;
            }
            String trimmed = value.strip();
            String lower = lower(trimmed);
            if (wordCount(trimmed) < FREE_TEXT_MIN_WORDS || lower.startsWith("http://") || lower.startsWith("https://")) {
                continue;
            }
            out.add(trimmed);
        }
        return out;
    }

    public static int wordCount(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.strip().split("\\s+").length;
    }

    public static int clampScore(long value) {
        return (int) Math.max(0, Math.min(100, value));
    }

    private static Pattern termPattern(String term) {
        String key = term.toLowerCase(Locale.ROOT).strip();
        return TERM_PATTERNS.computeIfAbsent(
            key,
            k -> Pattern.compile("(?<![a-z0-9])" + Pattern.quote(k) + "(?![a-z0-9])")
        );
    }

    private static boolean isNumeric(String token) {
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (!Character.isDigit(c) && c != '.') {
                return false;
            }
        }
        return true;
    }

    private static String undouble(String base) {
        int n = base.length();
        if (n >= 3 && base.charAt(n - 1) == base.charAt(n - 2) && "lsz".indexOf(base.charAt(n - 1)) < 0
            && !isVowel(base.charAt(n - 1))) {
            return base.substring(0, n - 1);
        }
        return base;
    }

    private static boolean isVowel(char c) {
        return "aeiou".indexOf(c) >= 0;
    }
}
