package com.delta.talentmatch.screening.scoring;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Employment date ranges found in résumé text, at month precision.
 *
 * <p>Open-ended ranges ("2021 - present") end at the reference month, normally the job's creation date,
 * so the result never depends on the wall clock.
 */
public final class EmploymentTimeline {
    private static final String MONTH = "(?<![a-z])(jan|feb|mar|apr|may|jun|jul|aug|sep|oct|nov|dec)[a-z]*\\.?";
    private static final Pattern RANGE = Pattern.compile(
        "(?:" + MONTH + "\\s+)?((?:19|20)\\d{2})\\s*(?:-|–|—|to|until|through)\\s*(?:" + MONTH + "\\s+)?"
            + "((?:19|20)\\d{2}|present|current|now|today)"
    );
    private static final Pattern YEAR = Pattern.compile("(?:19|20)\\d{2}");
    private static final Pattern LETTER = Pattern.compile("[a-z]");
    private static final List<String> OTHER_SECTION_HEADINGS = List.of(
        "experience", "employment", "work history", "career history", "projects", "skills", "certifications",
        "awards", "publications", "volunteering", "summary", "profile", "languages", "interests", "references"
    );
    private static final List<String> MONTHS = List.of(
        "jan", "feb", "mar", "apr", "may", "jun", "jul", "aug", "sep", "oct", "nov", "dec"
    );

    private final List<Stint> stints;
    private final boolean inconsistentDates;

    private EmploymentTimeline(List<Stint> stints, boolean inconsistentDates) {
        this.stints = List.copyOf(stints);
        this.inconsistentDates = inconsistentDates;
    }

    public static EmploymentTimeline parse(String text, Instant reference) {
        if (text == null || text.isBlank()) {
            return new EmploymentTimeline(List.of(), false);
        }
        List<int[]> raw = new ArrayList<>();
        List<Boolean> openEnded = new ArrayList<>();
        int latestExplicit = Integer.MIN_VALUE;
        String lower = TextSignals.lower(text);
        List<int[]> educationSections = educationSections(lower);
        Matcher matcher = RANGE.matcher(lower);
        int previousEnd = 0;
        while (matcher.find()) {
            boolean education = inSpan(educationSections, matcher.start())
                || describesQualification(lower, matcher, previousEnd);
            previousEnd = matcher.end();
            if (education) {
                continue;
            }
            int start = monthIndex(Integer.parseInt(matcher.group(2)), matcher.group(1));
            String endToken = matcher.group(4);
            boolean open = !Character.isDigit(endToken.charAt(0));
            int end = open ? Integer.MIN_VALUE : monthIndex(Integer.parseInt(endToken), matcher.group(3));
            raw.add(new int[] {start, end});
            openEnded.add(open);
            latestExplicit = Math.max(latestExplicit, Math.max(start, end));
        }
        if (raw.isEmpty()) {
            return new EmploymentTimeline(List.of(), false);
        }

        int referenceMonth;
        if (reference != null) {
            ZonedDateTime at = reference.atZone(ZoneOffset.UTC);
            referenceMonth = at.getYear() * 12 + at.getMonthValue() - 1;
        } else {
            referenceMonth = latestExplicit;
        }

        boolean inconsistent = false;
        List<Stint> stints = new ArrayList<>();
        for (int i = 0; i < raw.size(); i++) {
            int start = raw.get(i)[0];
            int end = openEnded.get(i) ? Math.max(start, referenceMonth) : raw.get(i)[1];
            if (end < start || start > referenceMonth || end > referenceMonth) {
                inconsistent = true;
                continue;
            }
            stints.add(new Stint(start, end));
        }
        return new EmploymentTimeline(stints, inconsistent);
    }

    public boolean isEmpty() {
        return stints.isEmpty();
    }

    public List<Stint> stints() {
        return stints;
    }

    public boolean hasInconsistentDates() {
        return inconsistentDates;
    }

    /** Years covered by the union of all stints, so overlapping jobs are not double counted. */
    public double totalYears() {
        int months = 0;
        for (Stint stint : merged()) {
            months += stint.months();
        }
        return months / 12.0;
    }

    public int longestGapMonths() {
        List<Stint> merged = merged();
        int longest = 0;
        for (int i = 1; i < merged.size(); i++) {
            longest = Math.max(longest, merged.get(i).startMonth() - merged.get(i - 1).endMonth());
        }
        return longest;
    }

    public int shortStintCount(int maxMonths) {
        int count = 0;
        for (Stint stint : stints) {
            if (stint.months() < maxMonths) {
                count++;
            }
        }
        return count;
    }

    private List<Stint> merged() {
        List<Stint> sorted = new ArrayList<>(stints);
        sorted.sort(Comparator.comparingInt(Stint::startMonth).thenComparingInt(Stint::endMonth));
        List<Stint> out = new ArrayList<>();
        for (Stint stint : sorted) {
            if (!out.isEmpty() && stint.startMonth() <= out.get(out.size() - 1).endMonth()) {
                Stint last = out.remove(out.size() - 1);
                out.add(new Stint(last.startMonth(), Math.max(last.endMonth(), stint.endMonth())));
            } else {
                out.add(stint);
            }
        }
        return out;
    }

    /**
     * Offsets of the text that sits under an education heading, up to the next recognized section heading.
     */
    private static List<int[]> educationSections(String lower) {
        List<int[]> spans = new ArrayList<>();
        int offset = 0;
        int openStart = -1;
        for (String line : lower.split("\n", -1)) {
            Boolean education = headingKind(line);
            if (education != null) {
                if (openStart >= 0) {
                    spans.add(new int[] {openStart, offset});
                    openStart = -1;
                }
                if (education) {
                    openStart = offset + line.length();
                }
            }
            offset += line.length() + 1;
        }
        if (openStart >= 0) {
            spans.add(new int[] {openStart, lower.length()});
        }
        return spans;
    }

    /** TRUE for an education heading, FALSE for another section heading, null for ordinary lines. */
    private static Boolean headingKind(String line) {
        String heading = line.strip();
        while (heading.endsWith(":")) {
            heading = heading.substring(0, heading.length() - 1).strip();
        }
        if (heading.isEmpty() || heading.split("\\s+").length > 4 || heading.chars().anyMatch(Character::isDigit)) {
            return null;
        }
        if (heading.contains("education") || heading.contains("academic") || heading.contains("qualifications")) {
            return Boolean.TRUE;
        }
        for (String other : OTHER_SECTION_HEADINGS) {
            if (heading.contains(other)) {
                return Boolean.FALSE;
            }
        }
        return null;
    }

    /**
     * Whether the words tied to a date range name a degree. The words are the ones before the range on its
     * line, or the ones after it when the line starts with the range.
     */
    private static boolean describesQualification(String lower, Matcher range, int previousEnd) {
        int lineStart = lower.lastIndexOf('\n', range.start() - 1) + 1;
        String context = lower.substring(Math.max(lineStart, previousEnd), range.start());
        if (!LETTER.matcher(context).find()) {
            int lineEnd = lower.indexOf('\n', range.end());
            String after = lower.substring(range.end(), lineEnd < 0 ? lower.length() : lineEnd);
            Matcher nextYear = YEAR.matcher(after);
            context = nextYear.find() ? after.substring(0, nextYear.start()) : after;
        }
        return TextSignals.countDistinctTerms(context, EducationScorer.DEGREE_TERMS) > 0;
    }

    private static boolean inSpan(List<int[]> spans, int offset) {
        for (int[] span : spans) {
            if (offset >= span[0] && offset < span[1]) {
                return true;
            }
        }
        return false;
    }

    private static int monthIndex(int year, String monthToken) {
        int month = 0;
        if (monthToken != null) {
            int idx = MONTHS.indexOf(monthToken.substring(0, Math.min(3, monthToken.length())));
            month = Math.max(0, idx);
        }
        return year * 12 + month;
    }

    public record Stint(int startMonth, int endMonth) {
        public int months() {
            return endMonth - startMonth;
        }
    }
}
