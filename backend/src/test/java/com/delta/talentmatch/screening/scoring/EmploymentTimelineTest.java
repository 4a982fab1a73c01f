package com.delta.talentmatch.screening.scoring;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class EmploymentTimelineTest {
    private static final Instant REFERENCE = Instant.parse("2020-03-10T00:00:00Z");

    @Test
    void measuresStintsAndGaps() {
        EmploymentTimeline timeline = EmploymentTimeline.parse(
            "Acme, Jan 2015 - Dec 2016\nBeta, March 2018 - present",
            REFERENCE
        );

        assertThat(timeline.stints()).hasSize(2);
        assertThat(timeline.longestGapMonths()).isEqualTo(15);
        assertThat(timeline.totalYears()).isCloseTo(47 / 12.0, within(1e-9));
        assertThat(timeline.hasInconsistentDates()).isFalse();
    }

    @Test
    void overlappingRolesAreNotDoubleCounted() {
        EmploymentTimeline timeline = EmploymentTimeline.parse("2010 - 2014; consulting 2012 - 2014", REFERENCE);
        assertThat(timeline.totalYears()).isEqualTo(4.0);
        assertThat(timeline.longestGapMonths()).isZero();
    }

    @Test
    void flagsEndBeforeStartAndFutureDates() {
        assertThat(EmploymentTimeline.parse("2019 - 2017", REFERENCE).hasInconsistentDates()).isTrue();
        assertThat(EmploymentTimeline.parse("2018 - 2023", REFERENCE).hasInconsistentDates()).isTrue();
        assertThat(EmploymentTimeline.parse("2015 - 2019", REFERENCE).hasInconsistentDates()).isFalse();
    }

    @Test
    void countsShortStints() {
        EmploymentTimeline timeline = EmploymentTimeline.parse(
            "Jan 2019 - Jun 2019, Jul 2019 - Dec 2019, Jan 2020 - Mar 2020, 2012 - 2018",
            REFERENCE
        );
        assertThat(timeline.shortStintCount(12)).isEqualTo(3);
    }

    @Test
    void degreeRangesAreNotCountedAsEmployment() {
        EmploymentTimeline timeline = EmploymentTimeline.parse(
            "B.Sc. Computer Science, State University, 2008 - 2012\nSoftware Engineer, Acme, 2016 - present",
            REFERENCE
        );

        assertThat(timeline.stints()).containsExactly(new EmploymentTimeline.Stint(2016 * 12, 2020 * 12 + 2));
        assertThat(timeline.longestGapMonths()).isZero();
    }

    @Test
    void degreeNamedAfterALeadingRangeIsSkipped() {
        EmploymentTimeline timeline = EmploymentTimeline.parse(
            "2008 - 2012 Bachelor of Science, MIT\n2013 - 2015 Analyst, Acme",
            REFERENCE
        );

        assertThat(timeline.stints()).containsExactly(new EmploymentTimeline.Stint(2013 * 12, 2015 * 12));
    }

    @Test
    void rangesUnderAnEducationHeadingAreSkipped() {
        EmploymentTimeline timeline = EmploymentTimeline.parse("""
            Experience
            Acme, 2014 - 2016
            Education:
            State University
            2008 - 2012
            Skills
            Consulting 2017 - 2019
            """, REFERENCE);

        assertThat(timeline.stints()).hasSize(2);
        assertThat(timeline.totalYears()).isEqualTo(4.0);
        assertThat(timeline.longestGapMonths()).isEqualTo(12);
    }

    @Test
    void monthNamesInsideWordsAreIgnored() {
        EmploymentTimeline timeline = EmploymentTimeline.parse(
            "Summary 2019 - 2021",
            Instant.parse("2022-01-01T00:00:00Z")
        );

        assertThat(timeline.stints()).containsExactly(new EmploymentTimeline.Stint(2019 * 12, 2021 * 12));
    }

    @Test
    void emptyTextHasNoStints() {
        assertThat(EmploymentTimeline.parse(null, REFERENCE).isEmpty()).isTrue();
        assertThat(EmploymentTimeline.parse("no dates here", null).isEmpty()).isTrue();
    }
}
