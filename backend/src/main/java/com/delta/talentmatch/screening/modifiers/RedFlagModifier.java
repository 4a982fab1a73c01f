package com.delta.talentmatch.screening.modifiers;

import com.delta.talentmatch.config.ScreeningProperties;
import com.delta.talentmatch.screening.model.ModifierApplication;
import com.delta.talentmatch.screening.scoring.EmploymentTimeline;
import com.delta.talentmatch.screening.scoring.TextSignals;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * One penalty per distinct red flag: an employment gap (stated, or longer than a year between dated roles),
 * rapid job hopping, or date ranges that cannot be right.
 */
@Component
@Order(2)
public class RedFlagModifier implements ScoreModifier {
    static final String NAME = "red_flag";
    static final int GAP_MONTHS = 12;
    static final int SHORT_STINT_MONTHS = 12;
    static final int JOB_HOPPING_STINTS = 4;

    private final ScreeningProperties properties;

    public RedFlagModifier(ScreeningProperties properties) {
        this.properties = properties;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<ModifierApplication> evaluate(ModifierContext context) {
        List<ModifierApplication> out = new ArrayList<>();
        if (!context.hasResumeText()) {
            return out;
        }
        int penalty = -properties.getModifiers().getRedFlagPenalty();
        String lowerResume = TextSignals.lower(context.resumeText());
        EmploymentTimeline timeline = EmploymentTimeline.parse(context.resumeText(), context.referenceTime());

        String statedGap = firstStatedGap(lowerResume);
        if (statedGap != null) {
            out.add(new ModifierApplication(NAME + ":employment_gap", penalty, "Résumé mentions \"" + statedGap + "\""));
        } else if (timeline.longestGapMonths() > GAP_MONTHS) {
            out.add(new ModifierApplication(
                NAME + ":employment_gap",
                penalty,
                "Employment gap of " + timeline.longestGapMonths() + " months between roles"
            ));
        }
        int shortStints = timeline.shortStintCount(SHORT_STINT_MONTHS);
        if (shortStints >= JOB_HOPPING_STINTS) {
            out.add(new ModifierApplication(
                NAME + ":job_hopping",
                penalty,
                shortStints + " roles lasting under a year"
            ));
        }
        if (timeline.hasInconsistentDates()) {
            out.add(new ModifierApplication(
                NAME + ":inconsistent_dates",
                penalty,
                "Employment dates are inconsistent (end before start or in the future)"
            ));
        }
        return out;
    }

    private String firstStatedGap(String lowerResume) {
        for (String phrase : properties.getModifiers().getRedFlagPhrases()) {
            if (TextSignals.containsTerm(lowerResume, phrase)) {
                return phrase;
            }
        }
        return null;
    }
}
