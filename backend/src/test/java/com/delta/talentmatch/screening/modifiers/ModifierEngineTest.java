package com.delta.talentmatch.screening.modifiers;

import com.delta.talentmatch.config.ScreeningProperties;
import com.delta.talentmatch.screening.ScreeningFixtures;
import com.delta.talentmatch.screening.model.ModifierApplication;
import com.delta.talentmatch.screening.scoring.ScoringInvariantViolationException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModifierEngineTest {
    private static final Instant REFERENCE = Instant.parse("2024-06-01T00:00:00Z");

    private final ScreeningProperties properties = new ScreeningProperties();
    private final ModifierEngine engine = ScreeningFixtures.modifierEngine(properties);

    @Test
    void missingProfileLinkIsPenalized() {
        List<ModifierApplication> applied = engine.apply(context("Backend developer.", Map.of(), scores(50, 50, 50)));
        assertThat(applied).containsExactly(new ModifierApplication(
            "missing_profile_link",
            -3,
            "No professional profile link (LinkedIn, GitHub or portfolio) provided"
        ));
    }

    @Test
    void profileLinkInAnswersCounts() {
        List<ModifierApplication> applied = engine.apply(context(
            "Backend developer.",
            Map.of("LinkedIn", "https://www.linkedin.com/in/ada"),
            scores(50, 50, 50)
        ));
        assertThat(applied).isEmpty();
    }

    @Test
    void statedGapAndJobHoppingAreSeparateRedFlags() {
        String resume = """
            https://github.com/ada
            Career break to care for family.
            Jan 2019 - Jun 2019, Jul 2019 - Dec 2019, Jan 2020 - Jun 2020, Jul 2020 - Dec 2020
            """;
        List<ModifierApplication> applied = engine.apply(context(resume, Map.of(), scores(50, 50, 50)));
        assertThat(applied).extracting(ModifierApplication::name)
            .containsExactly("red_flag:employment_gap", "red_flag:job_hopping");
        assertThat(applied).allSatisfy(modifier -> assertThat(modifier.delta()).isEqualTo(-5));
    }

    @Test
    void longGapBetweenDatedRolesIsARedFlag() {
        String resume = "https://github.com/ada\nAcme 2012 - 2016\nBeta 2019 - present";
        List<ModifierApplication> applied = engine.apply(context(resume, Map.of(), scores(50, 50, 50)));
        assertThat(applied).extracting(ModifierApplication::name).containsExactly("red_flag:employment_gap");
        assertThat(applied.get(0).reason()).contains("36 months");
    }

    @Test
    void timeInEducationIsNotAnEmploymentGap() {
        String resume = """
            https://github.com/ada
            B.Sc. Computer Science, State University, 2008 - 2012
            Software Engineer, Acme, 2016 - present
            """;
        List<ModifierApplication> applied = engine.apply(context(resume, Map.of(), scores(50, 50, 50)));
        assertThat(applied).isEmpty();
    }

    @Test
    void futureDatesAreInconsistent() {
        String resume = "https://github.com/ada\nAcme 2020 - 2027";
        List<ModifierApplication> applied = engine.apply(context(resume, Map.of(), scores(50, 50, 50)));
        assertThat(applied).extracting(ModifierApplication::name).containsExactly("red_flag:inconsistent_dates");
    }

    @Test
    void templatePhrasesMarkAnswersAsAiAuthored() {
        Map<String, String> answers = Map.of(
            "Why us",
            "I am thrilled to apply and delve into your rich tapestry of products."
        );
        List<ModifierApplication> applied = engine.apply(context("https://github.com/ada", answers, scores(50, 50, 50)));
        assertThat(applied).extracting(ModifierApplication::name).containsExactly("ai_authored_answers");
        assertThat(applied.get(0).delta()).isEqualTo(-10);
    }

    @Test
    void uniformLongAnswersMarkAnswersAsAiAuthored() {
        String answer = "word ".repeat(50).strip();
        Map<String, String> answers = new LinkedHashMap<>();
        answers.put("Q1", answer);
        answers.put("Q2", answer + " extra");
        answers.put("Q3", answer);
        List<ModifierApplication> applied = engine.apply(context("https://github.com/ada", answers, scores(50, 50, 50)));
        assertThat(applied).extracting(ModifierApplication::name).containsExactly("ai_authored_answers");
    }

    @Test
    void unicornNeedsBothThresholdsInclusive() {
        assertThat(engine.apply(context("https://github.com/ada", Map.of(), scores(50, 85, 85))))
            .extracting(ModifierApplication::name).containsExactly("unicorn");
        assertThat(engine.apply(context("https://github.com/ada", Map.of(), scores(50, 85, 84))))
            .isEmpty();
    }

    @Test
    void leadershipAndLowRelevanceApplyInOrder() {
        List<ModifierApplication> applied = engine.apply(context(
            "https://github.com/ada\nTech lead for a payments squad.",
            Map.of(),
            scores(10, 50, 50)
        ));
        assertThat(applied).extracting(ModifierApplication::name).containsExactly("leadership", "low_relevance");
        assertThat(applied.get(1).reason()).isEqualTo("Experience context does not match the role");
    }

    @Test
    void lowRelevanceSkipsUnreadableResumes() {
        List<ModifierApplication> applied = engine.apply(context(null, Map.of(), scores(5, 5, 5)));
        assertThat(applied).extracting(ModifierApplication::name).containsExactly("missing_profile_link");
    }

    @Test
    void eachMissingRequiredSkillCostsEightPoints() {
        List<ModifierApplication> applied = engine.apply(context(
            "https://github.com/ada\nPython services on PostgreSQL.",
            List.of("python", "postgres", "docker", "terraform")
        ));
        assertThat(applied).containsExactly(new ModifierApplication(
            "missing_required_skills",
            -16,
            "Missing required skills: docker, terraform"
        ));
    }

    @Test
    void missingRequiredSkillPenaltyIsCapped() {
        List<ModifierApplication> applied = engine.apply(context(
            "https://github.com/ada\nFront desk coordinator.",
            List.of("python", "java", "docker", "kubernetes", "terraform")
        ));
        assertThat(applied).extracting(ModifierApplication::name).containsExactly("missing_required_skills");
        assertThat(applied.get(0).delta()).isEqualTo(-30);
    }

    @Test
    void requiredSkillsMentionedByVariantAreNotMissing() {
        assertThat(engine.apply(context("https://github.com/ada\nRuns k8s clusters and Postgres.", List.of("kubernetes", "postgresql"))))
            .isEmpty();
        assertThat(engine.apply(context(null, Map.of(), scores(50, 50, 50), List.of("python"))))
            .extracting(ModifierApplication::name).containsExactly("missing_profile_link");
    }

    @Test
    void missingRequiredSkillSettingsAreConfigurable() {
        properties.getModifiers().setMissingRequiredSkillPenalty(20);
        properties.getModifiers().setMissingRequiredSkillCap(25);
        List<ModifierApplication> applied = engine.apply(context("https://github.com/ada", List.of("java", "go")));
        assertThat(applied).extracting(ModifierApplication::delta).containsExactly(-25);
    }

    @Test
    void throwingModifierIsAnInvariantViolation() {
        ModifierEngine broken = new ModifierEngine(List.of(new ScoreModifier() {
            @Override
            public String name() {
                return "broken";
            }

            @Override
            public List<ModifierApplication> evaluate(ModifierContext context) {
                throw new IllegalStateException("boom");
            }
        }));
        assertThatThrownBy(() -> broken.apply(context("text", Map.of(), scores(50, 50, 50))))
            .isInstanceOf(ScoringInvariantViolationException.class)
            .hasMessageContaining("broken");
    }

    private ModifierContext context(String resume, Map<String, String> answers, Map<String, Integer> scores) {
        return context(resume, answers, scores, List.of());
    }

    private ModifierContext context(String resume, List<String> requiredSkills) {
        return context(resume, Map.of(), scores(50, 50, 50), requiredSkills);
    }

    private ModifierContext context(
        String resume,
        Map<String, String> answers,
        Map<String, Integer> scores,
        List<String> requiredSkills
    ) {
        return new ModifierContext(resume, answers, scores, REFERENCE, requiredSkills);
    }

    private Map<String, Integer> scores(int relevance, int skills, int experience) {
        Map<String, Integer> scores = new LinkedHashMap<>();
        scores.put("job_relevance", relevance);
        scores.put("skills_match", skills);
        scores.put("experience", experience);
        return scores;
    }
}
