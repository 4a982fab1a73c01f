package com.delta.talentmatch.screening.ai;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AiResponseParserTest {
    private final AiResponseParser parser = new AiResponseParser(new ObjectMapper());

    @Test
    void readsFencedJsonWithLooseTypes() {
        String content = """
            Here is my evaluation:
            ```json
            {"summary": " Strong backend profile. ", "pros": "Python depth", "cons": ["No Kubernetes", ""], "score_adjustment": "+7 points"}
            ```
            """;

        AiAnalysisResponse response = parser.parse(content);

        assertThat(response.summary()).isEqualTo("Strong backend profile.");
        assertThat(response.pros()).containsExactly("Python depth");
        assertThat(response.cons()).containsExactly("No Kubernetes");
        assertThat(response.scoreAdjustment()).isEqualTo(7);
    }

    @Test
    void acceptsCamelCaseAdjustmentAndRoundsFractions() {
        AiAnalysisResponse response = parser.parse("{\"summary\":\"ok\",\"scoreAdjustment\":-4.6}");
        assertThat(response.scoreAdjustment()).isEqualTo(-5);
        assertThat(response.pros()).isEmpty();
    }

    @Test
    void unreadableAdjustmentIsNull() {
        AiAnalysisResponse response = parser.parse("{\"summary\":\"ok\",\"score_adjustment\":\"a lot\"}");
        assertThat(response.scoreAdjustment()).isNull();
    }

    @Test
    void rejectsContentWithoutAnObject() {
        assertThatThrownBy(() -> parser.parse("I cannot evaluate this candidate."))
            .isInstanceOf(AiServiceException.class);
        assertThatThrownBy(() -> parser.parse("  "))
            .isInstanceOf(AiServiceException.class);
        assertThatThrownBy(() -> parser.parse("{not json}"))
            .isInstanceOf(AiServiceException.class);
    }
}
