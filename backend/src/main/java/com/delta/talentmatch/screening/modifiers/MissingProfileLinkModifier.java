package com.delta.talentmatch.screening.modifiers;

import com.delta.talentmatch.config.ScreeningProperties;
import com.delta.talentmatch.screening.model.ModifierApplication;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

@Component
@Order(1)
public class MissingProfileLinkModifier implements ScoreModifier {
    static final String NAME = "missing_profile_link";

    private final ScreeningProperties properties;

    public MissingProfileLinkModifier(ScreeningProperties properties) {
        this.properties = properties;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<ModifierApplication> evaluate(ModifierContext context) {
        String combined = context.lowerCombinedText();
        for (String host : properties.getModifiers().getProfileLinkHosts()) {
            if (host != null && !host.isBlank() && combined.contains(host.toLowerCase(Locale.ROOT))) {
                return List.of();
            }
        }
        return List.of(new ModifierApplication(
            NAME,
            -properties.getModifiers().getMissingProfileLinkPenalty(),
            "No professional profile link (LinkedIn, GitHub or portfolio) provided"
        ));
    }
}
