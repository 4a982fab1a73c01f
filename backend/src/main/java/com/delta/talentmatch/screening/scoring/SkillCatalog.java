package com.delta.talentmatch.screening.scoring;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Known skills with their spelling variants. Used to derive a job's required skills and to find
 * the same skills in résumé text regardless of which variant either side uses.
 */
@Component
public class SkillCatalog {
    private final Map<String, List<String>> aliasesBySkill = new LinkedHashMap<>();
    private final Map<String, String> skillByAlias = new LinkedHashMap<>();

    public SkillCatalog() {
        register("python", "py");
        register("java");
        register("javascript", "js", "ecmascript");
        register("typescript", "ts");
        register("c++", "cpp");
        register("c#", "csharp", "c sharp");
        register("golang", "go lang");
        register("ruby");
        register("php");
        register("swift");
        register("kotlin");
        register("scala");
        register("rust");
        register("react", "reactjs", "react.js");
        register("angular", "angularjs");
        register("vue", "vuejs", "vue.js");
        register("node.js", "node", "nodejs");
        register("django");
        register("flask");
        register("fastapi");
        register("spring", "spring boot", "springboot");
        register("sql");
        register("nosql");
        register("postgresql", "postgres", "psql");
        register("mysql");
        register("mongodb", "mongo");
        register("redis");
        register("elasticsearch", "elastic search");
        register("kafka", "apache kafka");
        register("aws", "amazon web services");
        register("azure");
        register("gcp", "google cloud");
        register("docker");
        register("kubernetes", "k8s");
        register("terraform");
        register("jenkins");
        register("git");
        register("linux");
        register("machine learning", "ml");
        register("deep learning");
        register("data science");
        register("tensorflow");
        register("pytorch");
        register("pandas");
        register("html", "html5");
        register("css", "css3");
        register("rest api", "restful", "rest apis");
        register("graphql");
        register("microservices", "microservice");
        register("ci/cd", "cicd", "continuous integration");
        register("agile");
        register("scrum");
        register("devops");
        register("security", "cybersecurity");
        register("networking");
        register("project management");
    }

    private void register(String skill, String... aliases) {
        List<String> variants = new ArrayList<>();
        variants.add(skill);
        for (String alias : aliases) {
            variants.add(alias);
        }
        aliasesBySkill.put(skill, List.copyOf(variants));
        for (String variant : variants) {
            skillByAlias.put(variant, skill);
        }
    }

    /**
     * Maps any known variant to its canonical skill name; unknown skills come back trimmed and lower-cased.
     */
    public String canonicalize(String skill) {
        if (skill == null) {
            return "";
        }
        String key = skill.trim().toLowerCase(Locale.ROOT);
        return skillByAlias.getOrDefault(key, key);
    }

    public List<String> variantsOf(String skill) {
        String canonical = canonicalize(skill);
        return aliasesBySkill.getOrDefault(canonical, List.of(canonical));
    }

    /** Canonical skills present in {@code text}, in catalog order. */
    public Set<String> extractSkills(String text) {
        Set<String> found = new LinkedHashSet<>();
        if (text == null || text.isBlank()) {
            return found;
        }
        String lower = TextSignals.lower(text);
        for (Map.Entry<String, List<String>> entry : aliasesBySkill.entrySet()) {
            for (String variant : entry.getValue()) {
                if (TextSignals.containsTerm(lower, variant)) {
                    found.add(entry.getKey());
                    break;
                }
            }
        }
        return found;
    }

    public boolean mentions(String lowerText, String skill) {
        return TextSignals.countDistinctTerms(lowerText, variantsOf(skill)) > 0;
    }

    public List<String> canonicalizeAll(Collection<String> skills) {
        Set<String> out = new LinkedHashSet<>();
        if (skills != null) {
            for (String skill : skills) {
                String canonical = canonicalize(skill);
                if (!canonical.isBlank()) {
                    out.add(canonical);
                }
            }
        }
        return new ArrayList<>(out);
    }
}
