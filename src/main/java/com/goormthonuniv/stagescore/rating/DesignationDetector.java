package com.goormthonuniv.stagescore.rating;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/** "Critic's Pick" 류 표식 감지. 먼저 선언된 패턴 우선 */
@Component
public class DesignationDetector {

    public static final String CRITICS_PICK = "Critics_Pick";
    public static final String CRITICS_CHOICE = "Critics_Choice";
    public static final String RECOMMENDED = "Recommended";

    private static final Map<Pattern, String> PATTERNS = new LinkedHashMap<>();
    static {
        PATTERNS.put(Pattern.compile("critic'?s?'?\\s*pick", Pattern.CASE_INSENSITIVE), CRITICS_PICK);
        PATTERNS.put(Pattern.compile("critic'?s?'?\\s*choice", Pattern.CASE_INSENSITIVE), CRITICS_CHOICE);
        PATTERNS.put(Pattern.compile("recommended", Pattern.CASE_INSENSITIVE), RECOMMENDED);
        PATTERNS.put(Pattern.compile("editor'?s?'?\\s*pick", Pattern.CASE_INSENSITIVE), RECOMMENDED);
        PATTERNS.put(Pattern.compile("must[\\s-]*see", Pattern.CASE_INSENSITIVE), RECOMMENDED);
    }

    public Optional<String> detect(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        String t = text.replace('’', '\'');
        for (Map.Entry<Pattern, String> e : PATTERNS.entrySet()) {
            if (e.getKey().matcher(t).find()) return Optional.of(e.getValue());
        }
        return Optional.empty();
    }

    /** 명시 designation 필드를 우선, 없으면 본문에서 감지 */
    public Optional<String> detect(String designation, String excerpt) {
        Optional<String> d = detect(designation);
        if (d.isPresent()) return d;
        if (designation != null && !designation.isBlank()) return Optional.of(designation.trim());
        return detect(excerpt);
    }
}
