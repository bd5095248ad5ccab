package com.goormthonuniv.stagescore.util;

import java.util.Locale;
import java.util.regex.Pattern;

public final class TextUtils {
    private static final Pattern QUOTES = Pattern.compile("[‘’`´]"); // 굽은 따옴표 → '
    private static final int MAX_LEN = 4000; // 감성 분석 대상 본문 4k chars 트렁케이트

    private TextUtils() {}

    /** 소문자화 + 공백 정리 + 따옴표 통일. 비교용 키 생성에 사용 */
    public static String normalize(String text) {
        if (text == null) return "";
        String t = QUOTES.matcher(text.strip()).replaceAll("'");
        t = t.replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        if (t.length() > MAX_LEN) {
            t = t.substring(0, MAX_LEN);
        }
        return t;
    }

    /** 단어 경계 기준 포함 여부. phrase 는 공백 포함 가능 ("thumbs up") */
    public static boolean containsWord(String text, String phrase) {
        if (text == null || phrase == null || phrase.isBlank()) return false;
        Pattern p = Pattern.compile("(?<![a-z0-9])" + Pattern.quote(phrase.toLowerCase(Locale.ROOT)) + "(?![a-z0-9])");
        return p.matcher(normalize(text)).find();
    }

    public static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.strip();
        return t.isEmpty() ? null : t;
    }
}
