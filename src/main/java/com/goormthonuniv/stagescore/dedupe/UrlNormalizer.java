package com.goormthonuniv.stagescore.dedupe;

import java.util.Locale;

/** 중복 판정용 URL 키: 스킴/“www.”/프래그먼트/끝 슬래시 제거, 소문자. 쿼리는 선택적으로 제거 */
public final class UrlNormalizer {

    private UrlNormalizer() {}

    public static String normalize(String url, boolean stripQuery) {
        if (url == null || url.isBlank()) return null;
        String u = url.trim().toLowerCase(Locale.ROOT);

        int scheme = u.indexOf("://");
        if (scheme >= 0) u = u.substring(scheme + 3);
        if (u.startsWith("www.")) u = u.substring(4);

        int hash = u.indexOf('#');
        if (hash >= 0) u = u.substring(0, hash);
        if (stripQuery) {
            int q = u.indexOf('?');
            if (q >= 0) u = u.substring(0, q);
        }
        while (u.endsWith("/")) u = u.substring(0, u.length() - 1);
        return u.isEmpty() ? null : u;
    }
}
