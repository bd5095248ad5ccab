package com.goormthonuniv.stagescore.dedupe;

import com.goormthonuniv.stagescore.dto.NormalizedReview;

import java.util.Locale;
import java.util.Objects;

/** 같은 공연 안에서 두 리뷰가 같은 리뷰인지 판정. 규칙은 URL → 매체+평론가 → 매체+평론가 미상 순 */
public class DuplicateMatcher {

    private final boolean stripQuery;

    public DuplicateMatcher(boolean stripQuery) {
        this.stripQuery = stripQuery;
    }

    public MatchType match(NormalizedReview a, NormalizedReview b) {
        if (!Objects.equals(a.showId(), b.showId())) return MatchType.NONE;

        String ua = UrlNormalizer.normalize(a.url(), stripQuery);
        String ub = UrlNormalizer.normalize(b.url(), stripQuery);
        if (ua != null && ua.equals(ub)) return MatchType.URL;

        if (a.outletId() == null || !a.outletId().equals(b.outletId())) return MatchType.NONE;

        String ca = criticKey(a.criticName());
        String cb = criticKey(b.criticName());
        if (ca == null || cb == null) return MatchType.OUTLET_MISSING_CRITIC;
        return ca.equals(cb) ? MatchType.OUTLET_CRITIC : MatchType.NONE;
    }

    static String criticKey(String critic) {
        if (critic == null || critic.isBlank()) return null;
        return critic.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
