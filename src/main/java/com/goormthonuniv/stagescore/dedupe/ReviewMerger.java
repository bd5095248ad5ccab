package com.goormthonuniv.stagescore.dedupe;

import com.goormthonuniv.stagescore.dto.NormalizedReview;
import com.goormthonuniv.stagescore.dto.ReviewFlag;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 중복 리뷰 두 건 → 한 건.
 * 승자는 PRECEDENCE 로 정한다: URL 보유 > 평론가 보유 > 인용구 보유 > 이른 게재일 > 매체 id 사전순,
 * 이후 나머지 필드 전체로 결정적 타이브레이크 (값 있음 우선).
 * 필수 필드(점수/버킷/엄지/출처)는 승자 것을 통째로, 선택 필드는 승자 것에 빈칸만 패자 것으로 채운다. 플래그는 합집합.
 * 결과적으로 merge(a, b) == merge(b, a), merge(merge(a, b), b) == merge(a, b).
 */
public final class ReviewMerger {

    private ReviewMerger() {}

    public static final Comparator<NormalizedReview> PRECEDENCE =
            Comparator.<NormalizedReview>comparingInt(r -> absent(r.url()))
                    .thenComparingInt(r -> absent(r.criticName()))
                    .thenComparingInt(r -> absent(r.pullQuote()))
                    .thenComparing(NormalizedReview::publishDate, Comparator.nullsLast(Comparator.naturalOrder()))
                    .thenComparing(nullsLast(NormalizedReview::outletId))
                    // ---- 이하 결정성 확보용 ----
                    .thenComparing(nullsLast(NormalizedReview::showId))
                    .thenComparing(nullsLast(NormalizedReview::scoreSource))
                    .thenComparing(NormalizedReview::assignedScore, Comparator.reverseOrder())
                    .thenComparing(nullsLast(NormalizedReview::url))
                    .thenComparing(nullsLast(NormalizedReview::criticName))
                    .thenComparing(nullsLast(NormalizedReview::outlet))
                    .thenComparing(nullsLast(NormalizedReview::pullQuote))
                    .thenComparing(nullsLast(NormalizedReview::originalRating))
                    .thenComparing(nullsLast(NormalizedReview::designation))
                    .thenComparing(nullsLast(NormalizedReview::bucket))
                    .thenComparing(nullsLast(NormalizedReview::thumb))
                    .thenComparing(r -> flagKey(r.flags()));

    public static NormalizedReview merge(NormalizedReview a, NormalizedReview b) {
        boolean aWins = PRECEDENCE.compare(a, b) <= 0;
        NormalizedReview winner = aWins ? a : b;
        NormalizedReview loser = aWins ? b : a;

        EnumSet<ReviewFlag> flags = EnumSet.noneOf(ReviewFlag.class);
        flags.addAll(winner.flags());
        flags.addAll(loser.flags());

        return winner.toBuilder()
                .outletId(fill(winner.outletId(), loser.outletId()))
                .outlet(fill(winner.outlet(), loser.outlet()))
                .criticName(fill(winner.criticName(), loser.criticName()))
                .url(fill(winner.url(), loser.url()))
                .publishDate(winner.publishDate() != null ? winner.publishDate() : loser.publishDate())
                .originalRating(fill(winner.originalRating(), loser.originalRating()))
                .designation(fill(winner.designation(), loser.designation()))
                .pullQuote(fill(winner.pullQuote(), loser.pullQuote()))
                .flags(flags)
                .build();
    }

    /** a 와 b 를 병합하면 a 가 승자인지 */
    public static boolean isWinner(NormalizedReview a, NormalizedReview b) {
        return PRECEDENCE.compare(a, b) <= 0;
    }

    // ------------------------ 내부 유틸 ------------------------

    private static int absent(String s) {
        return s == null || s.isBlank() ? 1 : 0;
    }

    private static String fill(String preferred, String fallback) {
        return preferred != null && !preferred.isBlank() ? preferred : fallback;
    }

    private static <T extends Comparable<? super T>> Comparator<NormalizedReview> nullsLast(Function<NormalizedReview, T> key) {
        return Comparator.comparing(key, Comparator.nullsLast(Comparator.naturalOrder()));
    }

    private static String flagKey(Set<ReviewFlag> flags) {
        return flags.stream().map(Enum::name).sorted().collect(Collectors.joining(","));
    }
}
