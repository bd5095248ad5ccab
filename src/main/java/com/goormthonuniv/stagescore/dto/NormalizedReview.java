package com.goormthonuniv.stagescore.dto;

import lombok.Builder;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 정규화가 끝난 리뷰 1건. 불변이며, 병합/재처리는 항상 새 레코드를 만든다.
 * bucket/thumb 는 점수에서 파생되지만 저장값을 강제로 고치지 않는다(불일치는 Validator 가 플래그).
 */
@Builder(toBuilder = true)
public record NormalizedReview(
        String showId,
        String outletId,
        String outlet,
        String criticName,
        String url,
        LocalDate publishDate,
        int assignedScore,
        String originalRating,
        Bucket bucket,
        Thumb thumb,
        String designation,
        String pullQuote,
        ScoreSource scoreSource,
        Set<ReviewFlag> flags
) {
    public NormalizedReview {
        if (assignedScore < 0 || assignedScore > 100) {
            throw new IllegalArgumentException("assignedScore out of range: " + assignedScore);
        }
        // 빈 문자열은 "없음" 으로 통일 (병합 비교가 흔들리지 않도록)
        outletId = blankToNull(outletId);
        outlet = blankToNull(outlet);
        criticName = blankToNull(criticName);
        url = blankToNull(url);
        originalRating = blankToNull(originalRating);
        designation = blankToNull(designation);
        pullQuote = blankToNull(pullQuote);
        flags = immutableFlags(flags);
    }

    public boolean hasFlag(ReviewFlag flag) {
        return flags.contains(flag);
    }

    public NormalizedReview withFlags(Collection<ReviewFlag> newFlags) {
        return toBuilder().flags(immutableFlags(newFlags)).build();
    }

    public NormalizedReview plusFlag(ReviewFlag flag) {
        EnumSet<ReviewFlag> next = flags.isEmpty() ? EnumSet.noneOf(ReviewFlag.class) : EnumSet.copyOf(flags);
        next.add(flag);
        return withFlags(next);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }

    private static Set<ReviewFlag> immutableFlags(Collection<ReviewFlag> src) {
        if (src == null || src.isEmpty()) return Set.of();
        return Collections.unmodifiableSet(EnumSet.copyOf(src));
    }
}
