package com.goormthonuniv.stagescore.verify;

import com.goormthonuniv.stagescore.dedupe.DuplicateConflict;
import com.goormthonuniv.stagescore.dto.*;
import com.goormthonuniv.stagescore.rating.SentimentInferencer;
import com.goormthonuniv.stagescore.rating.SentimentSignal;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.text.similarity.LevenshteinDistance;

import java.time.Clock;
import java.time.LocalDate;
import java.util.*;

/**
 * 병합 후, 저장 전 사후 감사. 어떤 결과도 저장/집계를 막지 않는다.
 * - 저장된 bucket/thumb 가 점수에서 파생한 값과 다른지
 * - 본문 키워드 극성이 점수와 정면으로 어긋나는지 (추론 점수 제외)
 * - 한 공연의 리뷰(5건 이상)가 전부 같은 버킷인지
 * - 게재일이 개막일 기준 창(-30일 ~ +365일) 밖인지
 * - 같은 매체 안의 비슷한 평론가 이름 (편집 거리 ≤ 2)
 * - URL 도 원문 평점도 없는 리뷰
 * 이전 배치의 감사 플래그는 버리고 매번 새로 계산한다.
 */
@Slf4j
public class ReviewValidator {

    static final int UNIFORM_MIN_REVIEWS = 5;
    static final int WINDOW_DAYS_BEFORE = 30;
    static final int WINDOW_DAYS_AFTER = 365;
    static final int NEAR_DUPLICATE_DISTANCE = 2;
    static final double MIN_CONTRADICTION_WEIGHT = 2.0;

    private final SentimentInferencer sentiment;
    private final Clock clock;
    private final LevenshteinDistance distance = new LevenshteinDistance(NEAR_DUPLICATE_DISTANCE);

    public ReviewValidator(SentimentInferencer sentiment, Clock clock) {
        this.sentiment = sentiment;
        this.clock = clock;
    }

    public ValidationResult validate(ShowContext show, List<NormalizedReview> reviews, List<DuplicateConflict> conflicts) {
        List<AuditEntry> entries = new ArrayList<>();
        Set<Integer> nearDuplicates = nearDuplicateCritics(reviews);

        List<NormalizedReview> out = new ArrayList<>(reviews.size());
        for (int i = 0; i < reviews.size(); i++) {
            NormalizedReview r = reviews.get(i);
            EnumSet<ReviewFlag> flags = EnumSet.noneOf(ReviewFlag.class);
            for (ReviewFlag f : r.flags()) {
                if (!f.isAudit()) flags.add(f);
            }
            Map<ReviewFlag, String> found = new EnumMap<>(ReviewFlag.class);

            // (a) 파생값 일치
            Bucket derivedBucket = Bucket.of(r.assignedScore());
            if (r.bucket() != derivedBucket) {
                found.put(ReviewFlag.BUCKET_MISMATCH, "stored=" + r.bucket() + " derived=" + derivedBucket);
            }
            Thumb derivedThumb = Thumb.of(r.assignedScore());
            if (r.thumb() != derivedThumb) {
                found.put(ReviewFlag.THUMB_MISMATCH, "stored=" + r.thumb() + " derived=" + derivedThumb);
            }
            // (b) 키워드 극성
            String contradiction = sentimentContradiction(r);
            if (contradiction != null) found.put(ReviewFlag.SENTIMENT_CONTRADICTION, contradiction);
            // (d) 게재일 창
            String window = outsideWindow(show.openingDate(), r.publishDate());
            if (window != null) found.put(ReviewFlag.OUTSIDE_PUBLICATION_WINDOW, window);

            if (nearDuplicates.contains(i)) {
                found.put(ReviewFlag.NEAR_DUPLICATE_CRITIC, "similar critic name in " + r.outletId());
            }
            if (r.url() == null && r.originalRating() == null) {
                found.put(ReviewFlag.MISSING_PROVENANCE, "no url and no original rating");
            }

            flags.addAll(found.keySet());
            NormalizedReview next = r.withFlags(flags);
            out.add(next);

            found.forEach((flag, detail) -> {
                if (flag == ReviewFlag.BUCKET_MISMATCH || flag == ReviewFlag.THUMB_MISMATCH) {
                    log.warn("[StageScore] {} show={} outlet={} {}", flag, r.showId(), r.outletId(), detail);
                }
            });
            // 채점 단계 플래그 + 감사 플래그 모두 리포트에 싣는다
            for (ReviewFlag f : next.flags()) {
                entries.add(AuditEntry.forReview(next, f, found.getOrDefault(f, scoringDetail(f, next))));
            }
        }

        // (c) 버킷 쏠림 (공연 단위)
        if (reviews.size() >= UNIFORM_MIN_REVIEWS) {
            long distinct = reviews.stream().map(r -> Bucket.of(r.assignedScore())).distinct().count();
            if (distinct == 1) {
                Bucket only = Bucket.of(reviews.get(0).assignedScore());
                entries.add(AuditEntry.forShow(show.showId(), ReviewFlag.UNIFORM_BUCKETS,
                        "all " + reviews.size() + " reviews are " + only.label()));
            }
        }

        for (DuplicateConflict c : conflicts) {
            entries.add(new AuditEntry(c.showId(), c.outletId(), c.criticName(), c.keptUrl(),
                    ReviewFlag.DUPLICATE_CONFLICT, ReviewFlag.DUPLICATE_CONFLICT.category(),
                    "kept=" + c.keptScore() + " discarded=" + c.discardedScore()
                            + " match=" + c.matchType() + " discardedUrl=" + c.discardedUrl()));
        }

        if (!entries.isEmpty()) {
            log.info("[StageScore] audit show={} entries={}", show.showId(), entries.size());
        }
        return new ValidationResult(out, new AuditReport(show.showId(), entries, clock.instant()));
    }

    // ===================== 내부 =====================

    private String sentimentContradiction(NormalizedReview r) {
        if (r.scoreSource() == ScoreSource.INFERRED || r.pullQuote() == null) return null;
        SentimentSignal s = sentiment.signal(r.pullQuote());
        if (s.total() < MIN_CONTRADICTION_WEIGHT) return null;
        Bucket b = Bucket.of(r.assignedScore());
        if (s.stronglyPositive() && b == Bucket.PAN) {
            return "positive wording but score " + r.assignedScore();
        }
        if (s.stronglyNegative() && b.isFavorable()) {
            return "negative wording but score " + r.assignedScore();
        }
        return null;
    }

    static String outsideWindow(LocalDate opening, LocalDate published) {
        if (opening == null || published == null) return null;
        if (published.isBefore(opening.minusDays(WINDOW_DAYS_BEFORE))) {
            return "published " + published + " more than " + WINDOW_DAYS_BEFORE + " days before opening " + opening;
        }
        if (published.isAfter(opening.plusDays(WINDOW_DAYS_AFTER))) {
            return "published " + published + " more than " + WINDOW_DAYS_AFTER + " days after opening " + opening;
        }
        return null;
    }

    /** 같은 매체 안에서 이름이 다르지만 편집 거리 2 이내인 평론가 쌍의 인덱스 */
    private Set<Integer> nearDuplicateCritics(List<NormalizedReview> reviews) {
        Set<Integer> hits = new HashSet<>();
        for (int i = 0; i < reviews.size(); i++) {
            String a = criticKey(reviews.get(i).criticName());
            if (a == null) continue;
            for (int j = i + 1; j < reviews.size(); j++) {
                if (!Objects.equals(reviews.get(i).outletId(), reviews.get(j).outletId())) continue;
                String b = criticKey(reviews.get(j).criticName());
                if (b == null || a.equals(b)) continue;
                int d = distance.apply(a, b);
                if (d >= 0) {
                    hits.add(i);
                    hits.add(j);
                }
            }
        }
        return hits;
    }

    private static String criticKey(String critic) {
        return critic == null ? null : critic.trim().toLowerCase(Locale.ROOT);
    }

    private static String scoringDetail(ReviewFlag f, NormalizedReview r) {
        return f.name().toLowerCase(Locale.ROOT) + " score=" + r.assignedScore() + " source=" + r.scoreSource();
    }
}
