package com.goormthonuniv.stagescore.dedupe;

import com.goormthonuniv.stagescore.dto.NormalizedReview;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * 한 공연의 리뷰 목록에서 중복을 합친다.
 * 입력을 PRECEDENCE 순으로 먼저 정렬하므로 입력 순서와 무관하게 같은 결과가 나온다.
 * 병합으로 새 필드(URL 등)를 얻은 레코드는 남은 레코드와 다시 비교한다.
 */
@Slf4j
public class ReviewDeduplicator {

    public static final Comparator<NormalizedReview> OUTPUT_ORDER =
            Comparator.comparing(NormalizedReview::outletId, Comparator.nullsLast(Comparator.naturalOrder()))
                    .thenComparing(NormalizedReview::criticName, Comparator.nullsFirst(Comparator.naturalOrder()))
                    .thenComparing(ReviewMerger.PRECEDENCE);

    private final DuplicateMatcher matcher;

    public ReviewDeduplicator(DuplicateMatcher matcher) {
        this.matcher = matcher;
    }

    public DedupeResult deduplicate(List<NormalizedReview> reviews) {
        List<DuplicateConflict> conflicts = new ArrayList<>();
        List<NormalizedReview> kept = new ArrayList<>();

        List<NormalizedReview> ordered = new ArrayList<>(reviews);
        ordered.sort(ReviewMerger.PRECEDENCE);
        for (NormalizedReview r : ordered) {
            kept.add(absorb(kept, r, conflicts));
        }
        kept.sort(OUTPUT_ORDER);
        return new DedupeResult(kept, reviews.size() - kept.size(), conflicts);
    }

    /** 기존 저장분에 새 배치를 병합. 새 배치 내부 중복을 먼저 합친다 */
    public MergeOutcome mergeWithExisting(List<NormalizedReview> existing, List<NormalizedReview> incoming) {
        DedupeResult batch = deduplicate(incoming);
        List<DuplicateConflict> conflicts = new ArrayList<>(batch.conflicts());

        List<NormalizedReview> working = new ArrayList<>(existing);
        int added = 0, updated = 0, unchanged = 0;
        for (NormalizedReview r : batch.reviews()) {
            int idx = indexOfMatch(working, r);
            if (idx < 0) {
                working.add(r);
                added++;
                continue;
            }
            NormalizedReview before = working.remove(idx);
            NormalizedReview merged = mergeRecording(before, r, matcher.match(before, r), conflicts);
            // 병합으로 다른 기존 레코드와도 겹치게 되면 함께 흡수
            merged = absorb(working, merged, conflicts);
            working.add(merged);
            if (merged.equals(before)) unchanged++;
            else updated++;
        }
        working.sort(OUTPUT_ORDER);
        return new MergeOutcome(working, added, updated, unchanged, batch.duplicatesRemoved(), conflicts);
    }

    // ===================== 내부 =====================

    /** target 과 겹치는 레코드를 kept 에서 모두 빼서 합친 결과를 돌려준다 (kept 에는 넣지 않음) */
    private NormalizedReview absorb(List<NormalizedReview> kept, NormalizedReview target, List<DuplicateConflict> conflicts) {
        NormalizedReview merged = target;
        int idx;
        while ((idx = indexOfMatch(kept, merged)) >= 0) {
            NormalizedReview other = kept.remove(idx);
            merged = mergeRecording(other, merged, matcher.match(other, merged), conflicts);
        }
        return merged;
    }

    private int indexOfMatch(List<NormalizedReview> list, NormalizedReview r) {
        for (int i = 0; i < list.size(); i++) {
            if (matcher.match(list.get(i), r) != MatchType.NONE) return i;
        }
        return -1;
    }

    private static NormalizedReview mergeRecording(NormalizedReview a, NormalizedReview b, MatchType type,
                                                   List<DuplicateConflict> conflicts) {
        NormalizedReview merged = ReviewMerger.merge(a, b);
        if (a.assignedScore() != b.assignedScore()) {
            NormalizedReview loser = ReviewMerger.isWinner(a, b) ? b : a;
            DuplicateConflict c = new DuplicateConflict(merged.showId(), merged.outletId(), merged.criticName(), type,
                    merged.assignedScore(), loser.assignedScore(), merged.url(), loser.url());
            log.warn("[StageScore] duplicate conflict show={} outlet={} critic={} kept={} discarded={} ({})",
                    c.showId(), c.outletId(), c.criticName(), c.keptScore(), c.discardedScore(), type);
            conflicts.add(c);
        }
        return merged;
    }
}
