package com.goormthonuniv.stagescore.service;

import com.goormthonuniv.stagescore.calibration.CalibrationCorrector;
import com.goormthonuniv.stagescore.calibration.CalibrationResult;
import com.goormthonuniv.stagescore.calibration.CalibrationSample;
import com.goormthonuniv.stagescore.calibration.CalibrationSampleCollector;
import com.goormthonuniv.stagescore.dto.*;
import com.goormthonuniv.stagescore.llm.EnsembleScorer;
import com.goormthonuniv.stagescore.outlet.OutletResolution;
import com.goormthonuniv.stagescore.outlet.OutletResolver;
import com.goormthonuniv.stagescore.rating.DesignationDetector;
import com.goormthonuniv.stagescore.rating.ParsedRating;
import com.goormthonuniv.stagescore.rating.RatingParser;
import com.goormthonuniv.stagescore.rating.SentimentInferencer;
import com.goormthonuniv.stagescore.util.TextUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * RawReview 한 건 → NormalizedReview.
 * 점수 경로: 명시 평점 → (오라클 사용 가능 시) 앙상블 + 보정 → 키워드 추론 → 거절.
 */
@Slf4j
public class ReviewScoringService {

    private static final int MAX_QUOTE_CHARS = 1000;
    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("MMM d, yyyy", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("M/d/yyyy", Locale.ENGLISH)
    );

    private final OutletResolver outlets;
    private final RatingParser ratingParser;
    private final SentimentInferencer sentiment;
    private final DesignationDetector designations;
    private final EnsembleScorer ensemble;
    private final CalibrationCorrector calibration;
    private final CalibrationSampleCollector samples;
    private final boolean sampleExplicit;

    public ReviewScoringService(OutletResolver outlets,
                                RatingParser ratingParser,
                                SentimentInferencer sentiment,
                                DesignationDetector designations,
                                EnsembleScorer ensemble,
                                CalibrationCorrector calibration,
                                CalibrationSampleCollector samples,
                                boolean sampleExplicit) {
        this.outlets = outlets;
        this.ratingParser = ratingParser;
        this.sentiment = sentiment;
        this.designations = designations;
        this.ensemble = ensemble;
        this.calibration = calibration;
        this.samples = samples;
        this.sampleExplicit = sampleExplicit;
    }

    public ScoringOutcome score(String showId, RawReview raw) {
        OutletResolution outlet = outlets.resolve(raw.outletName(), raw.url());

        Optional<ParsedRating> rating = ratingParser.parse(raw, outlet.config());
        if (rating.isPresent()) {
            collectSample(raw, rating.get());
        } else {
            rating = scoreFromText(raw);
        }
        if (rating.isEmpty()) {
            String reason = raw.hasRating()
                    ? "unparseable rating \"" + raw.originalRating() + "\" and no usable excerpt"
                    : "no rating and no usable excerpt";
            log.warn("[StageScore] rejected review show={} outlet={} reason={}", showId, raw.outletName(), reason);
            return ScoringOutcome.rejected(RejectedReview.of(raw, reason));
        }

        ParsedRating r = rating.get();
        EnumSet<ReviewFlag> flags = EnumSet.noneOf(ReviewFlag.class);
        flags.addAll(r.flags());
        if (!outlet.resolved()) flags.add(ReviewFlag.UNRESOLVED_OUTLET);

        NormalizedReview review = NormalizedReview.builder()
                .showId(showId)
                .outletId(outlet.outletId())
                .outlet(outlet.outletName())
                .criticName(TextUtils.trimToNull(raw.criticName()))
                .url(TextUtils.trimToNull(raw.url()))
                .publishDate(parseDate(raw.publishDate()))
                .assignedScore(r.score())
                .originalRating(TextUtils.trimToNull(raw.originalRating()))
                .bucket(Bucket.of(r.score()))
                .thumb(Thumb.of(r.score()))
                .designation(designations.detect(raw.designation(), raw.excerpt()).orElse(null))
                .pullQuote(quote(raw.excerpt()))
                .scoreSource(r.source())
                .flags(flags)
                .build();
        return ScoringOutcome.scored(review);
    }

    // ===================== 내부 =====================

    /** 명시 평점이 없을 때: 앙상블 → 키워드 추론 */
    private Optional<ParsedRating> scoreFromText(RawReview raw) {
        if (!raw.hasExcerpt()) return Optional.empty();
        if (ensemble.isAvailable()) {
            Optional<EnsembleResult> er = ensemble.score(raw.excerpt());
            if (er.isPresent()) return Optional.of(fromEnsemble(er.get()));
            log.info("[StageScore] ensemble produced no score, using keyword inference outlet={}", raw.outletName());
        }
        return sentiment.infer(raw.excerpt());
    }

    private ParsedRating fromEnsemble(EnsembleResult er) {
        CalibrationResult cal = calibration.correct(er.finalScore());
        EnumSet<ReviewFlag> flags = EnumSet.noneOf(ReviewFlag.class);
        if (cal.insufficientData()) flags.add(ReviewFlag.INSUFFICIENT_CALIBRATION);
        if (er.flagForReview()) flags.add(ReviewFlag.HIGH_ORACLE_DISAGREEMENT);
        if (er.primaryFromFallback()) flags.add(ReviewFlag.ORACLE_FALLBACK);
        return new ParsedRating(cal.correctedScore(), null, ScoreSource.ENSEMBLE, flags);
    }

    /** 명시 평점 + 본문이 모두 있으면 (설정 시) 오라클 원점수와 짝지어 보정 표본으로 남긴다 */
    private void collectSample(RawReview raw, ParsedRating explicit) {
        if (!sampleExplicit || !raw.hasExcerpt() || !ensemble.isAvailable()) return;
        ensemble.score(raw.excerpt())
                .ifPresent(er -> samples.record(new CalibrationSample(er.finalScore(), explicit.score())));
    }

    static LocalDate parseDate(String text) {
        String t = TextUtils.trimToNull(text);
        if (t == null) return null;
        if (t.length() > 10 && Character.isDigit(t.charAt(0)) && t.charAt(4) == '-') {
            t = t.substring(0, 10); // ISO 날짜시간 → 날짜
        }
        DateTimeParseException last = null;
        for (DateTimeFormatter f : DATE_FORMATS) {
            try {
                return LocalDate.parse(t, f);
            } catch (DateTimeParseException e) {
                last = e;
            }
        }
        log.debug("[StageScore] unparseable publish date \"{}\": {}", text, last.getMessage());
        return null;
    }

    private static String quote(String excerpt) {
        String q = TextUtils.trimToNull(excerpt);
        if (q == null) return null;
        q = q.replaceAll("\\s+", " ");
        return q.length() > MAX_QUOTE_CHARS ? q.substring(0, MAX_QUOTE_CHARS) : q;
    }
}
