package com.goormthonuniv.stagescore.outlet;

import com.goormthonuniv.stagescore.exception.OutletCatalogException;
import com.goormthonuniv.stagescore.outlet.OutletResolution.MatchStage;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.*;
import java.util.regex.Pattern;

/**
 * 원시 매체명/URL → 정식 매체 식별자 + tier 가중치.
 * - 정식 id → 표시명 → 별칭 → URL 도메인 순. 각 단계는 전체 매체를 훑은 뒤 다음 단계로 넘어간다
 * - 비교는 대소문자 무시, 결과는 입력에 대해 결정적
 * - 식별 실패 시 합성 id + 최하위 tier (호출 측에서 UNRESOLVED_OUTLET 플래그)
 */
@Slf4j
public class OutletResolver {

    private static final String UNKNOWN_ID = "UNKNOWN";
    private static final int SYNTHETIC_ID_LEN = 6;
    private static final Pattern NON_LETTER = Pattern.compile("[^A-Z]");

    private final List<OutletConfig> outlets;
    private final TierWeights tierWeights;

    // 단계별 인덱스 (카탈로그 순서 보존, 첫 항목 우선)
    private final Map<String, OutletConfig> byId = new LinkedHashMap<>();
    private final Map<String, OutletConfig> byName = new LinkedHashMap<>();
    private final Map<String, OutletConfig> byAlias = new LinkedHashMap<>();

    public OutletResolver(List<OutletConfig> outlets, TierWeights tierWeights) {
        if (outlets == null || outlets.isEmpty()) {
            throw new OutletCatalogException("outlet catalog is empty");
        }
        this.outlets = List.copyOf(outlets);
        this.tierWeights = tierWeights;
        for (OutletConfig o : this.outlets) {
            byId.putIfAbsent(key(o.id()), o);
            byName.putIfAbsent(key(o.name()), o);
            for (String alias : o.aliases()) {
                byAlias.putIfAbsent(key(alias), o);
            }
        }
    }

    /** 이름 또는 URL 하나로 식별 */
    public OutletResolution resolve(String nameOrUrl) {
        OutletResolution r = match(nameOrUrl);
        if (r != null) return r;
        return unresolved(nameOrUrl);
    }

    /** 이름 먼저, 실패하면 URL 로 재시도 */
    public OutletResolution resolve(String name, String url) {
        OutletResolution r = match(name);
        if (r == null) r = match(url);
        if (r != null) return r;
        return unresolved(name != null && !name.isBlank() ? name : url);
    }

    public Optional<OutletConfig> findById(String outletId) {
        if (outletId == null) return Optional.empty();
        return Optional.ofNullable(byId.get(key(outletId)));
    }

    /** 집계용 가중치. 카탈로그에 없는 id 는 최하위 tier */
    public double tierWeight(String outletId) {
        return findById(outletId).map(OutletConfig::tierWeight)
                .orElse(tierWeights.weightOf(TierWeights.LOWEST_TIER));
    }

    public int tierOf(String outletId) {
        return findById(outletId).map(OutletConfig::tier).orElse(TierWeights.LOWEST_TIER);
    }

    public List<OutletConfig> outlets() {
        return outlets;
    }

    /** 대문자화 후 영문자만 남겨 앞 6자 ("Joe's Theatre Blog" → "JOESTH"), 하나도 없으면 UNKNOWN */
    public static String syntheticId(String raw) {
        if (raw == null) return UNKNOWN_ID;
        String letters = NON_LETTER.matcher(raw.toUpperCase(Locale.ROOT)).replaceAll("");
        if (letters.isEmpty()) return UNKNOWN_ID;
        return letters.length() > SYNTHETIC_ID_LEN ? letters.substring(0, SYNTHETIC_ID_LEN) : letters;
    }

    // ------------------------ 내부 유틸 ------------------------

    private OutletResolution match(String input) {
        if (input == null || input.isBlank()) return null;
        String k = key(input);

        OutletConfig hit = byId.get(k);
        if (hit != null) return resolved(hit, MatchStage.CANONICAL_ID);

        hit = byName.get(k);
        if (hit != null) return resolved(hit, MatchStage.DISPLAY_NAME);

        hit = byAlias.get(k);
        if (hit != null) return resolved(hit, MatchStage.ALIAS);

        hit = matchLongestDomain(k);
        if (hit != null) return resolved(hit, MatchStage.DOMAIN);
        return null;
    }

    /** 도메인 부분 문자열 매칭. 여러 개 걸리면 가장 긴 도메인 우선 (thewrap.com > wrap.com) */
    private OutletConfig matchLongestDomain(String lowered) {
        String host = normalizeHost(lowered);
        String haystack = host != null ? host : lowered;
        OutletConfig best = null;
        int bestLen = -1;
        for (OutletConfig o : outlets) {
            if (o.domain() == null || o.domain().isBlank()) continue;
            String d = key(o.domain());
            if (haystack.contains(d) && d.length() > bestLen) {
                best = o;
                bestLen = d.length();
            }
        }
        return best;
    }

    private OutletResolution resolved(OutletConfig o, MatchStage stage) {
        return new OutletResolution(o.id(), o.name(), o.tier(), o.tierWeight(), o, stage);
    }

    private OutletResolution unresolved(String raw) {
        String id = syntheticId(raw);
        log.warn("[StageScore] unresolved outlet input=\"{}\" syntheticId={}", raw, id);
        String name = raw == null || raw.isBlank() ? "Unknown Outlet" : raw.trim();
        return new OutletResolution(id, name, TierWeights.LOWEST_TIER,
                tierWeights.weightOf(TierWeights.LOWEST_TIER), null, MatchStage.UNRESOLVED);
    }

    /** URL 이면 host 만, "host/path" 형태도 허용. 파싱 불가면 null */
    static String normalizeHost(String urlOrHost) {
        String raw = urlOrHost.trim().toLowerCase(Locale.ROOT);
        if (!raw.contains(".")) return null;
        String candidate = raw.contains("://") ? raw : "https://" + raw;
        try {
            URI uri = new URI(candidate);
            String host = uri.getHost();
            if (host == null) return null;
            return host.startsWith("www.") ? host.substring(4) : host;
        } catch (URISyntaxException e) {
            log.debug("[StageScore] not a URL: {}", urlOrHost);
            return null;
        }
    }

    private static String key(String s) {
        return s.trim().toLowerCase(Locale.ROOT);
    }
}
