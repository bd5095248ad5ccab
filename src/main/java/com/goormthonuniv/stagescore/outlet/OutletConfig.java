package com.goormthonuniv.stagescore.outlet;

import java.util.List;

/**
 * 매체 카탈로그 한 줄. outlets.json 에서 한 번 읽어 들이며 이후 읽기 전용.
 * tierWeight 는 JSON 에 없으면 로더가 TierWeights 로 채운다.
 */
public record OutletConfig(
        String id,
        String name,
        int tier,                 // 1~3
        double tierWeight,
        List<String> aliases,
        String domain,
        RatingFormat ratingFormat,
        Integer maxScale,         // 별점 매체의 만점 (없으면 null)
        Boolean enabled           // 비활성 매체도 식별은 된다
) {
    public OutletConfig {
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
        enabled = enabled == null ? Boolean.TRUE : enabled;
    }

    public OutletConfig withTierWeight(double weight) {
        return new OutletConfig(id, name, tier, weight, aliases, domain, ratingFormat, maxScale, enabled);
    }

    public boolean active() {
        return Boolean.TRUE.equals(enabled);
    }
}
