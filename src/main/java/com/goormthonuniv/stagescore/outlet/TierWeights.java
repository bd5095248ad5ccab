package com.goormthonuniv.stagescore.outlet;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class TierWeights {

    public static final int LOWEST_TIER = 3;

    private final double tier1;
    private final double tier2;
    private final double tier3;

    public TierWeights(@Value("${stagescore.tiers.weight-1:1.0}") double tier1,
                       @Value("${stagescore.tiers.weight-2:0.85}") double tier2,
                       @Value("${stagescore.tiers.weight-3:0.70}") double tier3) {
        this.tier1 = tier1;
        this.tier2 = tier2;
        this.tier3 = tier3;
    }

    public static TierWeights defaults() {
        return new TierWeights(1.0, 0.85, 0.70);
    }

    /** 알 수 없는 tier 는 최하위 취급 */
    public double weightOf(int tier) {
        if (tier == 1) return tier1;
        if (tier == 2) return tier2;
        return tier3;
    }
}
