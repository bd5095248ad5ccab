package com.goormthonuniv.stagescore.outlet;

public record OutletResolution(
        String outletId,
        String outletName,
        int tier,
        double tierWeight,
        OutletConfig config,      // 미식별이면 null
        MatchStage stage
) {
    public enum MatchStage { CANONICAL_ID, DISPLAY_NAME, ALIAS, DOMAIN, UNRESOLVED }

    public boolean resolved() {
        return stage != MatchStage.UNRESOLVED;
    }
}
