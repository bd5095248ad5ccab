package com.goormthonuniv.stagescore.outlet;

import com.goormthonuniv.stagescore.exception.OutletCatalogException;
import com.goormthonuniv.stagescore.outlet.OutletResolution.MatchStage;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OutletResolverTest {

    private final OutletResolver resolver = new OutletResolver(List.of(
            outlet("NYT", "The New York Times", 1, List.of("New York Times", "NY Times"), "nytimes.com"),
            outlet("WRAP", "TheWrap", 2, List.of(), "thewrap.com"),
            outlet("WRAPCO", "Wrap Co", 3, List.of(), "wrap.com"),
            outlet("BWW", "BroadwayWorld", 3, List.of("Broadway World"), "broadwayworld.com")
    ), TierWeights.defaults());

    @Test
    void matchesEachStageCaseInsensitively() {
        assertThat(resolver.resolve("nyt").stage()).isEqualTo(MatchStage.CANONICAL_ID);
        assertThat(resolver.resolve("the new york times").stage()).isEqualTo(MatchStage.DISPLAY_NAME);
        assertThat(resolver.resolve("NY TIMES").stage()).isEqualTo(MatchStage.ALIAS);

        OutletResolution byUrl = resolver.resolve("https://www.nytimes.com/2025/03/12/theater/review.html");
        assertThat(byUrl.outletId()).isEqualTo("NYT");
        assertThat(byUrl.stage()).isEqualTo(MatchStage.DOMAIN);
        assertThat(byUrl.tier()).isEqualTo(1);
        assertThat(byUrl.tierWeight()).isEqualTo(1.0);
    }

    @Test
    void longestDomainWins() {
        assertThat(resolver.resolve("https://www.thewrap.com/some-review/").outletId()).isEqualTo("WRAP");
        assertThat(resolver.resolve("https://wrap.com/x").outletId()).isEqualTo("WRAPCO");
    }

    @Test
    void fallsBackToUrlWhenNameIsUnknown() {
        OutletResolution r = resolver.resolve("Broadway World Staff", "https://www.broadwayworld.com/article/123");
        assertThat(r.outletId()).isEqualTo("BWW");
        assertThat(r.resolved()).isTrue();
    }

    @Test
    void unresolvedGetsSyntheticIdAndLowestTier() {
        OutletResolution r = resolver.resolve("Joe's Theatre Blog", null);
        assertThat(r.resolved()).isFalse();
        assertThat(r.outletId()).isEqualTo("JOESTH");
        assertThat(r.outletName()).isEqualTo("Joe's Theatre Blog");
        assertThat(r.tier()).isEqualTo(3);
        assertThat(r.tierWeight()).isEqualTo(0.70);
        assertThat(r.config()).isNull();
    }

    @Test
    void syntheticIdEdgeCases() {
        assertThat(OutletResolver.syntheticId("all lowercase")).isEqualTo("ALLLOW");
        assertThat(OutletResolver.syntheticId("stagebuddy")).isEqualTo("STAGEB");
        assertThat(OutletResolver.syntheticId("theaterpizzazz")).isEqualTo("THEATE");
        assertThat(OutletResolver.syntheticId("NY Stage Review")).isEqualTo("NYSTAG");
        assertThat(OutletResolver.syntheticId("1234 !!")).isEqualTo("UNKNOWN");
        assertThat(OutletResolver.syntheticId(null)).isEqualTo("UNKNOWN");
        assertThat(OutletResolver.syntheticId("A B C D E F G H")).isEqualTo("ABCDEF");
    }

    @Test
    void weightLookupByIdDefaultsToLowestTier() {
        assertThat(resolver.tierWeight("WRAP")).isEqualTo(0.85);
        assertThat(resolver.tierWeight("NOPE")).isEqualTo(0.70);
        assertThat(resolver.tierOf(null)).isEqualTo(TierWeights.LOWEST_TIER);
    }

    @Test
    void emptyCatalogIsFatal() {
        assertThatThrownBy(() -> new OutletResolver(List.of(), TierWeights.defaults()))
                .isInstanceOf(OutletCatalogException.class);
    }

    private static OutletConfig outlet(String id, String name, int tier, List<String> aliases, String domain) {
        return new OutletConfig(id, name, tier, TierWeights.defaults().weightOf(tier), aliases, domain,
                RatingFormat.TEXT_BUCKET, null, true);
    }
}
