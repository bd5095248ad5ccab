package com.goormthonuniv.stagescore.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.goormthonuniv.stagescore.exception.OutletCatalogException;
import com.goormthonuniv.stagescore.outlet.OutletConfig;
import com.goormthonuniv.stagescore.outlet.OutletResolver;
import com.goormthonuniv.stagescore.outlet.RatingFormat;
import com.goormthonuniv.stagescore.outlet.TierWeights;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OutletCatalogConfigTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void bundledCatalogLoadsWithTierWeights() {
        List<OutletConfig> outlets = OutletCatalogConfig.load(new ClassPathResource("outlets.json"),
                objectMapper, TierWeights.defaults());

        assertThat(outlets).hasSizeGreaterThanOrEqualTo(40);
        assertThat(outlets).allSatisfy(o -> assertThat(o.tierWeight()).isPositive());

        OutletResolver resolver = new OutletResolver(outlets, TierWeights.defaults());
        OutletConfig guardian = resolver.findById("GUARDIAN").orElseThrow();
        assertThat(guardian.ratingFormat()).isEqualTo(RatingFormat.STARS);
        assertThat(guardian.maxScale()).isEqualTo(5);
        assertThat(resolver.findById("BWAYBOX")).hasValueSatisfying(o -> assertThat(o.active()).isFalse());
        assertThat(resolver.resolve("Time Out New York").outletId()).isEqualTo("TIMEOUTNY");
    }

    @Test
    void missingCatalogIsFatal() {
        assertThatThrownBy(() -> OutletCatalogConfig.load(new ClassPathResource("no-such-catalog.json"),
                objectMapper, TierWeights.defaults()))
                .isInstanceOf(OutletCatalogException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void emptyOrBrokenCatalogIsFatal() {
        assertThatThrownBy(() -> OutletCatalogConfig.load(json("[]"), objectMapper, TierWeights.defaults()))
                .isInstanceOf(OutletCatalogException.class)
                .hasMessageContaining("empty");
        assertThatThrownBy(() -> OutletCatalogConfig.load(json("{not json"), objectMapper, TierWeights.defaults()))
                .isInstanceOf(OutletCatalogException.class)
                .hasMessageContaining("unreadable");
    }

    @Test
    void explicitWeightIsKept() {
        List<OutletConfig> outlets = OutletCatalogConfig.load(
                json("[{\"id\":\"X\",\"name\":\"X Review\",\"tier\":2,\"tierWeight\":0.9}]"),
                objectMapper, TierWeights.defaults());
        assertThat(outlets.get(0).tierWeight()).isEqualTo(0.9);
        assertThat(outlets.get(0).active()).isTrue();
    }

    private static ByteArrayResource json(String s) {
        return new ByteArrayResource(s.getBytes(StandardCharsets.UTF_8));
    }
}
