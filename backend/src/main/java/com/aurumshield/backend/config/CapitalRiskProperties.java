package com.aurumshield.backend.config;

import com.aurumshield.backend.capital.CapitalBase;
import com.aurumshield.backend.capital.CapitalThresholds;
import com.aurumshield.backend.util.MoneyUtils;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

@Configuration
@ConfigurationProperties(prefix = "capital")
@Data
@Validated
public class CapitalRiskProperties {

    private Thresholds thresholds = new Thresholds();
    private Base base = new Base();
    private Overrides overrides = new Overrides();
    private Sweep sweep = new Sweep();
    private RiskConfig riskConfig = new RiskConfig();

    @Data
    public static class Thresholds {
        @NotBlank
        private String version = CapitalThresholds.DEFAULTS.version();

        @Positive
        private double targetEcr = CapitalThresholds.DEFAULTS.targetEcr();

        @DecimalMin("0.0")
        private double reserveHaircut = CapitalThresholds.DEFAULTS.reserveHaircut();

        @DecimalMin("0.0")
        private double tvarAddonFactor = CapitalThresholds.DEFAULTS.tvarAddonFactor();

        @Positive
        private double hardstopCaution = CapitalThresholds.DEFAULTS.hardstopCaution();

        @Positive
        private double hardstopBreach = CapitalThresholds.DEFAULTS.hardstopBreach();

        @Positive
        private double hardstopExceeded = CapitalThresholds.DEFAULTS.hardstopExceeded();

        @Positive
        private double hardstopThrottle = CapitalThresholds.DEFAULTS.hardstopThrottle();

        @Positive
        private double hardstopFreeze = CapitalThresholds.DEFAULTS.hardstopFreeze();

        @Positive
        private double ecrFreezeMultiplier = CapitalThresholds.DEFAULTS.ecrFreezeMultiplier();

        @Positive
        private double ecrCriticalMultiplier = CapitalThresholds.DEFAULTS.ecrCriticalMultiplier();

        @NotNull
        private Duration bufferNegativeLookback = CapitalThresholds.DEFAULTS.bufferNegativeLookback();

        @Positive
        private double throttleCapacityFraction = CapitalThresholds.DEFAULTS.throttleCapacityFraction();

        @Min(1)
        private int topDriverCount = CapitalThresholds.DEFAULTS.topDriverCount();
    }

    /** Cold-start capital figures used until collaborators push real state. */
    @Data
    public static class Base {
        @DecimalMin("0.0")
        private BigDecimal capitalBase = MoneyUtils.bd("100000000");

        @DecimalMin("0.0")
        private BigDecimal hardstopLimit = MoneyUtils.bd("50000000");

        @DecimalMin("0.0")
        private BigDecimal tvar99 = MoneyUtils.bd("4500000");
    }

    @Data
    public static class Overrides {
        @NotEmpty
        private List<String> allowedRoles = new ArrayList<>(List.of("admin", "treasury", "compliance"));

        @Min(1)
        private int minReasonLength = 20;

        @Min(1)
        private int inactiveExportLimit = 10;
    }

    @Data
    public static class Sweep {
        private boolean enabled = true;

        @Positive
        private long intervalMs = 60_000;
    }

    @Data
    public static class RiskConfig {
        @NotNull
        private Duration cacheTtl = Duration.ofSeconds(60);
    }

    public CapitalThresholds toThresholds() {
        return new CapitalThresholds(
                thresholds.getVersion(),
                thresholds.getTargetEcr(),
                thresholds.getReserveHaircut(),
                thresholds.getTvarAddonFactor(),
                thresholds.getHardstopCaution(),
                thresholds.getHardstopBreach(),
                thresholds.getHardstopExceeded(),
                thresholds.getHardstopThrottle(),
                thresholds.getHardstopFreeze(),
                thresholds.getEcrFreezeMultiplier(),
                thresholds.getEcrCriticalMultiplier(),
                thresholds.getBufferNegativeLookback(),
                thresholds.getThrottleCapacityFraction(),
                thresholds.getTopDriverCount()
        );
    }

    public CapitalBase toCapitalBase() {
        return new CapitalBase(base.getCapitalBase(), base.getHardstopLimit(), base.getTvar99(), MoneyUtils.ZERO);
    }

    public Set<String> allowedOverrideRoles() {
        return overrides.getAllowedRoles().stream()
                .map(role -> role.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
