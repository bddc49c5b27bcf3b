package com.atomicswap.config;

import com.atomicswap.domain.enums.SecretScope;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Deployment-wide settlement engine parameters, read from the {@code atomicswap.engine} prefix.
 */
@Configuration
@ConfigurationProperties(prefix = "atomicswap.engine")
@Validated
@Getter
@Setter
public class EngineProperties {

    /** Default resolver fee applied when an order does not name one. */
    @Min(0)
    @Max(10000)
    private int protocolFeeBps = 50;

    /** Ceiling for a per-order fee. */
    @Min(0)
    @Max(10000)
    private int maxFeeBps = 1000;

    @Min(1)
    private long minTimelockSeconds = 3600;

    @Min(1)
    private long maxTimelockSeconds = 2_592_000;

    /** Receives the fee when the receiver settles its own order. */
    @NotBlank
    private String treasuryAddress = "treasury";

    private boolean partialFillsEnabled = true;

    @NotNull
    private SecretScope secretScope = SecretScope.ORDER;

    /** Default minimum fill is total / divisor. */
    @Min(1)
    private long defaultMinFillDivisor = 10;

    /** Requested safety deposit without an explicit amount is total / divisor. */
    @Min(1)
    private long safetyDepositDivisor = 20;

    private boolean applyResolverDiscount = true;

    /** Timeout stamped on outbound cross-chain packets, relative to initiation. */
    @Min(1)
    private long ackTimeoutSeconds = 3600;
}
