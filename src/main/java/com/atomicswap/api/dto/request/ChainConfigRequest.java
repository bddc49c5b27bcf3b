package com.atomicswap.api.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChainConfigRequest {

    @NotBlank(message = "Chain name is required")
    private String name;

    @NotBlank(message = "Channel is required")
    private String channel;

    /** Defaults to true when omitted. */
    private Boolean active;

    @Min(value = 0, message = "Fee multiplier cannot be negative")
    @Max(value = 5000, message = "Fee multiplier must be 5000 bps or less")
    private int feeMultiplierBps;
}
