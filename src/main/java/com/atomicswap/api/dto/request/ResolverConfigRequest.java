package com.atomicswap.api.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResolverConfigRequest {

    private int priority;

    @Min(value = 0, message = "Fee discount must be between 0 and 10000 bps")
    @Max(value = 10000, message = "Fee discount must be between 0 and 10000 bps")
    private int feeDiscountBps;

    /** Defaults to true when omitted. */
    private Boolean enabled;
}
