package com.atomicswap.api.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Stage lengths in seconds. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StageDurationsRequest {

    @NotNull
    @PositiveOrZero
    private Long finalityDelay;

    @NotNull
    @Positive
    private Long takerExclusiveDuration;

    @NotNull
    @Positive
    private Long privateResolverDuration;

    @NotNull
    @Positive
    private Long publicResolverDuration;

    @NotNull
    @Positive
    private Long privateCancellationDuration;
}
