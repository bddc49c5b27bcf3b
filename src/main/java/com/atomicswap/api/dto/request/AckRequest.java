package com.atomicswap.api.dto.request;

import com.atomicswap.domain.enums.AckOutcome;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Acknowledgement from the messaging layer. Relayers either send an explicit outcome or
 * the plain success flag (false meaning a negative acknowledgement).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AckRequest {

    @NotNull(message = "Sequence is required")
    private Long sequence;

    private AckOutcome outcome;

    private Boolean success;
}
