package com.atomicswap.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateFillRequest {

    @NotNull(message = "Order id is required")
    private Long orderId;

    @NotBlank(message = "Filler is required")
    private String filler;

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be positive")
    private Long amount;

    /** Only with fill-scoped secrets. */
    @Pattern(regexp = "^[0-9a-fA-F]{64}$", message = "Hashlock must be 64 hex characters")
    private String hashlock;
}
