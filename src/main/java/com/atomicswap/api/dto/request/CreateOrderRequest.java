package com.atomicswap.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for creating a swap order. Set either {@code timelockSeconds} or
 * {@code stageDurations}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateOrderRequest {

    @NotBlank(message = "Sender is required")
    private String sender;

    @NotBlank(message = "Receiver is required")
    private String receiver;

    private String taker;

    private List<String> whitelist;

    @NotBlank(message = "Asset is required")
    private String asset;

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be positive")
    private Long amount;

    @Positive(message = "Minimum fill must be positive")
    private Long minFillAmount;

    private boolean partialFills;

    @NotBlank(message = "Hashlock is required")
    @Pattern(regexp = "^[0-9a-fA-F]{64}$", message = "Hashlock must be 64 hex characters")
    private String hashlock;

    @Positive(message = "Timelock must be positive")
    private Long timelockSeconds;

    @Valid
    private StageDurationsRequest stageDurations;

    @Min(value = 0, message = "Safety deposit cannot be negative")
    private Long safetyDepositAmount;

    private boolean requireSafetyDeposit;

    @Min(value = 0, message = "Fee must be between 0 and 10000 bps")
    @Max(value = 10000, message = "Fee must be between 0 and 10000 bps")
    private Integer feeBps;

    private String destinationChainId;
    private String destinationRecipient;
    private String destinationToken;
}
