package com.atomicswap.htlc;

import com.atomicswap.domain.vo.StageDurations;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Terms of a new swap order. Exactly one of {@code timelockSeconds} (single expiry) and
 * {@code stageDurations} (staged resolution) must be set.
 */
@Data
@Builder
public class CreateOrderCommand {

    private String sender;
    private String receiver;
    private String taker;
    private List<String> whitelist;

    private String asset;
    private long amount;

    /** Defaults to amount / 10 when partial fills are allowed. */
    private Long minFillAmount;

    private boolean partialFills;

    private String hashlock;

    private Long timelockSeconds;
    private StageDurations stageDurations;

    /** Explicit deposit requirement; takes precedence over {@code requireSafetyDeposit}. */
    private Long safetyDepositAmount;

    private boolean requireSafetyDeposit;

    /** Defaults to the configured protocol fee. */
    private Integer feeBps;

    private String destinationChainId;
    private String destinationRecipient;
    private String destinationToken;
}
