package com.atomicswap.domain.model;

import com.atomicswap.domain.enums.OrderStage;
import com.atomicswap.domain.enums.OrderStatus;
import com.atomicswap.domain.enums.TimelockMode;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * A hash-time-locked swap order. Funds of {@code totalAmount} are escrowed by the host ledger
 * and released either to the receiver against the hashlock preimage or back to the sender
 * once the cancellation window opens.
 *
 * <p>Amounts are integer base units of {@code asset}. {@code filledAmount + remainingAmount}
 * always equals {@code totalAmount}. All timestamps are epoch seconds.
 */
@Data
@Builder
public class SwapOrder {

    private Long id;

    private String sender;
    private String receiver;

    /** Designated taker for the exclusive stage. Null when any whitelisted resolver may settle. */
    private String taker;

    @Builder.Default
    private List<String> whitelist = new ArrayList<>();

    private String asset;
    private long totalAmount;
    private long filledAmount;
    private long remainingAmount;
    private long minFillAmount;
    private boolean partialFillsAllowed;

    /** Required resolver collateral; zero when the order does not require one. */
    private long safetyDepositAmount;

    private int feeBps;

    /** Hex SHA-256 digest, write-once. */
    private String hashlock;

    private String secret;
    private String withdrawnBy;
    private String cancelledBy;

    private TimelockMode timelockMode;
    private long createdAt;
    private long expiresAt;
    private Long finalityAt;
    private Long takerDeadline;
    private Long publicDeadline;
    private Long cancellationStart;
    private Long publicCancellationStart;

    private OrderStatus status;
    private OrderStage stage;

    private String destinationChainId;
    private String destinationRecipient;
    private String destinationToken;
    private Long sequenceRef;

    private long updatedAt;

    /** Row version the snapshot was read at; a save from an older snapshot is rejected. */
    private Long version;

    /**
     * Stage boundaries in ascending order: the single expiry, or the five staged deadlines.
     */
    public List<Long> boundaries() {
        if (timelockMode == TimelockMode.SINGLE) {
            return List.of(expiresAt);
        }
        return List.of(finalityAt, takerDeadline, publicDeadline, cancellationStart, publicCancellationStart);
    }

    public boolean isCrossChain() {
        return destinationChainId != null;
    }

    public boolean isWhitelisted(String address) {
        return whitelist != null && whitelist.contains(address);
    }
}
