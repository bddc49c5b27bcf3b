package com.atomicswap.domain.vo;

import com.atomicswap.domain.enums.TransferReason;
import lombok.Builder;
import lombok.Value;

/**
 * Itemized split of a settled amount. {@code payout + fee == amount}; all parts are
 * truncated basis-point products.
 *
 * <ul>
 *   <li>baseFee: amount * feeBps / 10000, after any resolver discount</li>
 *   <li>discount: the part of the undiscounted base fee waived for a registered resolver</li>
 *   <li>chainFee: amount * feeMultiplierBps / 10000 for cross-chain settlements</li>
 * </ul>
 */
@Value
@Builder
public class SettlementBreakdown {

    long amount;
    long baseFee;
    long discount;
    long chainFee;
    String feeRecipient;
    TransferReason feeReason;

    public long getFee() {
        return baseFee + chainFee;
    }

    public long getPayout() {
        return amount - getFee();
    }
}
