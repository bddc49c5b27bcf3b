package com.atomicswap.htlc;

import com.atomicswap.config.EngineProperties;
import com.atomicswap.domain.enums.TransferReason;
import com.atomicswap.domain.model.ChainConfig;
import com.atomicswap.domain.model.SwapOrder;
import com.atomicswap.domain.vo.SettlementBreakdown;
import com.atomicswap.exception.ValidationException;
import com.atomicswap.resolver.ResolverRegistry;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Basis-point fee arithmetic for settlements (10000 bps = 100%).
 *
 * <p>All products truncate toward zero and no remainder is redistributed. The fee goes to the
 * settling party, or to the treasury when the receiver settles its own order. An enabled
 * registry resolver may get part of the base fee waived; the chain surcharge is never discounted.
 *
 * <p>The order fee and the chain surcharge together may not exceed 10000 bps. Truncated
 * products never sum above the product of the summed rate, so the fee never exceeds the
 * settled amount and the payout is never negative.
 */
@Component
public class FeeCalculator {

    static final long BPS_DENOMINATOR = 10_000;

    private final EngineProperties engineProperties;
    private final ResolverRegistry resolverRegistry;

    public FeeCalculator(EngineProperties engineProperties, ResolverRegistry resolverRegistry) {
        this.engineProperties = engineProperties;
        this.resolverRegistry = resolverRegistry;
    }

    /**
     * @param chain destination chain for cross-chain settlements, null otherwise
     * @throws ValidationException if the order fee plus the chain surcharge exceeds 10000 bps
     */
    public SettlementBreakdown compute(SwapOrder order, long amount, String settler, ChainConfig chain) {
        checkCombinedFee(order.getFeeBps(), chain);
        long undiscounted = bps(amount, order.getFeeBps());
        boolean settlerIsReceiver = settler.equals(order.getReceiver());

        long discount = 0;
        if (engineProperties.isApplyResolverDiscount() && !settlerIsReceiver) {
            discount = bps(undiscounted, resolverRegistry.feeDiscountBps(settler));
        }
        long chainFee = chain != null ? bps(amount, chain.getFeeMultiplierBps()) : 0;

        return SettlementBreakdown.builder()
                .amount(amount)
                .baseFee(undiscounted - discount)
                .discount(discount)
                .chainFee(chainFee)
                .feeRecipient(settlerIsReceiver ? engineProperties.getTreasuryAddress() : settler)
                .feeReason(settlerIsReceiver ? TransferReason.TREASURY_FEE : TransferReason.RESOLVER_FEE)
                .build();
    }

    /** Rejects fee terms that could take more than the whole amount. */
    static void checkCombinedFee(int feeBps, ChainConfig chain) {
        long surcharge = chain != null ? chain.getFeeMultiplierBps() : 0;
        if (feeBps + surcharge > BPS_DENOMINATOR) {
            throw new ValidationException(
                    "Order fee plus chain surcharge exceeds the settled amount",
                    Map.of("feeBps", feeBps, "feeMultiplierBps", surcharge, "maxBps", BPS_DENOMINATOR));
        }
    }

    static long bps(long amount, long basisPoints) {
        return Math.multiplyExact(amount, basisPoints) / BPS_DENOMINATOR;
    }
}
