package com.atomicswap.support;

import com.atomicswap.domain.enums.OrderStage;
import com.atomicswap.domain.enums.OrderStatus;
import com.atomicswap.domain.enums.TimelockMode;
import com.atomicswap.domain.model.SwapOrder;
import com.atomicswap.htlc.SecretVerifier;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared orders and secrets for engine tests.
 *
 * <p>Staged orders created at {@link #NOW} use boundaries finality +100, taker +200,
 * public +300, cancellation +400, public cancellation +500.
 */
public final class SwapFixtures {

    public static final long NOW = 1_700_000_000L;

    public static final String SENDER = "alice";
    public static final String RECEIVER = "bob";
    public static final String TAKER = "tina";
    public static final String RESOLVER = "rex";
    public static final String STRANGER = "mallory";
    public static final String ASSET = "uatom";

    /** "abc" as hex; SHA-256 of it is the published test vector below. */
    public static final String SECRET = "616263";

    public static final String HASHLOCK = "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad";

    public static final String WRONG_SECRET = "616264";

    private SwapFixtures() {}

    public static String hashlockOf(String secretHex) {
        return new SecretVerifier().hashlockOf(secretHex);
    }

    /** ACTIVE single-timelock order expiring at NOW + 3600. */
    public static SwapOrder singleOrder(Long id) {
        return SwapOrder.builder()
                .id(id)
                .sender(SENDER)
                .receiver(RECEIVER)
                .whitelist(new ArrayList<>())
                .asset(ASSET)
                .totalAmount(1_000_000)
                .filledAmount(0)
                .remainingAmount(1_000_000)
                .minFillAmount(1_000_000)
                .feeBps(50)
                .hashlock(HASHLOCK)
                .timelockMode(TimelockMode.SINGLE)
                .createdAt(NOW)
                .expiresAt(NOW + 3600)
                .status(OrderStatus.ACTIVE)
                .stage(OrderStage.OPEN)
                .updatedAt(NOW)
                .build();
    }

    /** ACTIVE staged order with a taker and one whitelisted resolver. */
    public static SwapOrder stagedOrder(Long id) {
        return SwapOrder.builder()
                .id(id)
                .sender(SENDER)
                .receiver(RECEIVER)
                .taker(TAKER)
                .whitelist(new ArrayList<>(List.of(RESOLVER)))
                .asset(ASSET)
                .totalAmount(1_000_000)
                .filledAmount(0)
                .remainingAmount(1_000_000)
                .minFillAmount(1_000_000)
                .feeBps(50)
                .hashlock(HASHLOCK)
                .timelockMode(TimelockMode.STAGED)
                .createdAt(NOW)
                .finalityAt(NOW + 100)
                .takerDeadline(NOW + 200)
                .publicDeadline(NOW + 300)
                .cancellationStart(NOW + 400)
                .publicCancellationStart(NOW + 500)
                .expiresAt(NOW + 400)
                .status(OrderStatus.ACTIVE)
                .stage(OrderStage.PENDING)
                .updatedAt(NOW)
                .build();
    }

    /** Single-timelock order that accepts partial fills of at least 100_000. */
    public static SwapOrder partialFillOrder(Long id) {
        SwapOrder order = singleOrder(id);
        order.setPartialFillsAllowed(true);
        order.setMinFillAmount(100_000);
        return order;
    }
}
