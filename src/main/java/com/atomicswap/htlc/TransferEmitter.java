package com.atomicswap.htlc;

import com.atomicswap.domain.enums.TransferReason;
import com.atomicswap.domain.model.SwapOrder;
import com.atomicswap.domain.model.TransferInstruction;
import com.atomicswap.exception.LedgerException;
import com.atomicswap.ledger.LedgerGateway;
import java.time.Clock;
import org.springframework.stereotype.Component;

/**
 * Builds transfer instructions for an order and hands them to the {@link LedgerGateway}.
 * Zero amounts are dropped: truncated fees can round to nothing. A negative amount is a
 * bookkeeping fault and fails the whole operation.
 */
@Component
public class TransferEmitter {

    private final LedgerGateway ledgerGateway;
    private final Clock clock;

    public TransferEmitter(LedgerGateway ledgerGateway, Clock clock) {
        this.ledgerGateway = ledgerGateway;
        this.clock = clock;
    }

    public void emit(SwapOrder order, Long fillId, String recipient, long amount, TransferReason reason) {
        if (amount < 0) {
            throw new LedgerException(String.format(
                    "Negative %s transfer of %d for order %d to %s", reason, amount, order.getId(), recipient));
        }
        if (amount == 0) {
            return;
        }
        ledgerGateway.transfer(TransferInstruction.builder()
                .orderId(order.getId())
                .fillId(fillId)
                .recipient(recipient)
                .asset(order.getAsset())
                .amount(amount)
                .reason(reason)
                .createdAt(clock.instant().getEpochSecond())
                .build());
    }
}
