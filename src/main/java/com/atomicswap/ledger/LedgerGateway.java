package com.atomicswap.ledger;

import com.atomicswap.domain.model.TransferInstruction;
import java.util.List;

/**
 * Fund movement port towards the host ledger. The engine never moves funds itself; every
 * payout, fee, refund and deposit return is handed to this interface after all checks of
 * the enclosing operation have passed.
 *
 * <p>Implementations must participate in the caller's transaction or be idempotent on
 * {@code (orderId, fillId, reason, recipient)}: a rollback after {@link #transfer} must not
 * leave a half-settled order.
 */
public interface LedgerGateway {

    /**
     * Records a transfer out of escrow.
     *
     * @throws com.atomicswap.exception.LedgerException if the host ledger rejects the transfer
     */
    TransferInstruction transfer(TransferInstruction instruction);

    /** Transfers emitted for an order, oldest first. */
    List<TransferInstruction> transfersForOrder(Long orderId);
}
