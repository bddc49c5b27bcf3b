package com.atomicswap.domain.model;

import com.atomicswap.domain.enums.TransferReason;
import lombok.Builder;
import lombok.Data;

/**
 * A fund movement the engine asks the host ledger to perform.
 */
@Data
@Builder
public class TransferInstruction {

    private Long id;
    private Long orderId;
    private Long fillId;
    private String recipient;
    private String asset;
    private long amount;
    private TransferReason reason;
    private long createdAt;
}
