package com.atomicswap.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the pending_transfers table. The identity column doubles as the packet
 * sequence handed to the messaging layer; rows are deleted once acknowledged.
 */
@Entity
@Table(name = "pending_transfers")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PendingTransferEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long sequence;

    @Column(name = "order_id", nullable = false, unique = true)
    private Long orderId;

    @Column(name = "destination_chain_id", length = 64)
    private String destinationChainId;

    @Column(length = 100)
    private String channel;

    @Column(name = "destination_recipient", length = 128)
    private String destinationRecipient;

    @Column(name = "destination_token", length = 64)
    private String destinationToken;

    private long amount;

    private long payout;

    private long fee;

    @Column(name = "fee_recipient", length = 128)
    private String feeRecipient;

    @Column(length = 128)
    private String settler;

    @Column(name = "initiated_at")
    private long initiatedAt;

    @Column(name = "timeout_at")
    private long timeoutAt;
}
