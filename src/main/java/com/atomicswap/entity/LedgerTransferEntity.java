package com.atomicswap.entity;

import com.atomicswap.domain.enums.TransferReason;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Append-only journal of fund movements handed to the host ledger.
 */
@Entity
@Table(name = "ledger_transfers", indexes = @Index(name = "ix_ledger_transfers_order", columnList = "order_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LedgerTransferEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "order_id", nullable = false)
    private Long orderId;

    @Column(name = "fill_id")
    private Long fillId;

    @Column(nullable = false, length = 128)
    private String recipient;

    @Column(length = 64)
    private String asset;

    private long amount;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(20)")
    private TransferReason reason;

    @Column(name = "created_at")
    private long createdAt;
}
