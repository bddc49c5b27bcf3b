package com.atomicswap.entity;

import com.atomicswap.domain.enums.OrderStage;
import com.atomicswap.domain.enums.OrderStatus;
import com.atomicswap.domain.enums.TimelockMode;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the swap_orders table.
 * The identity column is the order-id sequence; the unique hashlock index backs
 * find-by-hashlock and rejects duplicate commitments. Writes carrying a stale version are
 * rejected, so two settlements of one order can never both commit.
 */
@Entity
@Table(
        name = "swap_orders",
        indexes = {
            @Index(name = "ux_swap_orders_hashlock", columnList = "hashlock", unique = true),
            @Index(name = "ix_swap_orders_status", columnList = "status"),
            @Index(name = "ix_swap_orders_sender", columnList = "sender"),
            @Index(name = "ix_swap_orders_receiver", columnList = "receiver")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SwapOrderEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 128)
    private String sender;

    @Column(nullable = false, length = 128)
    private String receiver;

    @Column(length = 128)
    private String taker;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "swap_order_whitelist", joinColumns = @JoinColumn(name = "order_id"))
    @OrderColumn(name = "position")
    @Column(name = "resolver_address", length = 128)
    @Builder.Default
    private List<String> whitelist = new ArrayList<>();

    @Column(nullable = false, length = 64)
    private String asset;

    @Column(name = "total_amount", nullable = false)
    private long totalAmount;

    @Column(name = "filled_amount", nullable = false)
    private long filledAmount;

    @Column(name = "remaining_amount", nullable = false)
    private long remainingAmount;

    @Column(name = "min_fill_amount", nullable = false)
    private long minFillAmount;

    @Column(name = "partial_fills_allowed", nullable = false)
    private boolean partialFillsAllowed;

    @Column(name = "safety_deposit_amount", nullable = false)
    private long safetyDepositAmount;

    @Column(name = "fee_bps", nullable = false)
    private int feeBps;

    @Column(nullable = false, length = 64, updatable = false)
    private String hashlock;

    @Column(length = 256)
    private String secret;

    @Column(name = "withdrawn_by", length = 128)
    private String withdrawnBy;

    @Column(name = "cancelled_by", length = 128)
    private String cancelledBy;

    @Enumerated(EnumType.STRING)
    @Column(name = "timelock_mode", columnDefinition = "varchar(10)")
    private TimelockMode timelockMode;

    @Column(name = "created_at", nullable = false)
    private long createdAt;

    @Column(name = "expires_at", nullable = false)
    private long expiresAt;

    @Column(name = "finality_at")
    private Long finalityAt;

    @Column(name = "taker_deadline")
    private Long takerDeadline;

    @Column(name = "public_deadline")
    private Long publicDeadline;

    @Column(name = "cancellation_start")
    private Long cancellationStart;

    @Column(name = "public_cancellation_start")
    private Long publicCancellationStart;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(20)")
    private OrderStatus status;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(30)")
    private OrderStage stage;

    @Column(name = "destination_chain_id", length = 64)
    private String destinationChainId;

    @Column(name = "destination_recipient", length = 128)
    private String destinationRecipient;

    @Column(name = "destination_token", length = 64)
    private String destinationToken;

    @Column(name = "sequence_ref")
    private Long sequenceRef;

    @Column(name = "updated_at")
    private long updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;
}
