package com.atomicswap.entity;

import com.atomicswap.domain.enums.FillStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the swap_fills table (1 order → N fills).
 */
@Entity
@Table(name = "swap_fills", indexes = @Index(name = "ix_swap_fills_order", columnList = "order_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FillEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "order_id", nullable = false)
    private Long orderId;

    @Column(nullable = false, length = 128)
    private String filler;

    @Column(nullable = false)
    private long amount;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(20)")
    private FillStatus status;

    @Column(length = 64)
    private String hashlock;

    @Column(length = 256)
    private String secret;

    @Column(name = "created_at", nullable = false)
    private long createdAt;

    @Column(name = "settled_at")
    private Long settledAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;
}
