package com.atomicswap.entity;

import com.atomicswap.domain.enums.SafetyDepositStatus;
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

@Entity
@Table(name = "safety_deposits", indexes = @Index(name = "ix_safety_deposits_order", columnList = "order_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SafetyDepositEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "order_id", nullable = false)
    private Long orderId;

    @Column(nullable = false, length = 128)
    private String depositor;

    private long amount;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)")
    private SafetyDepositStatus status;

    @Column(name = "posted_at")
    private long postedAt;

    @Column(name = "returned_at")
    private Long returnedAt;
}
