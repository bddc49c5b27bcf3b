package com.atomicswap.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "resolver_configs")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ResolverConfigEntity {

    @Id
    @Column(length = 128)
    private String address;

    private int priority;

    @Column(name = "fee_discount_bps")
    private int feeDiscountBps;

    private boolean enabled;

    @Column(name = "updated_at")
    private long updatedAt;
}
