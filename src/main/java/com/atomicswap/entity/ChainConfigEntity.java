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
@Table(name = "chain_configs")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChainConfigEntity {

    @Id
    @Column(name = "chain_id", length = 64)
    private String chainId;

    @Column(length = 100)
    private String name;

    @Column(length = 100)
    private String channel;

    private boolean active;

    @Column(name = "fee_multiplier_bps")
    private int feeMultiplierBps;
}
