package com.atomicswap.domain.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ChainConfig {

    private String chainId;
    private String name;

    /** Messaging channel towards this chain (IBC channel, bridge route). */
    private String channel;

    private boolean active;

    /** Additional fee charged on settlements bound for this chain, in basis points. */
    private int feeMultiplierBps;
}
