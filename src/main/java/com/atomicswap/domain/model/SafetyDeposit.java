package com.atomicswap.domain.model;

import com.atomicswap.domain.enums.SafetyDepositStatus;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class SafetyDeposit {

    private Long id;
    private Long orderId;
    private String depositor;
    private long amount;
    private SafetyDepositStatus status;
    private long postedAt;
    private Long returnedAt;
}
