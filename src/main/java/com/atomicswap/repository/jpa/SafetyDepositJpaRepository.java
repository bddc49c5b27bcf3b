package com.atomicswap.repository.jpa;

import com.atomicswap.domain.enums.SafetyDepositStatus;
import com.atomicswap.entity.SafetyDepositEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SafetyDepositJpaRepository extends JpaRepository<SafetyDepositEntity, Long> {

    List<SafetyDepositEntity> findByOrderId(Long orderId);

    List<SafetyDepositEntity> findByOrderIdAndStatus(Long orderId, SafetyDepositStatus status);

    boolean existsByOrderIdAndDepositorAndStatus(Long orderId, String depositor, SafetyDepositStatus status);
}
