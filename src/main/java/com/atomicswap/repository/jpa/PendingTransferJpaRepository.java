package com.atomicswap.repository.jpa;

import com.atomicswap.entity.PendingTransferEntity;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Keyed by packet sequence. A missing row means the sequence was never issued or has
 * already been acknowledged.
 */
@Repository
public interface PendingTransferJpaRepository extends JpaRepository<PendingTransferEntity, Long> {

    Optional<PendingTransferEntity> findByOrderId(Long orderId);

    List<PendingTransferEntity> findByTimeoutAtLessThanEqualOrderBySequenceAsc(long timeoutAt);
}
