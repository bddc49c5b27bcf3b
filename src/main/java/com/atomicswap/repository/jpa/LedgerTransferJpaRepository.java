package com.atomicswap.repository.jpa;

import com.atomicswap.entity.LedgerTransferEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface LedgerTransferJpaRepository extends JpaRepository<LedgerTransferEntity, Long> {

    List<LedgerTransferEntity> findByOrderIdOrderByIdAsc(Long orderId);
}
