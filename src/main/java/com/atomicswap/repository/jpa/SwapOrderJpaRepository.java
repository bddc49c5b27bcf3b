package com.atomicswap.repository.jpa;

import com.atomicswap.domain.enums.OrderStatus;
import com.atomicswap.entity.SwapOrderEntity;
import jakarta.persistence.LockModeType;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the swap_orders table. Open orders are found through the status
 * index rather than a separately maintained active list.
 */
@Repository
public interface SwapOrderJpaRepository extends JpaRepository<SwapOrderEntity, Long> {

    /** Row-locks the order until the surrounding transaction ends. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM SwapOrderEntity o WHERE o.id = :id")
    Optional<SwapOrderEntity> findByIdForUpdate(@Param("id") Long id);

    Optional<SwapOrderEntity> findByHashlock(String hashlock);

    boolean existsByHashlock(String hashlock);

    List<SwapOrderEntity> findByStatusIn(Collection<OrderStatus> statuses);

    Page<SwapOrderEntity> findByStatusIn(Collection<OrderStatus> statuses, Pageable pageable);

    @Query("SELECT o FROM SwapOrderEntity o WHERE o.sender = :address OR o.receiver = :address ORDER BY o.id DESC")
    List<SwapOrderEntity> findByParty(@Param("address") String address);

    long countByStatus(OrderStatus status);

    long countByStatusIn(Collection<OrderStatus> statuses);

    @Query("SELECT COALESCE(SUM(o.totalAmount), 0) FROM SwapOrderEntity o")
    long sumTotalAmount();
}
