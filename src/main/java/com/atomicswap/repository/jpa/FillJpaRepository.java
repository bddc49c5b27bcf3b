package com.atomicswap.repository.jpa;

import com.atomicswap.entity.FillEntity;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface FillJpaRepository extends JpaRepository<FillEntity, Long> {

    List<FillEntity> findByOrderIdOrderByIdAsc(Long orderId);

    @Query("SELECT f.orderId FROM FillEntity f WHERE f.id = :id")
    Optional<Long> findOrderIdById(@Param("id") Long id);
}
