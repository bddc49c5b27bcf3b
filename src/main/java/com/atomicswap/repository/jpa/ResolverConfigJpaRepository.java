package com.atomicswap.repository.jpa;

import com.atomicswap.entity.ResolverConfigEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ResolverConfigJpaRepository extends JpaRepository<ResolverConfigEntity, String> {

    List<ResolverConfigEntity> findAllByOrderByPriorityDescAddressAsc();
}
