package com.atomicswap.repository.jpa;

import com.atomicswap.entity.ChainConfigEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ChainConfigJpaRepository extends JpaRepository<ChainConfigEntity, String> {

    List<ChainConfigEntity> findByActiveTrue();
}
