package com.atomicswap.mapper;

import com.atomicswap.domain.model.ChainConfig;
import com.atomicswap.entity.ChainConfigEntity;
import java.util.List;
import org.mapstruct.Mapper;

@Mapper
public interface ChainConfigMapper {

    ChainConfigEntity toEntity(ChainConfig config);

    ChainConfig toDomain(ChainConfigEntity entity);

    List<ChainConfig> toDomainList(List<ChainConfigEntity> entities);
}
