package com.atomicswap.mapper;

import com.atomicswap.domain.model.ResolverConfig;
import com.atomicswap.entity.ResolverConfigEntity;
import java.util.List;
import org.mapstruct.Mapper;

@Mapper
public interface ResolverConfigMapper {

    ResolverConfigEntity toEntity(ResolverConfig config);

    ResolverConfig toDomain(ResolverConfigEntity entity);

    List<ResolverConfig> toDomainList(List<ResolverConfigEntity> entities);
}
