package com.atomicswap.mapper;

import com.atomicswap.domain.model.Fill;
import com.atomicswap.entity.FillEntity;
import java.util.List;
import org.mapstruct.Mapper;

@Mapper
public interface FillMapper {

    FillEntity toEntity(Fill fill);

    Fill toDomain(FillEntity entity);

    List<Fill> toDomainList(List<FillEntity> entities);
}
