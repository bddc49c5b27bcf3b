package com.atomicswap.mapper;

import com.atomicswap.domain.model.SwapOrder;
import com.atomicswap.entity.SwapOrderEntity;
import java.util.List;
import org.mapstruct.Mapper;

/**
 * MapStruct mapper between the SwapOrder domain model and SwapOrderEntity.
 * Field names match one-to-one; the whitelist list is copied.
 */
@Mapper
public interface SwapOrderMapper {

    SwapOrderEntity toEntity(SwapOrder order);

    SwapOrder toDomain(SwapOrderEntity entity);

    List<SwapOrder> toDomainList(List<SwapOrderEntity> entities);
}
