package com.atomicswap.mapper;

import com.atomicswap.domain.model.PendingTransfer;
import com.atomicswap.entity.PendingTransferEntity;
import org.mapstruct.Mapper;

@Mapper
public interface PendingTransferMapper {

    PendingTransferEntity toEntity(PendingTransfer transfer);

    PendingTransfer toDomain(PendingTransferEntity entity);
}
