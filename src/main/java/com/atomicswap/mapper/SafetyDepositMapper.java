package com.atomicswap.mapper;

import com.atomicswap.domain.model.SafetyDeposit;
import com.atomicswap.entity.SafetyDepositEntity;
import java.util.List;
import org.mapstruct.Mapper;

@Mapper
public interface SafetyDepositMapper {

    SafetyDepositEntity toEntity(SafetyDeposit deposit);

    SafetyDeposit toDomain(SafetyDepositEntity entity);

    List<SafetyDeposit> toDomainList(List<SafetyDepositEntity> entities);
}
