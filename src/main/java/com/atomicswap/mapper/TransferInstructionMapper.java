package com.atomicswap.mapper;

import com.atomicswap.domain.model.TransferInstruction;
import com.atomicswap.entity.LedgerTransferEntity;
import java.util.List;
import org.mapstruct.Mapper;

/**
 * Maps transfer instructions onto the ledger_transfers journal.
 */
@Mapper
public interface TransferInstructionMapper {

    LedgerTransferEntity toEntity(TransferInstruction instruction);

    TransferInstruction toDomain(LedgerTransferEntity entity);

    List<TransferInstruction> toDomainList(List<LedgerTransferEntity> entities);
}
