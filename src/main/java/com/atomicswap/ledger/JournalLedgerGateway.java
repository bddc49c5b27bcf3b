package com.atomicswap.ledger;

import com.atomicswap.domain.model.TransferInstruction;
import com.atomicswap.entity.LedgerTransferEntity;
import com.atomicswap.exception.LedgerException;
import com.atomicswap.mapper.TransferInstructionMapper;
import com.atomicswap.repository.jpa.LedgerTransferJpaRepository;
import java.util.List;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Default {@link LedgerGateway}: journals each instruction to ledger_transfers in the same
 * transaction as the order change, for a host adapter to drain into its native asset system.
 */
@Service
public class JournalLedgerGateway implements LedgerGateway {

    private static final Logger log = LoggerFactory.getLogger(JournalLedgerGateway.class);

    private final LedgerTransferJpaRepository ledgerTransferJpaRepository;
    private final TransferInstructionMapper transferInstructionMapper =
            Mappers.getMapper(TransferInstructionMapper.class);

    public JournalLedgerGateway(LedgerTransferJpaRepository ledgerTransferJpaRepository) {
        this.ledgerTransferJpaRepository = ledgerTransferJpaRepository;
    }

    @Override
    public TransferInstruction transfer(TransferInstruction instruction) {
        if (instruction.getAmount() <= 0) {
            throw new LedgerException("Transfer amount must be positive: " + instruction.getAmount());
        }
        if (instruction.getRecipient() == null || instruction.getRecipient().isBlank()) {
            throw new LedgerException("Transfer recipient is required");
        }
        LedgerTransferEntity saved = ledgerTransferJpaRepository.save(transferInstructionMapper.toEntity(instruction));
        log.info(
                "Transfer journaled: id={}, orderId={}, fillId={}, reason={}, recipient={}, amount={} {}",
                saved.getId(),
                saved.getOrderId(),
                saved.getFillId(),
                saved.getReason(),
                saved.getRecipient(),
                saved.getAmount(),
                saved.getAsset());
        return transferInstructionMapper.toDomain(saved);
    }

    @Override
    public List<TransferInstruction> transfersForOrder(Long orderId) {
        return transferInstructionMapper.toDomainList(ledgerTransferJpaRepository.findByOrderIdOrderByIdAsc(orderId));
    }
}
