package com.atomicswap.crosschain;

import com.atomicswap.domain.model.ChainConfig;
import com.atomicswap.entity.ChainConfigEntity;
import com.atomicswap.exception.ResourceNotFoundException;
import com.atomicswap.exception.ValidationException;
import com.atomicswap.mapper.ChainConfigMapper;
import com.atomicswap.repository.jpa.ChainConfigJpaRepository;
import java.util.List;
import java.util.Map;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Destination chains the engine can settle towards, with their channel and fee multiplier.
 */
@Service
public class ChainConfigService {

    private static final Logger log = LoggerFactory.getLogger(ChainConfigService.class);

    /**
     * Chain surcharge ceiling. It does not bound the combined fee on its own: orders whose fee
     * plus surcharge exceeds 10000 bps are rejected by {@link com.atomicswap.htlc.FeeCalculator}.
     */
    public static final int MAX_FEE_MULTIPLIER_BPS = 5_000;

    private final ChainConfigJpaRepository chainConfigJpaRepository;
    private final ChainConfigMapper chainConfigMapper = Mappers.getMapper(ChainConfigMapper.class);

    public ChainConfigService(ChainConfigJpaRepository chainConfigJpaRepository) {
        this.chainConfigJpaRepository = chainConfigJpaRepository;
    }

    @Transactional
    public ChainConfig upsert(ChainConfig config) {
        if (config.getChainId() == null || config.getChainId().isBlank()) {
            throw new ValidationException("Chain id is required");
        }
        if (config.getFeeMultiplierBps() < 0 || config.getFeeMultiplierBps() > MAX_FEE_MULTIPLIER_BPS) {
            throw new ValidationException(
                    "Fee multiplier out of range",
                    Map.of("feeMultiplierBps", config.getFeeMultiplierBps(), "max", MAX_FEE_MULTIPLIER_BPS));
        }
        ChainConfigEntity saved = chainConfigJpaRepository.save(chainConfigMapper.toEntity(config));
        log.info(
                "Chain config saved: chainId={}, channel={}, active={}, feeMultiplierBps={}",
                saved.getChainId(),
                saved.getChannel(),
                saved.isActive(),
                saved.getFeeMultiplierBps());
        return chainConfigMapper.toDomain(saved);
    }

    @Transactional
    public ChainConfig deactivate(String chainId) {
        ChainConfigEntity entity = chainConfigJpaRepository
                .findById(chainId)
                .orElseThrow(() -> new ResourceNotFoundException("Chain", chainId));
        entity.setActive(false);
        log.info("Chain deactivated: chainId={}", chainId);
        return chainConfigMapper.toDomain(chainConfigJpaRepository.save(entity));
    }

    public ChainConfig get(String chainId) {
        return chainConfigJpaRepository
                .findById(chainId)
                .map(chainConfigMapper::toDomain)
                .orElseThrow(() -> new ResourceNotFoundException("Chain", chainId));
    }

    /**
     * Resolves a chain that new settlements may target.
     *
     * @throws ValidationException if the chain is unknown or inactive
     */
    public ChainConfig requireActive(String chainId) {
        ChainConfig config = chainConfigJpaRepository
                .findById(chainId)
                .map(chainConfigMapper::toDomain)
                .orElseThrow(() -> new ValidationException("Unknown destination chain: " + chainId));
        if (!config.isActive()) {
            throw new ValidationException("Destination chain is not active: " + chainId);
        }
        return config;
    }

    public List<ChainConfig> list() {
        return chainConfigMapper.toDomainList(chainConfigJpaRepository.findAll());
    }
}
