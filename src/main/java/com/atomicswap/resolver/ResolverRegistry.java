package com.atomicswap.resolver;

import com.atomicswap.domain.model.ResolverConfig;
import com.atomicswap.entity.ResolverConfigEntity;
import com.atomicswap.exception.ResourceNotFoundException;
import com.atomicswap.exception.ValidationException;
import com.atomicswap.mapper.ResolverConfigMapper;
import com.atomicswap.repository.jpa.ResolverConfigJpaRepository;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Global registry of settlement agents, separate from each order's inline whitelist.
 *
 * <p>Every privileged-stage authorization check reads from here, so lookups go through a
 * Caffeine cache (absent addresses are cached too). Administrative writes evict the entry
 * so the next check sees the new enabled flag.
 */
@Service
public class ResolverRegistry {

    private static final Logger log = LoggerFactory.getLogger(ResolverRegistry.class);

    private final ResolverConfigJpaRepository resolverConfigJpaRepository;
    private final ResolverConfigMapper resolverConfigMapper = Mappers.getMapper(ResolverConfigMapper.class);
    private final Clock clock;

    /** address → registration, 5 min TTL as a bound on staleness if the table is edited out of band. */
    private final Cache<String, Optional<ResolverConfig>> configCache;

    public ResolverRegistry(ResolverConfigJpaRepository resolverConfigJpaRepository, Clock clock) {
        this.resolverConfigJpaRepository = resolverConfigJpaRepository;
        this.clock = clock;
        this.configCache = Caffeine.newBuilder()
                .expireAfterWrite(5, TimeUnit.MINUTES)
                .maximumSize(10_000)
                .build();
    }

    /**
     * Creates or replaces the registration for {@code config.address}.
     */
    @Transactional
    public ResolverConfig register(ResolverConfig config) {
        if (config.getAddress() == null || config.getAddress().isBlank()) {
            throw new ValidationException("Resolver address is required");
        }
        if (config.getFeeDiscountBps() < 0 || config.getFeeDiscountBps() > 10_000) {
            throw new ValidationException("Fee discount must be between 0 and 10000 bps");
        }
        config.setUpdatedAt(clock.instant().getEpochSecond());
        ResolverConfigEntity saved = resolverConfigJpaRepository.save(resolverConfigMapper.toEntity(config));
        configCache.invalidate(config.getAddress());
        log.info(
                "Resolver registered: address={}, priority={}, feeDiscountBps={}, enabled={}",
                config.getAddress(),
                config.getPriority(),
                config.getFeeDiscountBps(),
                config.isEnabled());
        return resolverConfigMapper.toDomain(saved);
    }

    @Transactional
    public ResolverConfig setEnabled(String address, boolean enabled) {
        ResolverConfigEntity entity = resolverConfigJpaRepository
                .findById(address)
                .orElseThrow(() -> new ResourceNotFoundException("Resolver", address));
        entity.setEnabled(enabled);
        entity.setUpdatedAt(clock.instant().getEpochSecond());
        ResolverConfigEntity saved = resolverConfigJpaRepository.save(entity);
        configCache.invalidate(address);
        log.info("Resolver {}: address={}", enabled ? "enabled" : "disabled", address);
        return resolverConfigMapper.toDomain(saved);
    }

    @Transactional
    public void remove(String address) {
        if (!resolverConfigJpaRepository.existsById(address)) {
            throw new ResourceNotFoundException("Resolver", address);
        }
        resolverConfigJpaRepository.deleteById(address);
        configCache.invalidate(address);
        log.info("Resolver removed: address={}", address);
    }

    public Optional<ResolverConfig> find(String address) {
        if (address == null) {
            return Optional.empty();
        }
        return configCache.get(
                address, key -> resolverConfigJpaRepository.findById(key).map(resolverConfigMapper::toDomain));
    }

    public ResolverConfig get(String address) {
        return find(address).orElseThrow(() -> new ResourceNotFoundException("Resolver", address));
    }

    /** Registrations ordered by priority, highest first. */
    public List<ResolverConfig> listByPriority() {
        return resolverConfigMapper.toDomainList(resolverConfigJpaRepository.findAllByOrderByPriorityDescAddressAsc());
    }

    public boolean isEnabled(String address) {
        return find(address).map(ResolverConfig::isEnabled).orElse(false);
    }

    /** Discount applicable to {@code address}; zero unless it is an enabled resolver. */
    public int feeDiscountBps(String address) {
        return find(address).filter(ResolverConfig::isEnabled).map(ResolverConfig::getFeeDiscountBps).orElse(0);
    }
}
