package com.atomicswap.unit.crosschain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.atomicswap.crosschain.ChainConfigService;
import com.atomicswap.domain.model.ChainConfig;
import com.atomicswap.exception.ResourceNotFoundException;
import com.atomicswap.exception.ValidationException;
import com.atomicswap.support.InMemoryRepositories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ChainConfigServiceTest {

    private ChainConfigService chainConfigService;

    @BeforeEach
    void setUp() {
        chainConfigService = new ChainConfigService(new InMemoryRepositories().chainConfigJpaRepository);
    }

    private ChainConfig osmosis(int multiplier) {
        return ChainConfig.builder()
                .chainId("osmosis-1")
                .name("Osmosis")
                .channel("channel-0")
                .active(true)
                .feeMultiplierBps(multiplier)
                .build();
    }

    @Test
    @DisplayName("Upserted chain is active for new settlements")
    void upsertAndRequireActive() {
        chainConfigService.upsert(osmosis(10));

        ChainConfig chain = chainConfigService.requireActive("osmosis-1");

        assertThat(chain.getChannel()).isEqualTo("channel-0");
        assertThat(chain.getFeeMultiplierBps()).isEqualTo(10);
        assertThat(chainConfigService.list()).hasSize(1);
    }

    @Test
    @DisplayName("Upsert replaces an existing chain")
    void upsertReplaces() {
        chainConfigService.upsert(osmosis(10));
        chainConfigService.upsert(osmosis(25));

        assertThat(chainConfigService.get("osmosis-1").getFeeMultiplierBps()).isEqualTo(25);
        assertThat(chainConfigService.list()).hasSize(1);
    }

    @Test
    @DisplayName("Multiplier above the ceiling is rejected")
    void rejectsLargeMultiplier() {
        assertThatThrownBy(() -> chainConfigService.upsert(osmosis(ChainConfigService.MAX_FEE_MULTIPLIER_BPS + 1)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Deactivated chain is kept but refused for new settlements")
    void deactivate() {
        chainConfigService.upsert(osmosis(10));

        chainConfigService.deactivate("osmosis-1");

        assertThat(chainConfigService.get("osmosis-1").isActive()).isFalse();
        assertThatThrownBy(() -> chainConfigService.requireActive("osmosis-1"))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Unknown chain is a validation error when targeted and NOT_FOUND when read")
    void unknownChain() {
        assertThatThrownBy(() -> chainConfigService.requireActive("juno-1")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> chainConfigService.get("juno-1")).isInstanceOf(ResourceNotFoundException.class);
        assertThatThrownBy(() -> chainConfigService.deactivate("juno-1"))
                .isInstanceOf(ResourceNotFoundException.class);
    }
}
