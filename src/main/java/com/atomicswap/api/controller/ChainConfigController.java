package com.atomicswap.api.controller;

import com.atomicswap.api.dto.request.ChainConfigRequest;
import com.atomicswap.crosschain.ChainConfigService;
import com.atomicswap.domain.model.ChainConfig;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/chains")
public class ChainConfigController {

    private final ChainConfigService chainConfigService;

    public ChainConfigController(ChainConfigService chainConfigService) {
        this.chainConfigService = chainConfigService;
    }

    @GetMapping
    public List<ChainConfig> list() {
        return chainConfigService.list();
    }

    @GetMapping("/{chainId}")
    public ChainConfig get(@PathVariable String chainId) {
        return chainConfigService.get(chainId);
    }

    @PutMapping("/{chainId}")
    public ChainConfig upsert(@PathVariable String chainId, @RequestBody @Valid ChainConfigRequest request) {
        return chainConfigService.upsert(ChainConfig.builder()
                .chainId(chainId)
                .name(request.getName())
                .channel(request.getChannel())
                .active(request.getActive() == null || request.getActive())
                .feeMultiplierBps(request.getFeeMultiplierBps())
                .build());
    }

    /** Deactivates rather than deletes: orders already targeting the chain keep their reference. */
    @DeleteMapping("/{chainId}")
    public ChainConfig deactivate(@PathVariable String chainId) {
        return chainConfigService.deactivate(chainId);
    }
}
