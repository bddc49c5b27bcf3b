package com.atomicswap.api.controller;

import com.atomicswap.api.dto.request.ResolverConfigRequest;
import com.atomicswap.domain.model.ResolverConfig;
import com.atomicswap.resolver.ResolverRegistry;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Administration of the global resolver registry.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/resolvers -- registrations by priority, highest first</li>
 *   <li>GET /api/resolvers/{address}</li>
 *   <li>PUT /api/resolvers/{address} -- register or replace</li>
 *   <li>PUT /api/resolvers/{address}/enabled?value= -- toggle authorization</li>
 *   <li>DELETE /api/resolvers/{address}</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/resolvers")
public class ResolverController {

    private final ResolverRegistry resolverRegistry;

    public ResolverController(ResolverRegistry resolverRegistry) {
        this.resolverRegistry = resolverRegistry;
    }

    @GetMapping
    public List<ResolverConfig> list() {
        return resolverRegistry.listByPriority();
    }

    @GetMapping("/{address}")
    public ResolverConfig get(@PathVariable String address) {
        return resolverRegistry.get(address);
    }

    @PutMapping("/{address}")
    public ResolverConfig register(@PathVariable String address, @RequestBody @Valid ResolverConfigRequest request) {
        return resolverRegistry.register(ResolverConfig.builder()
                .address(address)
                .priority(request.getPriority())
                .feeDiscountBps(request.getFeeDiscountBps())
                .enabled(request.getEnabled() == null || request.getEnabled())
                .build());
    }

    @PutMapping("/{address}/enabled")
    public ResolverConfig setEnabled(@PathVariable String address, @RequestParam boolean value) {
        return resolverRegistry.setEnabled(address, value);
    }

    @DeleteMapping("/{address}")
    public Map<String, String> remove(@PathVariable String address) {
        resolverRegistry.remove(address);
        return Map.of("message", "Resolver removed");
    }
}
