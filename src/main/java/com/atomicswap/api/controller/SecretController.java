package com.atomicswap.api.controller;

import com.atomicswap.api.dto.request.VerifySecretRequest;
import com.atomicswap.htlc.SecretVerifier;
import jakarta.validation.Valid;
import java.util.Map;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Side-effect-free preimage check, for clients validating a secret before revealing it. */
@RestController
@RequestMapping("/api/secrets")
public class SecretController {

    private final SecretVerifier secretVerifier;

    public SecretController(SecretVerifier secretVerifier) {
        this.secretVerifier = secretVerifier;
    }

    @PostMapping("/verify")
    public Map<String, Boolean> verify(@RequestBody @Valid VerifySecretRequest request) {
        return Map.of("valid", secretVerifier.verify(request.getSecret(), request.getHashlock()));
    }
}
