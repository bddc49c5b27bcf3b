package com.atomicswap.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VerifySecretRequest {

    @NotBlank(message = "Secret is required")
    private String secret;

    @NotBlank(message = "Hashlock is required")
    private String hashlock;
}
