package com.atomicswap.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Secret reveal for an order or a fill. {@code caller} is the withdrawing address.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WithdrawRequest {

    @NotBlank(message = "Caller is required")
    private String caller;

    @NotBlank(message = "Secret is required")
    @Size(max = 256, message = "Secret must be 128 bytes or less")
    @Pattern(regexp = "^([0-9a-fA-F]{2})+$", message = "Secret must be hex encoded")
    private String secret;
}
