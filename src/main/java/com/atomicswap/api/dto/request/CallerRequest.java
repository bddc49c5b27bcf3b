package com.atomicswap.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Body for cancel and fill refund: only the acting address. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CallerRequest {

    @NotBlank(message = "Caller is required")
    private String caller;
}
