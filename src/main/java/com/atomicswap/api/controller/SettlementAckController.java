package com.atomicswap.api.controller;

import com.atomicswap.api.dto.request.AckRequest;
import com.atomicswap.domain.enums.AckOutcome;
import com.atomicswap.exception.ValidationException;
import com.atomicswap.htlc.AckResult;
import com.atomicswap.htlc.AcknowledgementHandler;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Callback for the cross-chain messaging layer. Redeliveries answer 200 with
 * {@code applied=false} so relayers stop retrying.
 */
@RestController
@RequestMapping("/api/settlements")
public class SettlementAckController {

    private final AcknowledgementHandler acknowledgementHandler;

    public SettlementAckController(AcknowledgementHandler acknowledgementHandler) {
        this.acknowledgementHandler = acknowledgementHandler;
    }

    @PostMapping("/ack")
    public AckResult acknowledge(@RequestBody @Valid AckRequest request) {
        return acknowledgementHandler.acknowledge(request.getSequence(), resolveOutcome(request));
    }

    private AckOutcome resolveOutcome(AckRequest request) {
        if (request.getOutcome() != null) {
            return request.getOutcome();
        }
        if (request.getSuccess() != null) {
            return request.getSuccess() ? AckOutcome.SUCCESS : AckOutcome.FAILURE;
        }
        throw new ValidationException("Either outcome or success is required");
    }
}
