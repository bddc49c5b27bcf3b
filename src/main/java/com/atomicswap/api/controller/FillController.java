package com.atomicswap.api.controller;

import com.atomicswap.api.dto.request.CallerRequest;
import com.atomicswap.api.dto.request.CreateFillRequest;
import com.atomicswap.api.dto.request.WithdrawRequest;
import com.atomicswap.domain.model.Fill;
import com.atomicswap.htlc.FillLedger;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Partial fills: commit, withdraw against the secret, refund after expiry.
 */
@RestController
@RequestMapping("/api/fills")
public class FillController {

    private final FillLedger fillLedger;

    public FillController(FillLedger fillLedger) {
        this.fillLedger = fillLedger;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Fill createFill(@RequestBody @Valid CreateFillRequest request) {
        return fillLedger.createFill(
                request.getOrderId(), request.getFiller(), request.getAmount(), request.getHashlock());
    }

    @GetMapping("/{fillId}")
    public Fill getFill(@PathVariable Long fillId) {
        return fillLedger.getFill(fillId);
    }

    @PostMapping("/{fillId}/withdraw")
    public Fill withdrawFill(@PathVariable Long fillId, @RequestBody @Valid WithdrawRequest request) {
        return fillLedger.withdrawFill(fillId, request.getCaller(), request.getSecret());
    }

    @PostMapping("/{fillId}/refund")
    public Fill refundFill(@PathVariable Long fillId, @RequestBody @Valid CallerRequest request) {
        return fillLedger.refundFill(fillId, request.getCaller());
    }
}
