package com.atomicswap.api.controller;

import com.atomicswap.api.dto.request.CallerRequest;
import com.atomicswap.api.dto.request.CreateOrderRequest;
import com.atomicswap.api.dto.request.SafetyDepositRequest;
import com.atomicswap.api.dto.request.StageDurationsRequest;
import com.atomicswap.api.dto.request.WithdrawRequest;
import com.atomicswap.domain.model.EngineStats;
import com.atomicswap.domain.model.Fill;
import com.atomicswap.domain.model.SafetyDeposit;
import com.atomicswap.domain.model.SwapOrder;
import com.atomicswap.domain.model.TransferInstruction;
import com.atomicswap.domain.vo.StageDurations;
import com.atomicswap.exception.ResourceNotFoundException;
import com.atomicswap.exception.ValidationException;
import com.atomicswap.htlc.CancellationHandler;
import com.atomicswap.htlc.CreateOrderCommand;
import com.atomicswap.htlc.FillLedger;
import com.atomicswap.htlc.OrderStore;
import com.atomicswap.htlc.SafetyDepositService;
import com.atomicswap.htlc.SettlementExecutor;
import com.atomicswap.htlc.SettlementResult;
import com.atomicswap.ledger.LedgerGateway;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for swap orders: creation, settlement, cancellation and queries.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/orders -- create an order</li>
 *   <li>GET /api/orders -- open orders, paged by id</li>
 *   <li>GET /api/orders/{id} -- order with its stage refreshed</li>
 *   <li>GET /api/orders/by-party/{address} -- orders sent or received by an address</li>
 *   <li>GET /api/orders/by-hashlock/{hashlock} -- order id committed to a hashlock</li>
 *   <li>GET /api/orders/{id}/fills, /transfers, /safety-deposits</li>
 *   <li>GET /api/orders/{id}/can-withdraw, /can-cancel</li>
 *   <li>POST /api/orders/{id}/withdraw, /cancel, /safety-deposits</li>
 *   <li>GET /api/orders/stats</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/orders")
public class OrderController {

    private final OrderStore orderStore;
    private final SettlementExecutor settlementExecutor;
    private final CancellationHandler cancellationHandler;
    private final FillLedger fillLedger;
    private final SafetyDepositService safetyDepositService;
    private final LedgerGateway ledgerGateway;

    public OrderController(
            OrderStore orderStore,
            SettlementExecutor settlementExecutor,
            CancellationHandler cancellationHandler,
            FillLedger fillLedger,
            SafetyDepositService safetyDepositService,
            LedgerGateway ledgerGateway) {
        this.orderStore = orderStore;
        this.settlementExecutor = settlementExecutor;
        this.cancellationHandler = cancellationHandler;
        this.fillLedger = fillLedger;
        this.safetyDepositService = safetyDepositService;
        this.ledgerGateway = ledgerGateway;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public SwapOrder createOrder(@RequestBody @Valid CreateOrderRequest request) {
        return orderStore.createOrder(toCommand(request));
    }

    @GetMapping
    public List<SwapOrder> openOrders(
            @RequestParam(defaultValue = "0") int page, @RequestParam(defaultValue = "50") int size) {
        if (page < 0 || size < 1 || size > 500) {
            throw new ValidationException("page must be >= 0 and size between 1 and 500");
        }
        return orderStore.openOrders(page, size);
    }

    @GetMapping("/stats")
    public EngineStats stats() {
        return orderStore.stats();
    }

    @GetMapping("/{orderId}")
    public SwapOrder getOrder(@PathVariable Long orderId) {
        return orderStore.load(orderId);
    }

    @GetMapping("/by-party/{address}")
    public List<SwapOrder> ordersByParty(@PathVariable String address) {
        return orderStore.ordersByParty(address);
    }

    @GetMapping("/by-hashlock/{hashlock}")
    public Map<String, Long> findByHashlock(@PathVariable String hashlock) {
        Long orderId = orderStore
                .findIdByHashlock(hashlock)
                .orElseThrow(() -> new ResourceNotFoundException("Order with hashlock", hashlock));
        return Map.of("orderId", orderId);
    }

    @GetMapping("/{orderId}/fills")
    public List<Fill> getFills(@PathVariable Long orderId) {
        orderStore.load(orderId);
        return fillLedger.getFills(orderId);
    }

    @GetMapping("/{orderId}/transfers")
    public List<TransferInstruction> getTransfers(@PathVariable Long orderId) {
        orderStore.load(orderId);
        return ledgerGateway.transfersForOrder(orderId);
    }

    @GetMapping("/{orderId}/can-withdraw")
    public Map<String, Boolean> canWithdraw(@PathVariable Long orderId, @RequestParam String address) {
        return Map.of("allowed", settlementExecutor.canWithdraw(orderId, address));
    }

    @GetMapping("/{orderId}/can-cancel")
    public Map<String, Boolean> canCancel(
            @PathVariable Long orderId, @RequestParam(required = false) String address) {
        boolean allowed = address != null
                ? cancellationHandler.canCancel(orderId, address)
                : cancellationHandler.canCancel(orderId);
        return Map.of("allowed", allowed);
    }

    @PostMapping("/{orderId}/withdraw")
    public SettlementResult withdraw(@PathVariable Long orderId, @RequestBody @Valid WithdrawRequest request) {
        return settlementExecutor.withdraw(orderId, request.getCaller(), request.getSecret());
    }

    @PostMapping("/{orderId}/cancel")
    public SwapOrder cancel(@PathVariable Long orderId, @RequestBody @Valid CallerRequest request) {
        return cancellationHandler.cancel(orderId, request.getCaller());
    }

    @PostMapping("/{orderId}/safety-deposits")
    @ResponseStatus(HttpStatus.CREATED)
    public SafetyDeposit postSafetyDeposit(
            @PathVariable Long orderId, @RequestBody @Valid SafetyDepositRequest request) {
        return safetyDepositService.post(orderId, request.getDepositor(), request.getAmount());
    }

    @GetMapping("/{orderId}/safety-deposits")
    public List<SafetyDeposit> getSafetyDeposits(@PathVariable Long orderId) {
        orderStore.load(orderId);
        return safetyDepositService.depositsForOrder(orderId);
    }

    private CreateOrderCommand toCommand(CreateOrderRequest request) {
        StageDurationsRequest durations = request.getStageDurations();
        return CreateOrderCommand.builder()
                .sender(request.getSender())
                .receiver(request.getReceiver())
                .taker(request.getTaker())
                .whitelist(request.getWhitelist())
                .asset(request.getAsset())
                .amount(request.getAmount())
                .minFillAmount(request.getMinFillAmount())
                .partialFills(request.isPartialFills())
                .hashlock(request.getHashlock())
                .timelockSeconds(request.getTimelockSeconds())
                .stageDurations(
                        durations == null
                                ? null
                                : StageDurations.builder()
                                        .finalityDelay(durations.getFinalityDelay())
                                        .takerExclusiveDuration(durations.getTakerExclusiveDuration())
                                        .privateResolverDuration(durations.getPrivateResolverDuration())
                                        .publicResolverDuration(durations.getPublicResolverDuration())
                                        .privateCancellationDuration(durations.getPrivateCancellationDuration())
                                        .build())
                .safetyDepositAmount(request.getSafetyDepositAmount())
                .requireSafetyDeposit(request.isRequireSafetyDeposit())
                .feeBps(request.getFeeBps())
                .destinationChainId(request.getDestinationChainId())
                .destinationRecipient(request.getDestinationRecipient())
                .destinationToken(request.getDestinationToken())
                .build();
    }
}
