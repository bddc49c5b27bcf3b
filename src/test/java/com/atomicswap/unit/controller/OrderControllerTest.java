package com.atomicswap.unit.controller;

import static com.atomicswap.support.SwapFixtures.HASHLOCK;
import static com.atomicswap.support.SwapFixtures.SECRET;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.atomicswap.api.controller.OrderController;
import com.atomicswap.domain.enums.OrderStage;
import com.atomicswap.domain.enums.OrderStatus;
import com.atomicswap.domain.model.SwapOrder;
import com.atomicswap.entity.SwapOrderEntity;
import com.atomicswap.domain.vo.SettlementBreakdown;
import com.atomicswap.exception.GlobalExceptionHandler;
import com.atomicswap.exception.InvalidSecretException;
import com.atomicswap.exception.OrderStateException;
import com.atomicswap.exception.ResourceNotFoundException;
import com.atomicswap.exception.StageAuthorizationException;
import com.atomicswap.exception.ValidationException;
import com.atomicswap.htlc.CancellationHandler;
import com.atomicswap.htlc.CreateOrderCommand;
import com.atomicswap.htlc.FillLedger;
import com.atomicswap.htlc.OrderStore;
import com.atomicswap.htlc.SafetyDepositService;
import com.atomicswap.htlc.SettlementExecutor;
import com.atomicswap.htlc.SettlementResult;
import com.atomicswap.ledger.LedgerGateway;
import com.atomicswap.support.SwapFixtures;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.MediaType;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Unit tests for OrderController.
 *
 * <p>Verifies: create (201) and request validation, lookups, withdraw and cancel error
 * mapping onto the error envelope.
 */
class OrderControllerTest {

    private MockMvc mockMvc;

    @Mock
    private OrderStore orderStore;

    @Mock
    private SettlementExecutor settlementExecutor;

    @Mock
    private CancellationHandler cancellationHandler;

    @Mock
    private FillLedger fillLedger;

    @Mock
    private SafetyDepositService safetyDepositService;

    @Mock
    private LedgerGateway ledgerGateway;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        OrderController controller = new OrderController(
                orderStore, settlementExecutor, cancellationHandler, fillLedger, safetyDepositService, ledgerGateway);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void createOrder_returns201() throws Exception {
        when(orderStore.createOrder(any())).thenReturn(SwapFixtures.singleOrder(1L));

        mockMvc.perform(post("/api/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"sender":"alice","receiver":"bob","asset":"uatom","amount":1000000,
                         "hashlock":"%s","timelockSeconds":3600}
                        """.formatted(HASHLOCK)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(1))
                .andExpect(jsonPath("$.status").value("ACTIVE"))
                .andExpect(jsonPath("$.stage").value("OPEN"));

        ArgumentCaptor<CreateOrderCommand> command = ArgumentCaptor.forClass(CreateOrderCommand.class);
        verify(orderStore).createOrder(command.capture());
        assertThat(command.getValue().getAmount()).isEqualTo(1_000_000);
        assertThat(command.getValue().getTimelockSeconds()).isEqualTo(3600L);
        assertThat(command.getValue().getStageDurations()).isNull();
    }

    @Test
    void createOrder_stagedDurationsPassedThrough() throws Exception {
        when(orderStore.createOrder(any())).thenReturn(SwapFixtures.stagedOrder(1L));

        mockMvc.perform(post("/api/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"sender":"alice","receiver":"bob","taker":"tina","asset":"uatom","amount":1000000,
                         "hashlock":"%s","stageDurations":{"finalityDelay":600,"takerExclusiveDuration":600,
                         "privateResolverDuration":600,"publicResolverDuration":1800,
                         "privateCancellationDuration":600}}
                        """.formatted(HASHLOCK)))
                .andExpect(status().isCreated());

        ArgumentCaptor<CreateOrderCommand> command = ArgumentCaptor.forClass(CreateOrderCommand.class);
        verify(orderStore).createOrder(command.capture());
        assertThat(command.getValue().getStageDurations().getPublicResolverDuration()).isEqualTo(1800L);
        assertThat(command.getValue().getTaker()).isEqualTo("tina");
    }

    @Test
    void createOrder_missingAmount_returns400() throws Exception {
        mockMvc.perform(post("/api/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"sender":"alice","receiver":"bob","asset":"uatom","hashlock":"%s","timelockSeconds":3600}
                        """.formatted(HASHLOCK)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error.details.amount").exists());
        verifyNoInteractions(orderStore);
    }

    @Test
    void createOrder_shortHashlock_returns400() throws Exception {
        mockMvc.perform(post("/api/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"sender":"alice","receiver":"bob","asset":"uatom","amount":10,"hashlock":"abcd","timelockSeconds":3600}
                        """))
                .andExpect(status().isBadRequest());
    }

    @Test
    void createOrder_malformedJson_returns400() throws Exception {
        mockMvc.perform(post("/api/orders").contentType(MediaType.APPLICATION_JSON).content("{\"sender\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("BAD_REQUEST"));
    }

    @Test
    void getOrder_unknown_returns404() throws Exception {
        when(orderStore.load(99L)).thenThrow(new ResourceNotFoundException("Order", 99L));

        mockMvc.perform(get("/api/orders/99"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"));
    }

    @Test
    void findByHashlock_returnsOrderId() throws Exception {
        when(orderStore.findIdByHashlock(HASHLOCK)).thenReturn(Optional.of(7L));

        mockMvc.perform(get("/api/orders/by-hashlock/" + HASHLOCK))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.orderId").value(7));
    }

    @Test
    void findByHashlock_absent_returns404() throws Exception {
        when(orderStore.findIdByHashlock(HASHLOCK)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/orders/by-hashlock/" + HASHLOCK)).andExpect(status().isNotFound());
    }

    @Test
    void openOrders_rejectsOversizedPage() throws Exception {
        mockMvc.perform(get("/api/orders").param("size", "501")).andExpect(status().isBadRequest());
    }

    @Test
    void withdraw_returnsSettlement() throws Exception {
        SwapOrder completed = SwapFixtures.singleOrder(1L);
        completed.setStatus(OrderStatus.COMPLETED);
        SettlementBreakdown breakdown = SettlementBreakdown.builder()
                .amount(1_000_000)
                .baseFee(5_000)
                .feeRecipient("treasury")
                .build();
        when(settlementExecutor.withdraw(1L, "bob", SECRET))
                .thenReturn(SettlementResult.builder().order(completed).breakdown(breakdown).build());

        mockMvc.perform(post("/api/orders/1/withdraw")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"caller":"bob","secret":"%s"}
                        """.formatted(SECRET)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.order.status").value("COMPLETED"))
                .andExpect(jsonPath("$.breakdown.payout").value(995000))
                .andExpect(jsonPath("$.breakdown.fee").value(5000));
    }

    @Test
    void withdraw_invalidSecret_returns422() throws Exception {
        when(settlementExecutor.withdraw(1L, "bob", "0011")).thenThrow(new InvalidSecretException(1L));

        mockMvc.perform(post("/api/orders/1/withdraw")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"caller":"bob","secret":"0011"}
                        """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error.code").value("INVALID_SECRET"));
    }

    @Test
    void withdraw_nonHexSecret_returns400() throws Exception {
        mockMvc.perform(post("/api/orders/1/withdraw")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"caller":"bob","secret":"not-hex"}
                        """))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(settlementExecutor);
    }

    @Test
    void withdraw_wrongStage_returns403() throws Exception {
        when(settlementExecutor.withdraw(1L, "mallory", SECRET))
                .thenThrow(new StageAuthorizationException(1L, "mallory", OrderStage.OPEN, "withdraw"));

        mockMvc.perform(post("/api/orders/1/withdraw")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"caller":"mallory","secret":"%s"}
                        """.formatted(SECRET)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error.code").value("FORBIDDEN"));
    }

    @Test
    void cancel_beforeExpiry_returns409() throws Exception {
        when(cancellationHandler.cancel(1L, "alice")).thenThrow(OrderStateException.timelockNotExpired(1L));

        mockMvc.perform(post("/api/orders/1/cancel")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"caller":"alice"}
                        """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error.code").value("TIMELOCK_NOT_EXPIRED"));
    }

    @Test
    void cancel_racingSettlement_returns409() throws Exception {
        when(cancellationHandler.cancel(1L, "alice"))
                .thenThrow(new ObjectOptimisticLockingFailureException(SwapOrderEntity.class, 1L));

        mockMvc.perform(post("/api/orders/1/cancel")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"caller":"alice"}
                        """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error.code").value("ORDER_STATE_CONFLICT"));
    }

    @Test
    void createOrder_negativeStageDuration_returns400() throws Exception {
        mockMvc.perform(post("/api/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"sender":"alice","receiver":"bob","asset":"uatom","amount":1000000,
                         "hashlock":"%s","stageDurations":{"finalityDelay":0,"takerExclusiveDuration":-1,
                         "privateResolverDuration":600,"publicResolverDuration":1800,
                         "privateCancellationDuration":600}}
                        """.formatted(HASHLOCK)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error.details['stageDurations.takerExclusiveDuration']").exists());
        verifyNoInteractions(orderStore);
    }

    @Test
    void createOrder_overflowingStageDurations_returns400() throws Exception {
        when(orderStore.createOrder(any()))
                .thenThrow(new ValidationException("Stage duration exceeds the maximum timelock"));

        mockMvc.perform(post("/api/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"sender":"alice","receiver":"bob","asset":"uatom","amount":1000000,
                         "hashlock":"%s","stageDurations":{"finalityDelay":0,
                         "takerExclusiveDuration":9223372036854775807,
                         "privateResolverDuration":9223372036854775807,"publicResolverDuration":1,
                         "privateCancellationDuration":3603}}
                        """.formatted(HASHLOCK)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
    }

    @Test
    void canCancel_withoutAddressUsesSender() throws Exception {
        when(cancellationHandler.canCancel(1L)).thenReturn(true);

        mockMvc.perform(get("/api/orders/1/can-cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.allowed").value(true));
    }

    @Test
    void canWithdraw_requiresAddress() throws Exception {
        mockMvc.perform(get("/api/orders/1/can-withdraw"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));

        when(settlementExecutor.canWithdraw(eq(1L), eq("bob"))).thenReturn(true);
        mockMvc.perform(get("/api/orders/1/can-withdraw").param("address", "bob"))
                .andExpect(jsonPath("$.allowed").value(true));
    }
}
