package com.atomicswap.unit.controller;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.atomicswap.api.controller.SettlementAckController;
import com.atomicswap.domain.enums.AckOutcome;
import com.atomicswap.domain.enums.OrderStatus;
import com.atomicswap.exception.GlobalExceptionHandler;
import com.atomicswap.htlc.AckResult;
import com.atomicswap.htlc.AcknowledgementHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class SettlementAckControllerTest {

    private MockMvc mockMvc;

    @Mock
    private AcknowledgementHandler acknowledgementHandler;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        mockMvc = MockMvcBuilders.standaloneSetup(new SettlementAckController(acknowledgementHandler))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void ack_withOutcome() throws Exception {
        when(acknowledgementHandler.acknowledge(3L, AckOutcome.TIMEOUT))
                .thenReturn(AckResult.builder()
                        .sequence(3L)
                        .outcome(AckOutcome.TIMEOUT)
                        .applied(true)
                        .orderId(1L)
                        .orderStatus(OrderStatus.FAILED)
                        .build());

        mockMvc.perform(post("/api/settlements/ack")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"sequence":3,"outcome":"TIMEOUT"}
                        """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.applied").value(true))
                .andExpect(jsonPath("$.orderStatus").value("FAILED"));
    }

    @Test
    void ack_successFlagMapsToOutcome() throws Exception {
        when(acknowledgementHandler.acknowledge(3L, AckOutcome.FAILURE))
                .thenReturn(AckResult.builder().sequence(3L).outcome(AckOutcome.FAILURE).applied(false).build());

        mockMvc.perform(post("/api/settlements/ack")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"sequence":3,"success":false}
                        """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.applied").value(false));
        verify(acknowledgementHandler).acknowledge(3L, AckOutcome.FAILURE);
    }

    @Test
    void ack_withoutOutcome_returns400() throws Exception {
        mockMvc.perform(post("/api/settlements/ack")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"sequence":3}
                        """))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(acknowledgementHandler);
    }

    @Test
    void ack_unknownOutcome_returns400() throws Exception {
        mockMvc.perform(post("/api/settlements/ack")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"sequence":3,"outcome":"MAYBE"}
                        """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("BAD_REQUEST"));
    }
}
