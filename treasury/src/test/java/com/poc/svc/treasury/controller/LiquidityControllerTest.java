package com.poc.svc.treasury.controller;

import com.poc.svc.treasury.domain.EntityBalance;
import com.poc.svc.treasury.domain.GlobalPosition;
import com.poc.svc.treasury.domain.RegionalPosition;
import com.poc.svc.treasury.service.TreasuryAnalyticsService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.emptyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = LiquidityController.class)
@Import(ErrorHandlingAdvice.class)
class LiquidityControllerTest {

    private static final String TRACE_HEADER = "X-Trace-Id";
    private static final LocalDate AS_OF = LocalDate.of(2025, 3, 31);

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TreasuryAnalyticsService analyticsService;

    @Test
    @DisplayName("should return global position in snake_case with trace header")
    void globalPosition_success() throws Exception {
        GlobalPosition position = new GlobalPosition(
                AS_OF,
                "USD",
                new BigDecimal("1550000.00"),
                Map.of("APAC", new BigDecimal("1550000.00")),
                Map.of("USD", new BigDecimal("1000000.00"), "SGD", new BigDecimal("550000.00")),
                Map.of("SG01", new BigDecimal("1550000.00")),
                2,
                List.of(),
                0
        );
        Mockito.when(analyticsService.globalPosition(eq(AS_OF))).thenReturn(position);

        mockMvc.perform(get("/treasury/liquidity/global-position")
                        .param("asOf", "2025-03-31")
                        .header(TRACE_HEADER, "client-trace")
                        .accept(MediaType.APPLICATION_JSON))
                .andExpect(status().isOk())
                .andExpect(header().string(TRACE_HEADER, equalTo("client-trace")))
                .andExpect(jsonPath("$.as_of_date").value("2025-03-31"))
                .andExpect(jsonPath("$.reporting_currency").value("USD"))
                .andExpect(jsonPath("$.total_liquidity_reporting_ccy").value(1550000.00))
                .andExpect(jsonPath("$.by_currency.SGD").value(550000.00))
                .andExpect(jsonPath("$.total_accounts").value(2))
                .andExpect(jsonPath("$.excluded_records", hasSize(0)));
    }

    @Test
    @DisplayName("should generate a trace id when the client sends none")
    void globalPosition_generatesTraceId() throws Exception {
        Mockito.when(analyticsService.globalPosition(null)).thenReturn(GlobalPosition.empty(AS_OF, "USD"));

        mockMvc.perform(get("/treasury/liquidity/global-position").accept(MediaType.APPLICATION_JSON))
                .andExpect(status().isOk())
                .andExpect(header().string(TRACE_HEADER, not(emptyString())))
                .andExpect(jsonPath("$.total_liquidity_reporting_ccy").value(0.00));
    }

    @Test
    void regionalPosition_success() throws Exception {
        RegionalPosition position = new RegionalPosition(
                "APAC",
                new BigDecimal("1550000.00"),
                2,
                Map.of("SG01", new BigDecimal("1550000.00")),
                Map.of("USD", new BigDecimal("1000000.00")),
                List.of(new EntityBalance("SG01", new BigDecimal("1550000.00")))
        );
        Mockito.when(analyticsService.regionalPosition(null, "apac")).thenReturn(position);

        mockMvc.perform(get("/treasury/liquidity/by-region/{region}", "apac").accept(MediaType.APPLICATION_JSON))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.region").value("APAC"))
                .andExpect(jsonPath("$.account_count").value(2))
                .andExpect(jsonPath("$.top_entities[0].entity").value("SG01"));
    }

    @Test
    @DisplayName("should reject unparseable dates")
    void globalPosition_badDate() throws Exception {
        mockMvc.perform(get("/treasury/liquidity/global-position")
                        .param("asOf", "31/03/2025")
                        .header(TRACE_HEADER, "trace-bad-date")
                        .accept(MediaType.APPLICATION_JSON))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
                .andExpect(jsonPath("$.details.parameter").value("asOf"))
                .andExpect(jsonPath("$.trace_id").value("trace-bad-date"));
    }
}
