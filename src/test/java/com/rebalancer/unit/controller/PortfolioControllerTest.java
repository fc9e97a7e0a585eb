package com.rebalancer.unit.controller;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.rebalancer.api.controller.PortfolioController;
import com.rebalancer.config.ApiResponseAdvice;
import com.rebalancer.config.RebalancerProperties;
import com.rebalancer.domain.enums.OrderSide;
import com.rebalancer.domain.model.ExternalSaleRecord;
import com.rebalancer.domain.model.PortfolioConfig;
import com.rebalancer.exception.GlobalExceptionHandler;
import com.rebalancer.ledger.InMemoryLedgerStore;
import com.rebalancer.ledger.OwnershipLedger;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Standalone MockMvc tests for the portfolio views, backed by an in-memory ledger.
 */
class PortfolioControllerTest {

    private MockMvc mockMvc;
    private InMemoryLedgerStore ledgerStore;
    private OwnershipLedger ownershipLedger;

    @BeforeEach
    void setUp() {
        RebalancerProperties properties = new RebalancerProperties();
        properties.setPortfolios(List.of(PortfolioConfig.builder()
                .name("SP400")
                .indexId("13")
                .initialCapital(new BigDecimal("10000"))
                .build()));
        ledgerStore = new InMemoryLedgerStore();
        ownershipLedger = new OwnershipLedger(ledgerStore);

        mockMvc = MockMvcBuilders.standaloneSetup(new PortfolioController(properties, ownershipLedger, ledgerStore))
                .setControllerAdvice(new ApiResponseAdvice(), new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("GET /api/portfolios lists configured portfolios with holding counts")
    void listsPortfolios() throws Exception {
        ownershipLedger.apply("SP400", "AAPL", OrderSide.BUY, new BigDecimal("20"), new BigDecimal("100"));

        mockMvc.perform(get("/api/portfolios"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].name").value("SP400"))
                .andExpect(jsonPath("$.data[0].indexId").value("13"))
                .andExpect(jsonPath("$.data[0].enabled").value(true))
                .andExpect(jsonPath("$.data[0].holdings").value(1));
    }

    @Test
    @DisplayName("GET /api/portfolios/{name}/ledger matches the name case-insensitively")
    void ledgerByName() throws Exception {
        ownershipLedger.apply("SP400", "AAPL", OrderSide.BUY, new BigDecimal("20"), new BigDecimal("100"));

        mockMvc.perform(get("/api/portfolios/sp400/ledger"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].symbol").value("AAPL"))
                .andExpect(jsonPath("$.data[0].averageCost").value(100.0));
    }

    @Test
    @DisplayName("GET /api/portfolios/{name}/external-sales lists detected sales")
    void externalSales() throws Exception {
        ledgerStore.saveExternalSale(ExternalSaleRecord.builder()
                .id("ext-1")
                .portfolioName("SP400")
                .symbol("TSLA")
                .quantity(new BigDecimal("2"))
                .estimatedProceeds(new BigDecimal("300.00"))
                .detectedAt(LocalDateTime.of(2026, 3, 2, 9, 30))
                .build());

        mockMvc.perform(get("/api/portfolios/SP400/external-sales"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].id").value("ext-1"))
                .andExpect(jsonPath("$.data[0].usedForReinvestment").value(false));
    }

    @Test
    @DisplayName("GET /api/portfolios/{name}/trades and /runs are empty for a new portfolio")
    void emptyHistory() throws Exception {
        mockMvc.perform(get("/api/portfolios/SP400/trades"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").isEmpty());
        mockMvc.perform(get("/api/portfolios/SP400/runs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").isEmpty());
    }

    @Test
    @DisplayName("Unknown portfolio names answer 404")
    void unknownPortfolio() throws Exception {
        mockMvc.perform(get("/api/portfolios/NDX/ledger"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"))
                .andExpect(jsonPath("$.error.message").value("Portfolio not found: NDX"));
    }
}
