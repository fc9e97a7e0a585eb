package com.rebalancer.api.controller;

import com.rebalancer.api.dto.response.PortfolioResponse;
import com.rebalancer.config.RebalancerProperties;
import com.rebalancer.domain.model.ExecutionRun;
import com.rebalancer.domain.model.ExternalSaleRecord;
import com.rebalancer.domain.model.OwnershipRecord;
import com.rebalancer.domain.model.PortfolioConfig;
import com.rebalancer.domain.model.TradeRecord;
import com.rebalancer.exception.ResourceNotFoundException;
import com.rebalancer.ledger.LedgerStore;
import com.rebalancer.ledger.OwnershipLedger;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only views of the configured portfolios and what the engine remembers about them.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/portfolios -- configured portfolios with their holding count</li>
 *   <li>GET /api/portfolios/{name}/ledger -- ownership records</li>
 *   <li>GET /api/portfolios/{name}/external-sales -- detected external sales, newest first</li>
 *   <li>GET /api/portfolios/{name}/trades -- trade records, newest first</li>
 *   <li>GET /api/portfolios/{name}/runs -- recent execution runs</li>
 * </ul>
 * Portfolio names match case-insensitively.
 */
@RestController
@RequestMapping("/api/portfolios")
public class PortfolioController {

    private final RebalancerProperties rebalancerProperties;
    private final OwnershipLedger ownershipLedger;
    private final LedgerStore ledgerStore;

    public PortfolioController(
            RebalancerProperties rebalancerProperties, OwnershipLedger ownershipLedger, LedgerStore ledgerStore) {
        this.rebalancerProperties = rebalancerProperties;
        this.ownershipLedger = ownershipLedger;
        this.ledgerStore = ledgerStore;
    }

    @GetMapping
    public ResponseEntity<List<PortfolioResponse>> listPortfolios() {
        List<PortfolioResponse> portfolios = rebalancerProperties.getPortfolios().stream()
                .map(portfolio -> PortfolioResponse.builder()
                        .name(portfolio.getName())
                        .indexId(portfolio.getIndexId())
                        .initialCapital(portfolio.getInitialCapital())
                        .enabled(portfolio.isEnabled())
                        .holdings(ownershipLedger.getPortfolioLedger(portfolio.getName()).size())
                        .build())
                .toList();
        return ResponseEntity.ok(portfolios);
    }

    @GetMapping("/{name}/ledger")
    public ResponseEntity<List<OwnershipRecord>> getLedger(@PathVariable String name) {
        return ResponseEntity.ok(ownershipLedger.getPortfolioLedger(resolve(name)));
    }

    @GetMapping("/{name}/external-sales")
    public ResponseEntity<List<ExternalSaleRecord>> getExternalSales(@PathVariable String name) {
        return ResponseEntity.ok(ledgerStore.findExternalSalesByPortfolio(resolve(name)));
    }

    @GetMapping("/{name}/trades")
    public ResponseEntity<List<TradeRecord>> getTrades(@PathVariable String name) {
        return ResponseEntity.ok(ledgerStore.findTradesByPortfolio(resolve(name)));
    }

    @GetMapping("/{name}/runs")
    public ResponseEntity<List<ExecutionRun>> getRuns(@PathVariable String name) {
        return ResponseEntity.ok(ledgerStore.findExecutionRunsByPortfolio(resolve(name)));
    }

    private String resolve(String name) {
        return rebalancerProperties.getPortfolios().stream()
                .map(PortfolioConfig::getName)
                .filter(configured -> configured.equalsIgnoreCase(name))
                .findFirst()
                .orElseThrow(() -> new ResourceNotFoundException("Portfolio", name));
    }
}
