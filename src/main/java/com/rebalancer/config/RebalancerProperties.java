package com.rebalancer.config;

import com.rebalancer.domain.enums.PersistenceMode;
import com.rebalancer.domain.enums.SchedulerMode;
import com.rebalancer.domain.model.PortfolioConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Root configuration of the rebalancer.
 *
 * <p>Reads from application.properties:
 * <pre>
 * rebalancer.top-n=5
 * rebalancer.portfolios[0].name=SP400
 * rebalancer.portfolios[0].index-id=13
 * rebalancer.portfolios[0].initial-capital=10000
 * rebalancer.persistence.mode=JPA
 * rebalancer.broker.timeout=15s
 * rebalancer.leaderboard.api-url=${LEADERBOARD_API_URL:}
 * rebalancer.reconciliation.lookback-days=7
 * rebalancer.scheduler.cron=0 30 9 * * MON
 * rebalancer.webhook.secret=${WEBHOOK_SECRET:}
 * </pre>
 * Field constraints fail startup; {@code PortfolioConfigValidator} re-checks the
 * cross-portfolio rules before every run.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "rebalancer")
public class RebalancerProperties {

    @Min(1)
    private int topN = 5;

    @Valid
    private List<PortfolioConfig> portfolios = new ArrayList<>();

    private Persistence persistence = new Persistence();
    private Broker broker = new Broker();
    private Leaderboard leaderboard = new Leaderboard();
    private Reconciliation reconciliation = new Reconciliation();
    private Scheduler scheduler = new Scheduler();
    private Webhook webhook = new Webhook();

    public List<PortfolioConfig> getEnabledPortfolios() {
        return portfolios.stream().filter(PortfolioConfig::isEnabled).toList();
    }

    @Data
    public static class Persistence {
        private PersistenceMode mode = PersistenceMode.JPA;
    }

    @Data
    public static class Broker {
        private Duration timeout = Duration.ofSeconds(15);
        private int callThreads = 2;

        /** Seed prices for the paper broker, keyed by symbol. */
        private Map<String, BigDecimal> paperPrices = new HashMap<>();

        private BigDecimal paperDefaultPrice = new BigDecimal("100.00");
    }

    @Data
    public static class Leaderboard {
        private String apiUrl;
        private String apiToken;
        private String algoId = "1";
        private Duration timeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Reconciliation {
        private int lookbackDays = 7;
        private Duration matchTolerance = Duration.ofHours(1);
        private Duration unfilledGracePeriod = Duration.ofHours(24);
    }

    @Data
    public static class Scheduler {
        private SchedulerMode mode = SchedulerMode.INTERNAL;
        private String cron = "0 30 9 * * MON";
        private String zone = "America/New_York";
    }

    @Data
    public static class Webhook {
        /** Shared secret expected in the X-Webhook-Secret header. Blank disables the check. */
        private String secret;
    }
}
