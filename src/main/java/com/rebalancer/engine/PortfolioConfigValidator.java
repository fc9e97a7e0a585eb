package com.rebalancer.engine;

import com.rebalancer.config.RebalancerProperties;
import com.rebalancer.domain.enums.PersistenceMode;
import com.rebalancer.domain.model.PortfolioConfig;
import com.rebalancer.exception.ConfigurationException;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Checks the portfolio configuration. Runs once at startup (a bad configuration stops the
 * application) and again at the start of every run, before the broker is touched.
 *
 * <p>Rules:
 * <ul>
 *   <li>top-N is positive</li>
 *   <li>every portfolio has a name, an index id and a non-negative initial capital</li>
 *   <li>portfolio names are unique, ignoring case</li>
 *   <li>the in-memory store ({@code persistence.mode=NONE}) serves one enabled portfolio only</li>
 * </ul>
 */
@Component
public class PortfolioConfigValidator {

    private static final Logger log = LoggerFactory.getLogger(PortfolioConfigValidator.class);

    private final RebalancerProperties rebalancerProperties;

    public PortfolioConfigValidator(RebalancerProperties rebalancerProperties) {
        this.rebalancerProperties = rebalancerProperties;
    }

    @PostConstruct
    public void validateOnStartup() {
        validate();
        log.info(
                "Portfolio configuration valid: {} portfolio(s), {} enabled, top-{}",
                rebalancerProperties.getPortfolios().size(),
                rebalancerProperties.getEnabledPortfolios().size(),
                rebalancerProperties.getTopN());
    }

    /**
     * @throws ConfigurationException listing every problem found
     */
    public void validate() {
        List<String> problems = new ArrayList<>();

        if (rebalancerProperties.getTopN() <= 0) {
            problems.add("top-n must be positive, was " + rebalancerProperties.getTopN());
        }

        Set<String> names = new HashSet<>();
        List<PortfolioConfig> portfolios = rebalancerProperties.getPortfolios();
        for (int i = 0; i < portfolios.size(); i++) {
            PortfolioConfig portfolio = portfolios.get(i);
            String label = "portfolios[" + i + "]";
            if (isBlank(portfolio.getName())) {
                problems.add(label + ".name is required");
            } else if (!names.add(portfolio.getName().toLowerCase(Locale.ROOT))) {
                problems.add("duplicate portfolio name '" + portfolio.getName() + "'");
            }
            if (isBlank(portfolio.getIndexId())) {
                problems.add(label + ".index-id is required");
            }
            if (portfolio.getInitialCapital() == null) {
                problems.add(label + ".initial-capital is required");
            } else if (portfolio.getInitialCapital().signum() < 0) {
                problems.add(label + ".initial-capital must not be negative");
            }
        }

        int enabled = rebalancerProperties.getEnabledPortfolios().size();
        if (rebalancerProperties.getPersistence().getMode() == PersistenceMode.NONE && enabled > 1) {
            problems.add("persistence.mode=NONE supports a single enabled portfolio, found " + enabled);
        }

        if (!problems.isEmpty()) {
            throw new ConfigurationException(problems);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
