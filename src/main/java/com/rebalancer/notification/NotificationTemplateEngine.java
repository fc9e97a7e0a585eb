package com.rebalancer.notification;

import com.rebalancer.domain.enums.MismatchType;
import com.rebalancer.domain.model.ExecutedLeg;
import com.rebalancer.domain.model.OwnershipRecord;
import com.rebalancer.domain.model.PortfolioRunResult;
import com.rebalancer.domain.model.ReconciliationReport;
import com.rebalancer.domain.model.RunSummary;
import com.rebalancer.domain.model.SkippedLeg;
import java.time.format.DateTimeFormatter;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Renders a {@link RunSummary} for the notification channels.
 *
 * <p>Bodies use Telegram HTML parse mode ({@code <b>bold</b>}) and plain newlines so
 * the same text reads well on a phone and inside an e-mail.
 */
@Component
public class NotificationTemplateEngine {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public String renderSubject(RunSummary summary) {
        String prefix = summary.isDryRun() ? "[DRY RUN] " : "";
        String outcome = summary.hasFailures() ? "completed with failures" : "completed";
        return String.format(
                "%sRebalance %s: %d executed, %d skipped",
                prefix,
                outcome,
                summary.getExecutedCount(),
                summary.getSkippedCount());
    }

    public String render(RunSummary summary) {
        StringBuilder text = new StringBuilder();
        text.append(summary.isDryRun() ? "<b>REBALANCE DRY RUN</b>\n" : "<b>REBALANCE</b>\n");
        text.append("<b>Run:</b> ").append(summary.getRunId()).append('\n');
        text.append("<b>Trigger:</b> ").append(escape(summary.getTrigger())).append('\n');
        if (summary.getStartedAt() != null) {
            text.append("<b>Started:</b> ").append(summary.getStartedAt().format(TIME_FORMAT)).append('\n');
        }
        renderReconciliation(summary.getReconciliation(), text);

        for (PortfolioRunResult portfolio : summary.getPortfolios()) {
            text.append('\n');
            renderPortfolio(portfolio, text);
        }
        return text.toString();
    }

    private void renderReconciliation(ReconciliationReport report, StringBuilder text) {
        if (report == null) {
            text.append("<b>Reconciliation:</b> not run\n");
            return;
        }
        text.append(String.format(
                "<b>Reconciliation:</b> %d mismatch(es), %d external sale(s), %d untracked holding(s)%n",
                report.getTotalMismatches(),
                report.getDetectedSales().size(),
                report.countMismatches(MismatchType.UNTRACKED_HOLDING)));
        report.getDetectedSales().forEach(sale -> text.append(String.format(
                "  external sale: [%s] %s %s, est. %s%n",
                escape(sale.getPortfolioName()),
                sale.getQuantity().toPlainString(),
                sale.getSymbol(),
                sale.getEstimatedProceeds().toPlainString())));
    }

    private void renderPortfolio(PortfolioRunResult portfolio, StringBuilder text) {
        text.append("<b>")
                .append(escape(portfolio.getPortfolioName()))
                .append("</b> ")
                .append(portfolio.getStatus())
                .append('\n');
        if (portfolio.getErrorMessage() != null) {
            text.append("<b>Error:</b> ").append(escape(portfolio.getErrorMessage())).append('\n');
            return;
        }
        if (portfolio.getCurrentSymbols() != null) {
            text.append("Leaderboard: ").append(joined(portfolio.getCurrentSymbols())).append('\n');
        }

        List<ExecutedLeg> executed = portfolio.getExecuted();
        if (executed.isEmpty() && portfolio.getSkipped().isEmpty()) {
            text.append("No trades\n");
        }
        for (ExecutedLeg leg : executed) {
            text.append(String.format(
                    "%s %s %s @ %s = %s%n",
                    leg.getSide(),
                    leg.getQuantity().toPlainString(),
                    leg.getSymbol(),
                    leg.getPrice().toPlainString(),
                    leg.getTotal().toPlainString()));
        }
        for (SkippedLeg leg : portfolio.getSkipped()) {
            text.append(String.format(
                    "<i>skipped</i> %s %s (%s) %s%n",
                    leg.getSide(),
                    leg.getSymbol(),
                    leg.getReason(),
                    leg.getDetail() != null ? escape(leg.getDetail()) : ""));
        }

        if (!portfolio.getLedger().isEmpty()) {
            text.append("Holdings:\n");
            for (OwnershipRecord record : portfolio.getLedger()) {
                text.append(String.format(
                        "  %s %s (cost %s)%n",
                        record.getSymbol(),
                        record.getQuantity().toPlainString(),
                        record.getTotalCost().toPlainString()));
            }
        }
    }

    private static String joined(List<String> symbols) {
        return symbols.isEmpty() ? "-" : String.join(", ", symbols);
    }

    static String escape(String value) {
        if (value == null) {
            return "";
        }
        return value.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }
}
