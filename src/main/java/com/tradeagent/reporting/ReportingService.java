package com.tradeagent.reporting;

import com.tradeagent.config.TradeAgentProperties;
import com.tradeagent.domain.enums.TradingMode;
import com.tradeagent.domain.model.TradeResult;
import com.tradeagent.observability.AuditService;
import com.tradeagent.store.TradeStore;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Reports on trades that were actually executed, as opposed to {@code BacktestService} which
 * reports on a replay.
 *
 * <p>A null mode covers paper and live together. Metrics are measured against the configured
 * risk capital.
 */
@Service
public class ReportingService {

    private static final Logger log = LoggerFactory.getLogger(ReportingService.class);

    private final TradeStore tradeStore;
    private final PerformanceCalculator performanceCalculator;
    private final ReportWriter reportWriter;
    private final AuditService auditService;
    private final TradeAgentProperties properties;

    public ReportingService(
            TradeStore tradeStore,
            PerformanceCalculator performanceCalculator,
            ReportWriter reportWriter,
            AuditService auditService,
            TradeAgentProperties properties) {
        this.tradeStore = tradeStore;
        this.performanceCalculator = performanceCalculator;
        this.reportWriter = reportWriter;
        this.auditService = auditService;
        this.properties = properties;
    }

    /** Computes the metrics and writes report, equity, summary and trade files. */
    public TradeReport report(TradingMode mode) {
        TradeReport analytics = analytics(mode);
        Path outputDir = Path.of(properties.getReporting().getOutputDirectory());
        String prefix = "report_" + analytics.getScope();

        ReportWriter.ReportFiles files =
                reportWriter.write(analytics.getReport(), analytics.getEquityCurve(), outputDir, prefix);
        Path tradesCsv = reportWriter.writeTrades(analytics.getTrades(), outputDir, prefix);

        Map<String, Object> audit = new LinkedHashMap<>();
        audit.put("numTrades", analytics.getReport().getNumTrades());
        audit.put("reportJson", files.getReport().toString());
        audit.put("summaryTxt", files.getSummary().toString());
        auditService.log("REPORT", "Report", analytics.getScope(), audit);

        analytics.setReportFiles(files);
        analytics.setTradesCsv(tradesCsv);
        return analytics;
    }

    /** Computes the metrics without writing anything. */
    public TradeReport analytics(TradingMode mode) {
        String scope = mode != null ? mode.wireValue() : "all";
        List<TradeResult> trades = tradeStore.tradeResults(mode);
        BigDecimal capital = properties.getRisk().getCapital();
        PerformanceReport report = performanceCalculator.calculate(trades, capital, null, null);
        log.info("Report over {} {} trades: pnl={}", trades.size(), scope, report.getTotalPnl());
        return TradeReport.builder()
                .scope(scope)
                .report(report)
                .equityCurve(performanceCalculator.equityCurve(trades))
                .trades(trades)
                .build();
    }
}
