package com.tradeagent.backtest;

import com.tradeagent.domain.model.TradeResult;
import com.tradeagent.reporting.PerformanceReport;
import com.tradeagent.reporting.ReportWriter;
import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Data;

@Data
@Builder(toBuilder = true)
public class BacktestResult {

    private String symbol;
    private String strategy;
    private int candlesProcessed;
    private int riskRejections;
    private PerformanceReport report;
    private List<BigDecimal> equityCurve;
    private List<TradeResult> trades;

    /** Set once the report files have been written. */
    private ReportWriter.ReportFiles reportFiles;
}
