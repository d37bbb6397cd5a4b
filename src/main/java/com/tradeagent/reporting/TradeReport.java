package com.tradeagent.reporting;

import com.tradeagent.domain.model.TradeResult;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/** Performance over stored paper or live trades. File paths are null for analytics-only calls. */
@Data
@Builder
public class TradeReport {

    /** {@code paper}, {@code live} or {@code all}. */
    private String scope;

    private PerformanceReport report;
    private List<BigDecimal> equityCurve;
    private List<TradeResult> trades;
    private ReportWriter.ReportFiles reportFiles;
    private Path tradesCsv;
}
