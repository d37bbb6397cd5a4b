package com.tradeagent.reporting;

import com.tradeagent.domain.model.TradeResult;
import com.tradeagent.mapper.JsonHelper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes a performance report as three files under an output directory:
 * {@code <prefix>_report.json}, {@code <prefix>_equity.csv} and {@code <prefix>_summary.txt}.
 */
@Component
public class ReportWriter {

    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    public ReportFiles write(PerformanceReport report, List<BigDecimal> equity, Path outputDir, String prefix) {
        try {
            Files.createDirectories(outputDir);
            Path json = outputDir.resolve(prefix + "_report.json");
            Path csv = outputDir.resolve(prefix + "_equity.csv");
            Path summary = outputDir.resolve(prefix + "_summary.txt");

            Files.writeString(json, JsonHelper.toPrettyJson(report), StandardCharsets.UTF_8);
            Files.writeString(csv, equityCsv(equity), StandardCharsets.UTF_8);
            Files.writeString(summary, summary(report), StandardCharsets.UTF_8);

            log.info("Report written to {} ({} trades)", outputDir, report.getNumTrades());
            return new ReportFiles(json, csv, summary);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write report to " + outputDir, e);
        }
    }

    /** Writes {@code <prefix>_trades.csv}, one row per trade in the given order. */
    public Path writeTrades(List<TradeResult> trades, Path outputDir, String prefix) {
        Path csv = outputDir.resolve(prefix + "_trades.csv");
        try {
            Files.createDirectories(outputDir);
            Files.writeString(csv, tradesCsv(trades), StandardCharsets.UTF_8);
            return csv;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write trades to " + csv, e);
        }
    }

    static String tradesCsv(List<TradeResult> trades) {
        StringBuilder csv = new StringBuilder("timestamp,intent_id,mode,symbol,side,size,price,fee,realized_pnl\n");
        for (TradeResult trade : trades) {
            csv.append(trade.getTimestamp()).append(',')
                    .append(nullToEmpty(trade.getIntentId())).append(',')
                    .append(trade.getMode() != null ? trade.getMode().wireValue() : "").append(',')
                    .append(trade.getSymbol()).append(',')
                    .append(trade.getSide().wireValue()).append(',')
                    .append(plain(trade.getSize())).append(',')
                    .append(plain(trade.getPrice())).append(',')
                    .append(plain(trade.getFee())).append(',')
                    .append(plain(trade.getRealizedPnl())).append('\n');
        }
        return csv.toString();
    }

    private static String plain(BigDecimal value) {
        return value != null ? value.toPlainString() : "";
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    static String equityCsv(List<BigDecimal> equity) {
        StringBuilder csv = new StringBuilder("step,equity\n");
        for (int i = 0; i < equity.size(); i++) {
            csv.append(i + 1).append(',').append(equity.get(i).toPlainString()).append('\n');
        }
        return csv.toString();
    }

    public static String summary(PerformanceReport report) {
        return "Total PnL: " + money(report.getTotalPnl()) + "\n"
                + "Total Return: " + percent(report.getTotalReturn()) + "\n"
                + "CAGR: " + percent(report.getCagr()) + "\n"
                + "Sharpe (trade-based): " + money(report.getSharpe()) + "\n"
                + "Max Drawdown: " + money(report.getMaxDrawdown()) + "\n"
                + "Win Rate: " + percent(report.getWinRate()) + "\n"
                + "Profit Factor: " + money(report.getProfitFactor()) + "\n"
                + "Turnover: " + money(report.getTurnover()) + "\n"
                + "Fees: " + money(report.getFees()) + "\n"
                + "Trades: " + report.getNumTrades() + "\n";
    }

    private static String money(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_EVEN).toPlainString();
    }

    private static String percent(BigDecimal fraction) {
        return fraction.movePointRight(2).setScale(2, RoundingMode.HALF_EVEN).toPlainString() + "%";
    }

    /** Paths of the written files. */
    @Getter
    @AllArgsConstructor
    public static class ReportFiles {
        private final Path report;
        private final Path equity;
        private final Path summary;
    }
}
