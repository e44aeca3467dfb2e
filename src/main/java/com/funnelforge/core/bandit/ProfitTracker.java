package com.funnelforge.core.bandit;

import com.funnelforge.collaborator.LogSink;
import com.funnelforge.core.config.FunnelProperties;
import com.funnelforge.core.model.Arm;
import com.funnelforge.core.model.ProfitReport;
import com.funnelforge.core.model.ProfitWindow;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps rolling profit snapshots of the arm registry and builds profit reports from them.
 */
@Service
public class ProfitTracker {

    private static final int TOP_ARMS = 10;

    private final ArmRegistry registry;
    private final FunnelProperties properties;
    private final Clock clock;
    private final LogSink logSink;
    private final Deque<ProfitWindow> windows = new ArrayDeque<>();

    public ProfitTracker(ArmRegistry registry, FunnelProperties properties, Clock clock, LogSink logSink) {
        this.registry = registry;
        this.properties = properties;
        this.clock = clock;
        this.logSink = logSink;
    }

    /**
     * Appends a snapshot of cumulative profit and spend across live arms, keeping only the
     * most recent windows up to the configured capacity.
     */
    public ProfitWindow addProfitWindow() {
        Instant now = Instant.now(clock);
        List<Arm> arms = registry.list();
        double profit = arms.stream().mapToDouble(Arm::profit).sum();
        double spend = arms.stream().mapToDouble(Arm::spend).sum();
        double roi = spend > 0 ? profit / spend : 0.0;

        var window = new ProfitWindow(now.minus(properties.getProfitWindowInterval()), now, profit, spend, roi);
        synchronized (windows) {
            windows.addLast(window);
            while (windows.size() > properties.getProfitWindowCapacity()) {
                windows.removeFirst();
            }
        }

        logSink.record("profit_window",
                String.format("Profit window: %.0f profit, %.0f%% ROI", profit, roi * 100), "success",
                Map.of("windowProfit", profit, "windowSpend", spend, "roi", roi,
                       "windowStart", window.windowStart().toString(), "windowEnd", now.toString()));
        return window;
    }

    public List<ProfitWindow> windows() {
        synchronized (windows) {
            return List.copyOf(windows);
        }
    }

    /**
     * Summarises the last {@code hours} hours: window totals, the most profitable arms,
     * per-stream performance of arms updated in the period and the profit trend.
     */
    public ProfitReport profitReport(int hours) {
        if (hours <= 0) {
            throw new IllegalArgumentException("hours must be positive: " + hours);
        }
        Instant cutoff = Instant.now(clock).minus(Duration.ofHours(hours));
        List<ProfitWindow> recent = windows().stream()
                .filter(w -> w.windowEnd().isAfter(cutoff))
                .toList();

        double totalProfit = recent.stream().mapToDouble(ProfitWindow::totalProfit).sum();
        double totalSpend = recent.stream().mapToDouble(ProfitWindow::totalSpend).sum();
        double averageRoi = recent.stream().mapToDouble(ProfitWindow::roi).average().orElse(0.0);

        List<Arm> arms = registry.list();
        int profitable = (int) arms.stream().filter(a -> a.profit() > 0).count();

        List<ProfitReport.ArmSummary> topArms = arms.stream()
                .filter(a -> a.profit() > 0)
                .sorted(Comparator.comparingDouble(Arm::profit).reversed())
                .limit(TOP_ARMS)
                .map(a -> new ProfitReport.ArmSummary(a.id(), a.profit(), a.roi(), a.allocation(),
                        a.clicks(), a.conversions()))
                .toList();

        var streams = new LinkedHashMap<String, ProfitReport.StreamSummary>();
        for (String stream : properties.getStreams()) {
            List<Arm> streamArms = arms.stream()
                    .filter(a -> a.streamKey().equals(stream) && a.lastUpdated().isAfter(cutoff))
                    .toList();
            double profit = streamArms.stream().mapToDouble(Arm::profit).sum();
            double spend = streamArms.stream().mapToDouble(Arm::spend).sum();
            streams.put(stream, new ProfitReport.StreamSummary(profit, spend,
                    spend > 0 ? profit / spend : 0.0, streamArms.size()));
        }

        List<ProfitReport.TrendPoint> trend = recent.stream()
                .map(w -> new ProfitReport.TrendPoint(w.windowEnd(), w.totalProfit(), w.roi()))
                .toList();

        return new ProfitReport(hours,
                new ProfitReport.Summary(totalProfit, totalSpend, averageRoi, profitable, arms.size()),
                topArms, streams, trend);
    }
}
