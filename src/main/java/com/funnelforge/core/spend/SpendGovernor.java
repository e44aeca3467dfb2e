package com.funnelforge.core.spend;

import com.funnelforge.collaborator.LogSink;
import com.funnelforge.core.bandit.ArmRegistry;
import com.funnelforge.core.config.FunnelProperties;
import com.funnelforge.core.events.EventBus;
import com.funnelforge.core.events.FunnelEvent;
import com.funnelforge.core.exception.ArmNotFoundException;
import com.funnelforge.core.exception.DecisionNotFoundException;
import com.funnelforge.core.exception.InvalidStateException;
import com.funnelforge.core.logging.MdcContext;
import com.funnelforge.core.metrics.FunnelMetrics;
import com.funnelforge.core.model.Arm;
import com.funnelforge.core.model.BudgetStatus;
import com.funnelforge.core.model.DecisionStatus;
import com.funnelforge.core.model.DecisionType;
import com.funnelforge.core.model.RiskLevel;
import com.funnelforge.core.model.SpendDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Gatekeeper for ad spend.
 *
 * <p>Every proposal is classified by expected ROI and by its size relative to the daily budget
 * and the platform's daily limit:
 * <ul>
 *   <li>HIGH risk if ROI &lt; 1.2, spend/budget &gt; 0.3 or spend/platformLimit &gt; 0.5</li>
 *   <li>MEDIUM risk if ROI &lt; 2.0, spend/budget &gt; 0.15 or spend/platformLimit &gt; 0.25</li>
 *   <li>LOW otherwise</li>
 * </ul>
 * HIGH risk (or ROI below 1.0) blocks the spend outright. Low-risk automatic spend below the
 * approval threshold is executed immediately; everything else waits in the pending set
 * for a human. While the emergency stop is active nothing is executed automatically.
 *
 * <p>Daily spend resets lazily on the first call of a new day in the clock's zone.
 */
@Service
public class SpendGovernor {

    private static final Logger log = LoggerFactory.getLogger(SpendGovernor.class);

    static final String AUTO_APPROVER = "system_auto";
    static final String ARM_MISSING = "system_arm_missing";

    private final ArmRegistry registry;
    private final FunnelProperties properties;
    private final Clock clock;
    private final LogSink logSink;
    private final EventBus eventBus;
    private final FunnelMetrics metrics;

    private final AtomicInteger counter = new AtomicInteger(0);
    private final Map<String, SpendDecision> pending = new LinkedHashMap<>();
    private final Map<String, SpendDecision> history = new LinkedHashMap<>();

    private double dailySpend;
    private LocalDate lastResetDate;
    private boolean autoSpendEnabled = true;

    public SpendGovernor(ArmRegistry registry, FunnelProperties properties, Clock clock,
                         LogSink logSink, EventBus eventBus, FunnelMetrics metrics) {
        this.registry = registry;
        this.properties = properties;
        this.clock = clock;
        this.logSink = logSink;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.lastResetDate = LocalDate.now(clock);
    }

    /**
     * Classifies a spend proposal. Automatic low-risk proposals are approved by
     * {@value #AUTO_APPROVER} and executed before returning; all others are stored as PENDING.
     *
     * @throws IllegalArgumentException if {@code proposedSpend} is not positive
     * @throws ArmNotFoundException if the arm does not exist
     */
    public synchronized SpendDecision evaluate(String armId, double proposedSpend,
                                               double expectedRevenue, String platform) {
        if (!(proposedSpend > 0)) {
            throw new IllegalArgumentException("Proposed spend must be positive: " + proposedSpend);
        }
        resetDailyIfNeeded();
        Arm arm = registry.get(armId);

        double expectedRoi = expectedRevenue / proposedSpend;
        RiskLevel risk = riskLevel(proposedSpend, expectedRoi, platform);
        DecisionType type = decisionType(proposedSpend, expectedRoi, risk);
        boolean approvalRequired = proposedSpend >= properties.getApprovalThreshold() || risk == RiskLevel.HIGH;
        Instant now = Instant.now(clock);

        var decision = new SpendDecision(
                String.format("spend-%04d", counter.incrementAndGet()),
                type, proposedSpend, armId, platform,
                reasoning(proposedSpend, expectedRoi, arm, platform),
                approvalRequired, risk, expectedRoi, DecisionStatus.PENDING, now, null, null);

        MdcContext.setDecision(decision.id());
        try {
            metrics.recordSpendDecision(type.name(), risk.name());
            if (type == DecisionType.AUTOMATIC && !approvalRequired && autoSpendEnabled) {
                SpendDecision approved = decision.resolve(DecisionStatus.APPROVED, AUTO_APPROVER, now);
                return executeApproved(approved);
            }

            pending.put(decision.id(), decision);
            log.info("Spend decision {} requires review: {} on {} ({}, risk {})",
                    decision.id(), proposedSpend, platform, type, risk);
            eventBus.publish(new FunnelEvent("spend.pending", decision.id(),
                    Map.of("type", type.name(), "amount", proposedSpend, "armId", armId), now));
            return decision;
        } finally {
            MdcContext.clearDecision();
        }
    }

    /**
     * Books an APPROVED decision against the daily budget and the arm.
     *
     * @throws InvalidStateException       if the decision is not APPROVED (including a second call)
     * @throws DecisionNotFoundException   if the id is unknown
     * @throws ArmNotFoundException        if the arm was pruned; the decision is then REJECTED
     */
    public synchronized SpendDecision execute(String decisionId) {
        SpendDecision decision = findDecision(decisionId)
                .orElseThrow(() -> new DecisionNotFoundException(decisionId));
        if (decision.status() != DecisionStatus.APPROVED) {
            throw new InvalidStateException("Cannot execute spend decision " + decisionId
                    + " in status " + decision.status());
        }
        resetDailyIfNeeded();
        return executeApproved(decision);
    }

    /**
     * Approves and executes a pending decision.
     *
     * @throws DecisionNotFoundException if the id is unknown or no longer pending
     * @throws ArmNotFoundException      if the arm was pruned while waiting; the decision is then REJECTED
     */
    public synchronized SpendDecision approve(String decisionId, String approver) {
        approver = approver != null ? approver : "unknown";
        SpendDecision decision = pending.remove(decisionId);
        if (decision == null) {
            throw new DecisionNotFoundException(decisionId);
        }
        resetDailyIfNeeded();
        SpendDecision approved = decision.resolve(DecisionStatus.APPROVED, approver, Instant.now(clock));
        history.put(decisionId, approved);
        eventBus.publish(new FunnelEvent("spend.approved", decisionId,
                Map.of("approver", approver), approved.resolvedAt()));
        return executeApproved(approved);
    }

    /**
     * Rejects a pending decision.
     *
     * @throws DecisionNotFoundException if the id is unknown or no longer pending
     */
    public synchronized SpendDecision reject(String decisionId, String approver) {
        approver = approver != null ? approver : "unknown";
        SpendDecision decision = pending.remove(decisionId);
        if (decision == null) {
            throw new DecisionNotFoundException(decisionId);
        }
        SpendDecision rejected = decision.resolve(DecisionStatus.REJECTED, approver, Instant.now(clock));
        history.put(decisionId, rejected);
        log.info("Spend decision {} rejected: {} by {}", decisionId, decision.amount(), approver);
        eventBus.publish(new FunnelEvent("spend.rejected", decisionId,
                Map.of("approver", approver), rejected.resolvedAt()));
        return rejected;
    }

    /**
     * Clears every pending decision (recorded as rejected) and disables automatic spend
     * until {@link #resume()}.
     */
    public synchronized void emergencyStop(String reason) {
        Instant now = Instant.now(clock);
        for (SpendDecision decision : pending.values()) {
            history.put(decision.id(), decision.resolve(DecisionStatus.REJECTED, "emergency_stop", now));
        }
        int cleared = pending.size();
        pending.clear();
        autoSpendEnabled = false;

        log.warn("Spend emergency stop: {} ({} pending decisions cleared)", reason, cleared);
        logSink.record("emergency_stop", "Emergency stop activated: " + reason, "warning",
                Map.of("dailySpend", dailySpend, "reason", reason, "timestamp", now.toString()));
        eventBus.publish(new FunnelEvent("spend.emergency_stop", null,
                Map.of("reason", reason, "cleared", cleared), now));
    }

    public synchronized void resume() {
        autoSpendEnabled = true;
        log.info("Automatic spend resumed");
        eventBus.publish(new FunnelEvent("spend.resumed", null, Map.of(), Instant.now(clock)));
    }

    /**
     * Marks pending decisions older than {@code timeout} as EXPIRED and drops them.
     *
     * @return the expired decisions
     */
    public synchronized List<SpendDecision> expireStale(Duration timeout) {
        Instant now = Instant.now(clock);
        Instant cutoff = now.minus(timeout);
        var expired = new ArrayList<SpendDecision>();

        var it = pending.values().iterator();
        while (it.hasNext()) {
            SpendDecision decision = it.next();
            if (decision.createdAt().isBefore(cutoff)) {
                it.remove();
                SpendDecision resolved = decision.resolve(DecisionStatus.EXPIRED, "system_timeout", now);
                history.put(resolved.id(), resolved);
                expired.add(resolved);
                eventBus.publish(new FunnelEvent("spend.expired", resolved.id(),
                        Map.of("amount", resolved.amount()), now));
            }
        }
        if (!expired.isEmpty()) {
            log.info("Expired {} spend decisions pending longer than {}", expired.size(), timeout);
        }
        return expired;
    }

    public synchronized BudgetStatus getBudgetStatus() {
        resetDailyIfNeeded();
        List<Arm> arms = registry.list();
        double totalSpent = arms.stream().mapToDouble(Arm::spend).sum();
        double totalRevenue = arms.stream().mapToDouble(Arm::revenue).sum();

        var platforms = new LinkedHashSet<String>();
        properties.getPlatforms().forEach(p -> platforms.add(p.toLowerCase()));
        platforms.addAll(properties.getSpend().getPlatformLimits().keySet());
        var platformSpend = new LinkedHashMap<String, Double>();
        for (String platform : platforms) {
            platformSpend.put(platform, arms.stream()
                    .filter(a -> a.platform().equalsIgnoreCase(platform))
                    .mapToDouble(Arm::spend)
                    .sum());
        }

        double roas = totalSpent > 0 ? totalRevenue / totalSpent : 0.0;
        BudgetStatus.RiskStatus riskStatus = roas < 1.2 ? BudgetStatus.RiskStatus.DANGER
                : roas < 2.0 ? BudgetStatus.RiskStatus.CAUTION
                : BudgetStatus.RiskStatus.SAFE;

        return new BudgetStatus(totalSpent, dailySpend, properties.getDailyBudget() - dailySpend,
                platformSpend, roas, totalRevenue - totalSpent, riskStatus, autoSpendEnabled,
                pending.size(), recommendations(roas, platformSpend));
    }

    public synchronized List<SpendDecision> pendingDecisions() {
        return List.copyOf(pending.values());
    }

    /** Looks a decision up among pending and resolved ones. */
    public synchronized Optional<SpendDecision> findDecision(String decisionId) {
        SpendDecision decision = pending.get(decisionId);
        return Optional.ofNullable(decision != null ? decision : history.get(decisionId));
    }

    public synchronized boolean isAutoSpendEnabled() {
        return autoSpendEnabled;
    }

    public synchronized double getDailySpend() {
        resetDailyIfNeeded();
        return dailySpend;
    }

    // The arm is booked before the budget so a pruned arm leaves no partial state behind
    private SpendDecision executeApproved(SpendDecision decision) {
        try {
            registry.recordSpend(decision.armId(), decision.amount());
        } catch (ArmNotFoundException e) {
            Instant now = Instant.now(clock);
            SpendDecision rejected = decision.resolve(DecisionStatus.REJECTED, ARM_MISSING, now);
            history.put(rejected.id(), rejected);
            log.warn("Spend decision {} rejected: arm {} no longer exists", decision.id(), decision.armId());
            eventBus.publish(new FunnelEvent("spend.rejected", decision.id(),
                    Map.of("approver", ARM_MISSING, "armId", decision.armId()), now));
            throw e;
        }
        dailySpend += decision.amount();
        SpendDecision executed = decision.withStatus(DecisionStatus.EXECUTED);
        history.put(executed.id(), executed);

        metrics.recordSpendExecuted(decision.amount());
        log.info("Executed spend {}: {} on {}", decision.id(), decision.amount(), decision.platform());
        logSink.record("ad_spend", String.format("Spend executed: %.2f", decision.amount()), "success",
                Map.of("decisionId", decision.id(), "platform", decision.platform(),
                       "amount", decision.amount(), "expectedRoi", decision.expectedRoi()));
        eventBus.publish(new FunnelEvent("spend.executed", decision.id(),
                Map.of("amount", decision.amount(), "armId", decision.armId()), Instant.now(clock)));
        return executed;
    }

    private void resetDailyIfNeeded() {
        LocalDate today = LocalDate.now(clock);
        if (!today.equals(lastResetDate)) {
            log.info("Daily spend reset for {} (previous day spent {})", today, dailySpend);
            dailySpend = 0;
            lastResetDate = today;
        }
    }

    RiskLevel riskLevel(double spend, double expectedRoi, String platform) {
        double budgetRatio = spend / properties.getDailyBudget();
        double platformRatio = spend / properties.platformLimit(platform);

        if (expectedRoi < 1.2 || budgetRatio > 0.3 || platformRatio > 0.5) {
            return RiskLevel.HIGH;
        }
        if (expectedRoi < 2.0 || budgetRatio > 0.15 || platformRatio > 0.25) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }

    DecisionType decisionType(double spend, double expectedRoi, RiskLevel risk) {
        if (risk == RiskLevel.HIGH || expectedRoi < 1.0) {
            return DecisionType.EMERGENCY_STOP;
        }
        if (spend >= properties.getApprovalThreshold() || risk == RiskLevel.MEDIUM) {
            return DecisionType.REQUIRES_APPROVAL;
        }
        return DecisionType.AUTOMATIC;
    }

    private String reasoning(double spend, double expectedRoi, Arm arm, String platform) {
        var reasons = new ArrayList<String>();
        reasons.add(String.format("Expected ROI: %.2fx", expectedRoi));
        reasons.add(String.format("Arm profit: %.2f", arm.profit()));
        reasons.add("Platform: " + platform);
        if (spend >= properties.getApprovalThreshold()) {
            reasons.add("High spend amount: " + spend);
        }
        if (expectedRoi < 1.5) {
            reasons.add("Low ROI warning");
        }
        if (arm.profit() / Math.max(arm.spend(), 1) > 2) {
            reasons.add("High-performing arm");
        }
        return String.join(" | ", reasons);
    }

    private List<String> recommendations(double roas, Map<String, Double> platformSpend) {
        var recommendations = new ArrayList<String>();
        if (roas < 1.5) {
            recommendations.add("Low ROAS detected: consider pausing underperforming arms");
        }
        if (dailySpend > properties.getDailyBudget() * 0.8) {
            recommendations.add("Approaching daily budget limit");
        }
        platformSpend.entrySet().stream()
                .filter(e -> e.getValue() > 0)
                .max(Map.Entry.comparingByValue())
                .ifPresent(e -> recommendations.add(e.getKey() + " showing highest spend: monitor performance"));
        if (roas > 3.0) {
            recommendations.add("High ROAS: consider increasing budget allocation");
        }
        return recommendations;
    }
}
