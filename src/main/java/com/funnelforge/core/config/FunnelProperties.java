package com.funnelforge.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "funnel")
public class FunnelProperties {

    private Bandit bandit = new Bandit();
    private Spend spend = new Spend();
    private Scheduler scheduler = new Scheduler();

    // -- Bandit accessors (delegate to nested) --
    public List<String> getStreams() { return bandit.streams; }
    public List<String> getPlatforms() { return bandit.platforms; }
    public List<String> getHookTypes() { return bandit.hookTypes; }
    public List<String> getTemplateStyles() { return bandit.templateStyles; }
    public double getExplorationRate() { return bandit.explorationRate; }
    public double getNegativeProfitPenalty() { return bandit.negativeProfitPenalty; }
    public double getBaselineShare() { return bandit.baselineShare; }
    public double getPruneThreshold() { return bandit.pruneThreshold; }
    public long getPruneMinSamples() { return bandit.pruneMinSamples; }
    public double getPriorRoas() { return bandit.priorRoas; }
    public int getArmsPerCycle() { return bandit.armsPerCycle; }

    // -- Spend accessors (delegate to nested) --
    public double getDailyBudget() { return spend.dailyBudget; }
    public double getApprovalThreshold() { return spend.approvalThreshold; }
    public double getDefaultPlatformLimit() { return spend.defaultPlatformLimit; }
    public Duration getApprovalTimeout() { return spend.approvalTimeout; }

    /** Daily limit for the platform, case-insensitive, falling back to the default limit. */
    public double platformLimit(String platform) {
        if (platform == null) return spend.defaultPlatformLimit;
        Double limit = spend.platformLimits.get(platform.toLowerCase());
        return limit != null ? limit : spend.defaultPlatformLimit;
    }

    // -- Scheduler accessors (delegate to nested) --
    public int getMaxConcurrentTasks() { return scheduler.maxConcurrentTasks; }
    public Duration getTickInterval() { return scheduler.tickInterval; }
    public Duration getOptimizationInterval() { return scheduler.optimizationInterval; }
    public Duration getProfitWindowInterval() { return scheduler.profitWindowInterval; }
    public Duration getRetention() { return scheduler.retention; }
    public int getProfitWindowCapacity() { return scheduler.profitWindowCapacity; }
    public boolean isSchedulerEnabled() { return scheduler.enabled; }
    public double getContentCost() { return scheduler.contentCost; }
    public double getVideoCost() { return scheduler.videoCost; }

    public Bandit getBandit() { return bandit; }
    public void setBandit(Bandit bandit) { this.bandit = bandit; }
    public Spend getSpend() { return spend; }
    public void setSpend(Spend spend) { this.spend = spend; }
    public Scheduler getScheduler() { return scheduler; }
    public void setScheduler(Scheduler scheduler) { this.scheduler = scheduler; }

    public static class Bandit {
        private List<String> streams = new ArrayList<>(List.of(
                "mnp", "credit", "tech", "anime", "travel", "fashion", "food", "hacks", "jobs", "cute"));
        private List<String> platforms = new ArrayList<>(List.of("tiktok", "instagram"));
        private List<String> hookTypes = new ArrayList<>(List.of("numeric", "question", "limited", "benefit"));
        private List<String> templateStyles = new ArrayList<>(List.of("minimal", "dynamic", "business"));
        private double explorationRate = 0.15;
        private double negativeProfitPenalty = 0.1;
        private double baselineShare = 0.1;
        private double pruneThreshold = -1000;
        private long pruneMinSamples = 100;
        private double priorRoas = 2.5;
        private int armsPerCycle = 10;

        public List<String> getStreams() { return streams; }
        public void setStreams(List<String> streams) { this.streams = streams; }
        public List<String> getPlatforms() { return platforms; }
        public void setPlatforms(List<String> platforms) { this.platforms = platforms; }
        public List<String> getHookTypes() { return hookTypes; }
        public void setHookTypes(List<String> hookTypes) { this.hookTypes = hookTypes; }
        public List<String> getTemplateStyles() { return templateStyles; }
        public void setTemplateStyles(List<String> templateStyles) { this.templateStyles = templateStyles; }
        public double getExplorationRate() { return explorationRate; }
        public void setExplorationRate(double explorationRate) { this.explorationRate = explorationRate; }
        public double getNegativeProfitPenalty() { return negativeProfitPenalty; }
        public void setNegativeProfitPenalty(double negativeProfitPenalty) { this.negativeProfitPenalty = negativeProfitPenalty; }
        public double getBaselineShare() { return baselineShare; }
        public void setBaselineShare(double baselineShare) { this.baselineShare = baselineShare; }
        public double getPruneThreshold() { return pruneThreshold; }
        public void setPruneThreshold(double pruneThreshold) { this.pruneThreshold = pruneThreshold; }
        public long getPruneMinSamples() { return pruneMinSamples; }
        public void setPruneMinSamples(long pruneMinSamples) { this.pruneMinSamples = pruneMinSamples; }
        public double getPriorRoas() { return priorRoas; }
        public void setPriorRoas(double priorRoas) { this.priorRoas = priorRoas; }
        public int getArmsPerCycle() { return armsPerCycle; }
        public void setArmsPerCycle(int armsPerCycle) { this.armsPerCycle = armsPerCycle; }
    }

    public static class Spend {
        private double dailyBudget = 100;
        private double approvalThreshold = 50;
        private double defaultPlatformLimit = 50;
        private Map<String, Double> platformLimits = new LinkedHashMap<>(Map.of(
                "tiktok", 60.0,
                "instagram", 40.0,
                "youtube", 30.0));
        private Duration approvalTimeout = Duration.ofMinutes(60);

        public double getDailyBudget() { return dailyBudget; }
        public void setDailyBudget(double dailyBudget) { this.dailyBudget = dailyBudget; }
        public double getApprovalThreshold() { return approvalThreshold; }
        public void setApprovalThreshold(double approvalThreshold) { this.approvalThreshold = approvalThreshold; }
        public double getDefaultPlatformLimit() { return defaultPlatformLimit; }
        public void setDefaultPlatformLimit(double defaultPlatformLimit) { this.defaultPlatformLimit = defaultPlatformLimit; }
        public Map<String, Double> getPlatformLimits() { return platformLimits; }
        public void setPlatformLimits(Map<String, Double> platformLimits) { this.platformLimits = platformLimits; }
        public Duration getApprovalTimeout() { return approvalTimeout; }
        public void setApprovalTimeout(Duration approvalTimeout) { this.approvalTimeout = approvalTimeout; }
    }

    public static class Scheduler {
        private boolean enabled = true;
        private int maxConcurrentTasks = 5;
        private Duration tickInterval = Duration.ofSeconds(30);
        private Duration optimizationInterval = Duration.ofHours(2);
        private Duration profitWindowInterval = Duration.ofMinutes(30);
        private Duration retention = Duration.ofHours(24);
        private int profitWindowCapacity = 48;
        private double contentCost = 2.0;
        private double videoCost = 0.17;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public int getMaxConcurrentTasks() { return maxConcurrentTasks; }
        public void setMaxConcurrentTasks(int maxConcurrentTasks) { this.maxConcurrentTasks = maxConcurrentTasks; }
        public Duration getTickInterval() { return tickInterval; }
        public void setTickInterval(Duration tickInterval) { this.tickInterval = tickInterval; }
        public Duration getOptimizationInterval() { return optimizationInterval; }
        public void setOptimizationInterval(Duration optimizationInterval) { this.optimizationInterval = optimizationInterval; }
        public Duration getProfitWindowInterval() { return profitWindowInterval; }
        public void setProfitWindowInterval(Duration profitWindowInterval) { this.profitWindowInterval = profitWindowInterval; }
        public Duration getRetention() { return retention; }
        public void setRetention(Duration retention) { this.retention = retention; }
        public int getProfitWindowCapacity() { return profitWindowCapacity; }
        public void setProfitWindowCapacity(int profitWindowCapacity) { this.profitWindowCapacity = profitWindowCapacity; }
        public double getContentCost() { return contentCost; }
        public void setContentCost(double contentCost) { this.contentCost = contentCost; }
        public double getVideoCost() { return videoCost; }
        public void setVideoCost(double videoCost) { this.videoCost = videoCost; }
    }
}
