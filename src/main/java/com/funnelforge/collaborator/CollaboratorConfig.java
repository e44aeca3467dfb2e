package com.funnelforge.collaborator;

import com.funnelforge.collaborator.simulated.KeywordComplianceChecker;
import com.funnelforge.collaborator.simulated.SimulatedContentGenerator;
import com.funnelforge.collaborator.simulated.SimulatedPublisher;
import com.funnelforge.collaborator.simulated.SimulatedVideoRenderer;
import com.funnelforge.core.events.EventBus;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Default collaborators. Vendor integrations take over by declaring their own beans.
 */
@Configuration
public class CollaboratorConfig {

    @Bean
    @ConditionalOnMissingBean
    public LogSink logSink(EventBus eventBus, Clock clock) {
        return new EventBusLogSink(eventBus, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ApprovalGateway approvalGateway(LogSink logSink, Clock clock) {
        return new InMemoryApprovalGateway(logSink, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ContentGenerator contentGenerator() {
        return new SimulatedContentGenerator();
    }

    @Bean
    @ConditionalOnMissingBean
    public VideoRenderer videoRenderer() {
        return new SimulatedVideoRenderer();
    }

    @Bean
    @ConditionalOnMissingBean
    public ComplianceChecker complianceChecker() {
        return new KeywordComplianceChecker();
    }

    @Bean
    @ConditionalOnMissingBean
    public Publisher publisher() {
        return new SimulatedPublisher();
    }
}
