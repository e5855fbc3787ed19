package com.whereq.governor.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.governor.cache.AssetCache;
import com.whereq.governor.cache.AssetUnloader;
import com.whereq.governor.event.EventPublisher;
import com.whereq.governor.event.EventSink;
import com.whereq.governor.event.LoggingEventSink;
import com.whereq.governor.profiler.Profiler;
import com.whereq.governor.resource.MetricsSource;
import com.whereq.governor.resource.ResourceCalculator;
import com.whereq.governor.resource.ResourceMonitor;
import com.whereq.governor.resource.SystemMetricsSource;
import com.whereq.governor.service.AdmissionController;
import com.whereq.governor.service.BudgetManager;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

/**
 * Wires the governor components. Every collaborator is a bean so it can be replaced.
 *
 * @author WhereQ Inc.
 */
@Configuration
public class GovernorConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public MetricsSource metricsSource(Clock clock) {
        return new SystemMetricsSource(clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public AssetUnloader assetUnloader() {
        return AssetUnloader.noop();
    }

    @Bean
    @ConditionalOnMissingBean
    public EventSink eventSink(ObjectMapper objectMapper) {
        return new LoggingEventSink(objectMapper);
    }

    @Bean(destroyMethod = "dispose")
    public Scheduler governorEventScheduler() {
        return Schedulers.newSingle("governor-events");
    }

    @Bean(destroyMethod = "dispose")
    public Scheduler governorMetricsScheduler() {
        return Schedulers.newBoundedElastic(2, 16, "governor-metrics");
    }

    @Bean
    public EventPublisher eventPublisher(EventSink eventSink,
                                         @Qualifier("governorEventScheduler") Scheduler scheduler,
                                         Clock clock) {
        return new EventPublisher(eventSink, scheduler, clock);
    }

    @Bean
    public ResourceMonitor resourceMonitor(MetricsSource metricsSource, Clock clock, GovernorProperties properties,
                                           @Qualifier("governorMetricsScheduler") Scheduler scheduler,
                                           MeterRegistry meterRegistry) {
        return new ResourceMonitor(metricsSource, clock, properties.getMetrics().getPollTimeout(),
            scheduler, meterRegistry);
    }

    @Bean
    public ResourceCalculator resourceCalculator() {
        return new ResourceCalculator();
    }

    @Bean
    public AdmissionController admissionController(MeterRegistry meterRegistry) {
        return new AdmissionController(meterRegistry);
    }

    @Bean
    public AssetCache assetCache(AssetUnloader assetUnloader, GovernorProperties properties,
                                 EventPublisher eventPublisher, Clock clock, MeterRegistry meterRegistry) {
        return new AssetCache(assetUnloader, properties.getCache().getUnloadFailurePolicy(),
            eventPublisher, clock, meterRegistry);
    }

    @Bean
    public Profiler profiler(MetricsSource metricsSource, EventPublisher eventPublisher, Clock clock,
                             GovernorProperties properties) {
        GovernorProperties.ProfilerConfig config = properties.getProfiler();
        return new Profiler(metricsSource, eventPublisher, clock, config.getHistorySize(), config.isEnabled());
    }

    @Bean
    public BudgetManager budgetManager(GovernorProperties properties, ResourceMonitor resourceMonitor,
                                       AdmissionController admissionController,
                                       ResourceCalculator resourceCalculator, AssetCache assetCache,
                                       EventPublisher eventPublisher, Clock clock, MeterRegistry meterRegistry) {
        return new BudgetManager(properties.getLimits().toBudgetLimits(), resourceMonitor, admissionController,
            resourceCalculator, assetCache, eventPublisher, clock, meterRegistry);
    }
}
