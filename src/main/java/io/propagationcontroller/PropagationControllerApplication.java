package io.propagationcontroller;

import io.micrometer.core.instrument.MeterRegistry;
import io.propagationcontroller.config.PropagationControllerConfig;
import io.propagationcontroller.evaluation.PropagationEvaluator;
import io.propagationcontroller.metrics.MetricsProvider;
import io.propagationcontroller.placement.ClusterFilter;
import io.propagationcontroller.placement.LexicographicUnitRankingStrategy;
import io.propagationcontroller.placement.PlacementResolver;
import io.propagationcontroller.placement.ScoredUnitRankingStrategy;
import io.propagationcontroller.placement.SpreadGrouper;
import io.propagationcontroller.placement.UnitRankingStrategy;
import io.propagationcontroller.placement.UnitScorer;
import io.propagationcontroller.placement.UnitSelector;
import io.propagationcontroller.selector.ResourceSelectorMatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import static io.propagationcontroller.config.Constants.UNIT_RANKING_CLUSTER_COUNT;

/**
 * Main Spring Boot application class for the Propagation Controller.
 * 
 * Wires the placement engine (cluster filter, spread grouper, unit selector, resolver)
 * and the resource selector matcher into a PropagationEvaluator exposed over REST.
 * Every bean is stateless apart from its configuration.
 */
@Slf4j
@SpringBootApplication
public class PropagationControllerApplication {

    public static void main(String[] args) {
        log.info("Starting Propagation Controller Application");
        
        try {
            SpringApplication.run(PropagationControllerApplication.class, args);
            log.info("Propagation Controller started successfully");
        } catch (Exception e) {
            log.error("Failed to start Propagation Controller: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
    
    @Bean
    @Primary
    public PropagationControllerConfig config() {
        PropagationControllerConfig config = new PropagationControllerConfig();
        log.info("Loaded configuration");
        return config;
    }
    
    @Bean
    public MetricsProvider metricsProvider(MeterRegistry meterRegistry, PropagationControllerConfig config) {
        return new MetricsProvider(meterRegistry, config.getControllerId());
    }
    
    @Bean
    public UnitRankingStrategy unitRankingStrategy(PropagationControllerConfig config) {
        if (UNIT_RANKING_CLUSTER_COUNT.equals(config.getUnitRanking())) {
            log.info("Initializing cluster-count unit ranking");
            return new ScoredUnitRankingStrategy(UnitScorer.CLUSTER_COUNT, "ClusterCount");
        }
        log.info("Initializing lexicographic unit ranking");
        return new LexicographicUnitRankingStrategy();
    }
    
    @Bean
    public PlacementResolver placementResolver(PropagationControllerConfig config, UnitRankingStrategy unitRankingStrategy) {
        log.info("Initializing PlacementResolver (count empty-key unit: {})", config.isCountEmptyKeyUnit());
        return new PlacementResolver(
            new ClusterFilter(),
            new SpreadGrouper(),
            new UnitSelector(unitRankingStrategy, config.isCountEmptyKeyUnit()));
    }
    
    @Bean
    public ResourceSelectorMatcher resourceSelectorMatcher() {
        return new ResourceSelectorMatcher();
    }
    
    @Bean
    public PropagationEvaluator propagationEvaluator(ResourceSelectorMatcher resourceSelectorMatcher,
                                                     PlacementResolver placementResolver,
                                                     MetricsProvider metricsProvider,
                                                     PropagationControllerConfig config) {
        log.info("Initializing PropagationEvaluator for scheduler '{}'", config.getSchedulerName());
        return new PropagationEvaluator(resourceSelectorMatcher, placementResolver, metricsProvider,
            config.getSchedulerName());
    }
}
