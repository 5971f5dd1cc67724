package io.slot4j.config;

import io.slot4j.BusyIntervalProvider;
import io.slot4j.SchedulingEngine;
import io.slot4j.internal.CachingBusyIntervalProvider;
import io.slot4j.internal.DefaultSchedulingEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Spring Boot auto-configuration entrypoint for the scheduling engine.
 *
 * <p>Without a {@link BusyIntervalProvider} bean the engine knows of no busy time.
 */
@AutoConfiguration
@ConditionalOnClass(SchedulingEngine.class)
@EnableConfigurationProperties(SchedulingProperties.class)
@ConditionalOnProperty(prefix = "slot4j", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(SchedulingAutoConfiguration.class);

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public SchedulingEngine schedulingEngine(SchedulingProperties props, ObjectProvider<BusyIntervalProvider> providers) {
        BusyIntervalProvider provider = providers.getIfAvailable(BusyIntervalProvider::none);
        if (props.isCacheBusyIntervals() && !(provider instanceof CachingBusyIntervalProvider)) {
            provider = new CachingBusyIntervalProvider(provider);
        }
        log.info("Scheduling engine configured zone={} dayStartTime={} dayThreshold={} parallelism={} cacheBusyIntervals={}",
                props.getZone(), props.getDayStartTime(), props.getDayThreshold(), props.getParallelism(),
                props.isCacheBusyIntervals());
        return new DefaultSchedulingEngine(props.toEngineConfig(), provider);
    }
}
