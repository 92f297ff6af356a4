package com.rostra.eventservice.config;

import com.rostra.eventbus.EventBus;
import com.rostra.eventbus.EventDispatcher;
import com.rostra.eventbus.EventHandler;
import com.rostra.eventservice.pipeline.EventPipelineLifecycle;
import com.rostra.eventservice.pipeline.EventTransportBootstrap;
import com.rostra.observability.EventMetrics;
import com.rostra.observability.MetricFactory;
import com.rostra.observability.MicrometerEventMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the event pipeline. Every bean here lives as long as the application; {@link
 * EventPipelineLifecycle} owns starting and stopping them. The transport is also closed on bean
 * destruction, which covers a refresh that fails before the lifecycle starts.
 */
@Configuration(proxyBeanMethods = false)
public class EventPipelineConfig {

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, EventServiceProperties service) {
        return new MetricFactory(registry, service.name());
    }

    @Bean
    public EventMetrics eventMetrics(MetricFactory metricFactory) {
        return new MicrometerEventMetrics(metricFactory);
    }

    @Bean(destroyMethod = "")
    public EventBus eventBus(EventBusProperties properties, EventMetrics metrics) {
        return new EventBus(properties.capacity(), metrics);
    }

    @Bean(name = "eventTransportBootstrap", destroyMethod = "close")
    public EventTransportBootstrap eventTransport(EventBusProperties properties, EventMetrics metrics) {
        return EventTransportBootstrap.start(properties.transport(), metrics);
    }

    @Bean(destroyMethod = "")
    public EventDispatcher eventDispatcher(
            EventBus bus,
            EventMetrics metrics,
            EventBusProperties properties,
            ObjectProvider<EventHandler> handlers) {
        EventDispatcher dispatcher = new EventDispatcher(bus, metrics, properties.dispatcherOptions());
        handlers.orderedStream().forEach(dispatcher::register);
        return dispatcher;
    }

    @Bean
    public EventPipelineLifecycle eventPipelineLifecycle(
            EventBus bus,
            EventDispatcher dispatcher,
            EventTransportBootstrap transport,
            EventMetrics metrics,
            EventBusProperties properties) {
        return new EventPipelineLifecycle(bus, dispatcher, transport, metrics, properties.pollInterval());
    }
}
