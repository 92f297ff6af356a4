package com.rostra.eventservice.pipeline;

import com.rostra.eventbus.EventBus;
import com.rostra.eventbus.EventDispatcher;
import com.rostra.eventbus.EventForwarder;
import com.rostra.eventbus.RunningDispatcher;
import com.rostra.eventtransport.StreamTransport;
import com.rostra.observability.EventMetrics;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Starts the dispatcher and forwarder once the context is ready and tears the pipeline down on
 * shutdown: dispatcher, then forwarder, then transport, then bus.
 *
 * <p>The pipeline runs once. Stopping closes the bus, so a later {@link #start()} is ignored.
 */
public class EventPipelineLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(EventPipelineLifecycle.class);

    private final EventBus bus;
    private final EventDispatcher dispatcher;
    private final EventTransportBootstrap transport;
    private final EventMetrics metrics;
    private final Duration pollInterval;

    private volatile boolean running;
    private volatile boolean stopped;
    private volatile RunningDispatcher runningDispatcher;
    private volatile EventForwarder forwarder;

    public EventPipelineLifecycle(
            EventBus bus,
            EventDispatcher dispatcher,
            EventTransportBootstrap transport,
            EventMetrics metrics,
            Duration pollInterval) {
        this.bus = bus;
        this.dispatcher = dispatcher;
        this.transport = transport;
        this.metrics = metrics;
        this.pollInterval = pollInterval;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        if (stopped) {
            log.warn("Event pipeline was stopped and cannot be restarted; start ignored");
            return;
        }
        runningDispatcher = dispatcher.start();
        transport.transport().ifPresent(t -> forwarder = EventForwarder.start(bus, t, metrics, pollInterval));
        running = true;
        log.info("Event pipeline started: {} handler(s), transport {}",
                dispatcher.handlerNames().size(), transport.status());
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        dispatcher.stop();
        if (forwarder != null) {
            forwarder.stop();
        }
        transport.transport().ifPresent(StreamTransport::close);
        bus.close();
        running = false;
        stopped = true;
        log.info("Event pipeline stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    public Optional<RunningDispatcher> dispatcher() {
        return Optional.ofNullable(runningDispatcher);
    }

    public Optional<EventForwarder> forwarder() {
        return Optional.ofNullable(forwarder);
    }
}
