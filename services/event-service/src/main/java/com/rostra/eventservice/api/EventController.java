package com.rostra.eventservice.api;

import com.rostra.eventbus.EventBus;
import com.rostra.eventbus.EventDispatcher;
import com.rostra.eventbus.RunningDispatcher;
import com.rostra.eventmodel.DomainEvent;
import com.rostra.eventmodel.EventSerializer;
import com.rostra.eventservice.pipeline.EventPipelineLifecycle;
import com.rostra.eventservice.pipeline.EventTransportBootstrap;
import com.rostra.eventservice.projection.EntityActivity;
import com.rostra.eventservice.projection.EntityActivityProjection;
import jakarta.validation.Valid;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Producer and status API for operators and admin tooling.
 *
 * <p>Publishing is fire-and-forget: 202 means the event passed validation and entered the bus,
 * not that any handler or the transport has seen it.
 */
@RestController
@RequestMapping("/api/v1/events")
public class EventController {

    private static final Logger log = LoggerFactory.getLogger(EventController.class);

    private final EventBus bus;
    private final EventDispatcher dispatcher;
    private final EventPipelineLifecycle pipeline;
    private final EventTransportBootstrap transport;
    private final EntityActivityProjection projection;

    public EventController(
            EventBus bus,
            EventDispatcher dispatcher,
            EventPipelineLifecycle pipeline,
            EventTransportBootstrap transport,
            EntityActivityProjection projection) {
        this.bus = bus;
        this.dispatcher = dispatcher;
        this.pipeline = pipeline;
        this.transport = transport;
        this.projection = projection;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.ACCEPTED)
    public PublishEventResponse publish(@Valid @RequestBody PublishEventRequest request) {
        DomainEvent event = EventSerializer.readEvent(request.eventType(), request.data());
        UUID id = bus.publish(request.tenantId(), request.actorId(), event);
        log.info("Accepted {} event {} for tenant {}", request.eventType(), id, request.tenantId());
        return new PublishEventResponse(id, event.eventType().value());
    }

    @GetMapping("/status")
    public Map<String, Object> status() {
        Map<String, Object> busStatus = new LinkedHashMap<>();
        busStatus.put("capacity", bus.capacity());
        busStatus.put("subscribers", bus.subscriberCount());
        busStatus.put("closed", bus.isClosed());

        Map<String, Object> dispatcherStatus = new LinkedHashMap<>();
        dispatcherStatus.put("state", dispatcher.state().name());
        dispatcherStatus.put("handlers", dispatcher.handlerNames());
        dispatcherStatus.put("processed",
                pipeline.dispatcher().map(RunningDispatcher::processedCount).orElse(0L));
        dispatcherStatus.put("tripped",
                pipeline.dispatcher().map(RunningDispatcher::trippedHandlers).orElse(List.of()));

        Map<String, Object> transportStatus = new LinkedHashMap<>();
        transportStatus.put("status", transport.status().name());
        transport.transport().ifPresent(t -> {
            transportStatus.put("mode", t.mode().name());
            transportStatus.put("stream", t.stream());
            transportStatus.put("reliability", t.reliabilityLevel().name());
        });
        transport.failure().ifPresent(reason -> transportStatus.put("failure", reason));
        pipeline.forwarder().ifPresent(f -> {
            transportStatus.put("forwarded", f.forwardedCount());
            transportStatus.put("failed", f.failedCount());
        });

        Map<String, Object> status = new LinkedHashMap<>();
        status.put("bus", busStatus);
        status.put("dispatcher", dispatcherStatus);
        status.put("transport", transportStatus);
        return status;
    }

    @GetMapping("/entities/{id}")
    public EntityActivity entity(@PathVariable("id") UUID id) {
        return projection.get(id);
    }
}
