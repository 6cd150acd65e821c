package com.snapkeeper.core.handler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The ordered, process-wide list of enabled event handlers.
 * <p>
 * Built once at startup from the configured handler types and the available
 * {@link EventHandler} beans. Every worker subscribes to exactly this list, in
 * this order. The pipeline holds no mutable state after construction.
 */
public final class EventHandlerPipeline {

    private static final Logger log = LoggerFactory.getLogger(EventHandlerPipeline.class);

    private final List<HandlerType> types;
    private final List<EventHandler> handlers;

    private EventHandlerPipeline(List<HandlerType> types, List<EventHandler> handlers) {
        this.types = List.copyOf(types);
        this.handlers = List.copyOf(handlers);
    }

    /**
     * Assembles the pipeline.
     *
     * @param enabled   handler types in delivery order
     * @param available all handler implementations known to the application
     * @return pipeline containing the enabled types that have an implementation
     * @throws IllegalStateException if two implementations claim the same type
     */
    public static EventHandlerPipeline of(List<HandlerType> enabled, Collection<? extends EventHandler> available) {
        Map<HandlerType, EventHandler> byType = new EnumMap<>(HandlerType.class);
        for (EventHandler handler : available) {
            EventHandler previous = byType.put(handler.type(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate event handlers for " + handler.type() + ": "
                        + previous.getClass().getName() + " and " + handler.getClass().getName());
            }
        }

        var types = new ArrayList<HandlerType>();
        var handlers = new ArrayList<EventHandler>();
        for (HandlerType type : enabled) {
            if (types.contains(type)) {
                log.warn("Event handler {} listed more than once, keeping the first position", type);
                continue;
            }
            EventHandler handler = byType.get(type);
            if (handler == null) {
                log.warn("Event handler {} is enabled but no implementation is registered, leaving it out", type);
                continue;
            }
            types.add(type);
            handlers.add(handler);
        }
        log.info("Event handler pipeline: {}", types);
        return new EventHandlerPipeline(types, handlers);
    }

    public static EventHandlerPipeline empty() {
        return new EventHandlerPipeline(List.of(), List.of());
    }

    /** Active handler types, in delivery order. */
    public List<HandlerType> types() {
        return types;
    }

    /** Active handlers, in delivery order. */
    public List<EventHandler> handlers() {
        return handlers;
    }
}
