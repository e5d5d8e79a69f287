package net.javahippie.inflo.event;

import java.util.Map;

/**
 * A subscriber callback registered on the {@link EventBus}.
 * The returned value is reported back to the publisher in the handler's {@link HandlerResult}.
 */
@FunctionalInterface
public interface EventHandler {

    Object handle(Map<String, Object> payload) throws Exception;
}
