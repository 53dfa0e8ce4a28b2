package io.github.hongjungwan.actionlog.api;

import java.util.Map;

/**
 * Destination for fully formed action messages.
 *
 * <p>Implementations own timestamp formatting, transport and delivery guarantees.
 * Delivery is expected to be synchronous and must not touch the action's own state.</p>
 *
 * <pre>{@code
 * ActionLogger logger = ActionLoggerFactory.getLogger("billing");
 * Action action = Actions.startAction(logger, "billing:charge", Map.of("amount", 100));
 * }</pre>
 */
@FunctionalInterface
public interface ActionLogger {

    /**
     * Deliver one message.
     *
     * @param message field mapping, already serialized
     * @param action  the action the message belongs to, or {@code null} for a message
     *                logged outside any action
     */
    void write(Map<String, Object> message, Action action);
}
