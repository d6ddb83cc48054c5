package org.nostrtv.core.router;

import org.nostrtv.core.protocol.Event;

/**
 * Handles one kind of validated event. Exceptions are logged by the router and do not stop it.
 */
@FunctionalInterface
public interface EventHandler {
    void handle(Event event) throws Exception;
}
