package com.flashkit.hexbench.core.session;

import org.jboss.logging.Logger;

/**
 * Free-text status sink for operator-facing messages ("Found 3 matches").
 * Supplied to each session, so tests and embedding UIs can capture the stream.
 */
@FunctionalInterface
public interface StatusLog {

    void status(String message);

    /**
     * Routes status messages to a JBoss logger at INFO level.
     */
    static StatusLog jboss(Class<?> category) {
        Logger log = Logger.getLogger(category);
        return message -> log.info(message);
    }
}
