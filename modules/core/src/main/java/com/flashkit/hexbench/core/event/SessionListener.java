package com.flashkit.hexbench.core.event;

/**
 * Receives session events on the thread that caused them.
 */
@FunctionalInterface
public interface SessionListener {

    void onEvent(SessionEvent event);
}
