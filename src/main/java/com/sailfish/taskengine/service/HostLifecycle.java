package com.sailfish.taskengine.service;

/**
 * Lifecycle signals from the host process.
 */
public interface HostLifecycle {

    /**
     * No-op lifecycle for hosts that never suspend or tear down explicitly.
     */
    HostLifecycle NONE = new HostLifecycle() {
        @Override
        public void addForegroundListener(Runnable listener) {
        }

        @Override
        public void addTeardownListener(Runnable listener) {
        }
    };

    /**
     * Registers a callback for when the host regains the foreground. Timers may
     * have been skipped while it was in the background.
     */
    void addForegroundListener(Runnable listener);

    /**
     * Registers a callback for when the host is about to shut down.
     */
    void addTeardownListener(Runnable listener);
}
