package com.sailfish.taskengine.offline;

/**
 * A zero-argument unit of work whose execution can be postponed.
 */
@FunctionalInterface
public interface DeferredOperation {

    void run() throws Exception;
}
