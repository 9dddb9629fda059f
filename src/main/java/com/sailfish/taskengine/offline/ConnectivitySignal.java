package com.sailfish.taskengine.offline;

/**
 * Host-provided view of network connectivity.
 */
public interface ConnectivitySignal {

    boolean isOnline();

    void addListener(ConnectivityListener listener);

    void removeListener(ConnectivityListener listener);
}
