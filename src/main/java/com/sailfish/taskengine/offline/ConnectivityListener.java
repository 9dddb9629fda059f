package com.sailfish.taskengine.offline;

/**
 * Receives connectivity changes from a {@link ConnectivitySignal}.
 */
public interface ConnectivityListener {

    void onOnline();

    void onOffline();
}
