package com.sailfish.taskengine.support;

import com.sailfish.taskengine.offline.ConnectivityListener;
import com.sailfish.taskengine.offline.ConnectivitySignal;

import java.util.ArrayList;
import java.util.List;

public class FakeConnectivity implements ConnectivitySignal {

    private final List<ConnectivityListener> listeners = new ArrayList<>();
    private boolean online;

    public FakeConnectivity(boolean online) {
        this.online = online;
    }

    public void goOnline() {
        online = true;
        new ArrayList<>(listeners).forEach(ConnectivityListener::onOnline);
    }

    public void goOffline() {
        online = false;
        new ArrayList<>(listeners).forEach(ConnectivityListener::onOffline);
    }

    @Override
    public boolean isOnline() {
        return online;
    }

    @Override
    public void addListener(ConnectivityListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeListener(ConnectivityListener listener) {
        listeners.remove(listener);
    }
}
