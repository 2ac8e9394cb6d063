package com.phillippitts.feedercontrol.service.device;

/**
 * Connection state of the device link.
 */
public enum LinkState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED
}
