package com.welie.gattlink.adapter;

/**
 * Power state of the local Bluetooth adapter.
 */
public enum AdapterState {
    UNKNOWN,
    RESETTING,
    UNSUPPORTED,
    UNAUTHORIZED,
    POWERED_OFF,
    POWERED_ON
}
