package com.welie.gattlink.adapter;

/**
 * The kinds of completion events the native stack reports for commands.
 *
 * <p>Completions carry no request identifier, so they are matched to callers by kind alone.
 */
public enum ResponseKind {
    SERVICES_DISCOVERED,
    CHARACTERISTICS_DISCOVERED,
    DESCRIPTORS_DISCOVERED,
    CHARACTERISTIC_WRITTEN,
    DESCRIPTOR_READ,
    DESCRIPTOR_WRITTEN,
    NOTIFICATION_STATE_UPDATED,
    RSSI_READ
}
