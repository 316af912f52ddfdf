package com.welie.gattlink;

/**
 * Runs right after notifications of an observed characteristic were enabled, on the first subscription and again on
 * every reconnect. Typical uses are writing a control point or reading an initial value.
 *
 * <p>The action may call the peripheral's operations. It must not connect or disconnect.
 */
@FunctionalInterface
public interface SubscriptionAction {

    void onSubscribed() throws GattException, InterruptedException;
}
