package com.welie.gattlink;

import com.welie.gattlink.adapter.AdapterState;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * The local Bluetooth adapter is not powered on.
 */
public class AdapterUnavailableException extends GattException {

    private static final long serialVersionUID = 1L;

    @NotNull
    private final AdapterState adapterState;

    public AdapterUnavailableException(@NotNull AdapterState adapterState) {
        super(String.format("Bluetooth adapter is %s, but %s was required", adapterState, AdapterState.POWERED_ON));
        this.adapterState = Objects.requireNonNull(adapterState, "no valid adapter state provided");
    }

    @NotNull
    public AdapterState getAdapterState() {
        return adapterState;
    }
}
