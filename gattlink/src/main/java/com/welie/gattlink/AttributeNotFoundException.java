package com.welie.gattlink;

import org.jetbrains.annotations.NotNull;

/**
 * The discovered services contain no matching service, characteristic or descriptor.
 */
public class AttributeNotFoundException extends GattException {

    private static final long serialVersionUID = 1L;

    public AttributeNotFoundException(@NotNull String message) {
        super(message);
    }
}
