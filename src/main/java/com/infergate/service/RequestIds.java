package com.infergate.service;

import java.util.UUID;

/**
 * Correlation ids of the form {@code chatcmpl-} followed by 24 lowercase hex characters.
 */
public final class RequestIds {

    public static final String PREFIX = "chatcmpl-";
    private static final int HEX_LENGTH = 24;

    private RequestIds() {
        // Utility class, no instantiation
    }

    public static String newId() {
        return PREFIX + UUID.randomUUID().toString().replace("-", "").substring(0, HEX_LENGTH);
    }
}
