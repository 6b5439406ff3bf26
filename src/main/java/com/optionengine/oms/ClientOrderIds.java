package com.optionengine.oms;

import java.util.Locale;
import java.util.UUID;

/**
 * Client order ids are generated before submission so a fill racing the placement call can
 * still be matched. Twenty characters, which fits the Kite order tag.
 */
public final class ClientOrderIds {

    public static final int LENGTH = 20;

    private static final String PREFIX = "OX";

    private ClientOrderIds() {}

    public static String next() {
        String hex = UUID.randomUUID().toString().replace("-", "").toUpperCase(Locale.ROOT);
        return PREFIX + hex.substring(0, LENGTH - PREFIX.length());
    }
}
