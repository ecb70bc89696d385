package com.deepansh.gateway.response;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.UUID;

/**
 * Identifiers for responses and their output items.
 *
 * Response ids are {@code resp_} followed by a version 7 UUID: the leading 48 bits are
 * the Unix time in milliseconds, so ids sort roughly by creation time.
 */
public final class ResponseIds {

    public static final String RESPONSE_PREFIX = "resp_";
    public static final String MESSAGE_ITEM_PREFIX = "msg_";

    private static final SecureRandom RANDOM = new SecureRandom();

    private ResponseIds() {
    }

    public static String newResponseId() {
        return RESPONSE_PREFIX + uuidV7(System.currentTimeMillis());
    }

    public static String newMessageItemId() {
        byte[] bytes = new byte[16];
        RANDOM.nextBytes(bytes);
        return MESSAGE_ITEM_PREFIX + HexFormat.of().formatHex(bytes);
    }

    static UUID uuidV7(long epochMillis) {
        byte[] random = new byte[10];
        RANDOM.nextBytes(random);

        long msb = (epochMillis & 0xFFFFFFFFFFFFL) << 16;
        msb |= 0x7000L;
        msb |= ((random[0] & 0x0FL) << 8) | (random[1] & 0xFFL);

        long lsb = 0;
        for (int i = 2; i < 10; i++) {
            lsb = (lsb << 8) | (random[i] & 0xFFL);
        }
        lsb = (lsb & 0x3FFFFFFFFFFFFFFFL) | 0x8000000000000000L;

        return new UUID(msb, lsb);
    }
}
