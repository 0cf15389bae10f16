package org.rentalledger.common.util;

import java.util.UUID;

public class IdGenerator {

    public static String generateTransactionId() {
        return "rent-" + UUID.randomUUID();
    }

    public static String generateLineId() {
        return "line-" + UUID.randomUUID();
    }
}
