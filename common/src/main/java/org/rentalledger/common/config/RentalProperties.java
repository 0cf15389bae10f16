package org.rentalledger.common.config;

import lombok.Getter;
import lombok.Setter;
import org.rentalledger.common.enums.LowStockBoundary;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Type-safe view of the {@code rental.*} settings in application.yml.
 */
@Component
@ConfigurationProperties(prefix = "rental")
@Getter
@Setter
public class RentalProperties {

    /**
     * Prefix put in front of notes appended by a return, so they can be told apart from the
     * notes written at creation.
     */
    private String returnNoteTag = "[Return]";

    /**
     * Seeds a handful of demo products on startup when the catalog is empty.
     */
    private boolean seedSampleData = false;

    private AtomicUnitSettings atomicUnit = new AtomicUnitSettings();
    private Stock stock = new Stock();
    private OverdueSweep overdueSweep = new OverdueSweep();

    @Getter
    @Setter
    public static class AtomicUnitSettings {
        // upper bound for a whole create/return/complete/cancel/sweep unit
        private Duration timeout = Duration.ofSeconds(10);
    }

    @Getter
    @Setter
    public static class Stock {
        private LowStockBoundary lowStockBoundary = LowStockBoundary.INCLUSIVE;
    }

    @Getter
    @Setter
    public static class OverdueSweep {
        private boolean enabled = true;
        private String cron = "0 */5 * * * *";
    }
}
