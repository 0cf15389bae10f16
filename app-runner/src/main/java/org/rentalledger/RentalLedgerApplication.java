package org.rentalledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = {
        "org.rentalledger.common",
        "org.rentalledger.inventory",
        "org.rentalledger.rental",
        "org.rentalledger.coreconfig"
})
@EnableJpaRepositories(basePackages = {
        "org.rentalledger.inventory",
        "org.rentalledger.rental"
})
@EntityScan(basePackages = {
        "org.rentalledger.inventory",
        "org.rentalledger.rental"
})
@EnableScheduling
public class RentalLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(RentalLedgerApplication.class, args);
    }
}
