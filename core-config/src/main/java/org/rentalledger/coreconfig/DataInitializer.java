package org.rentalledger.coreconfig;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.rentalledger.inventory.entity.Product;
import org.rentalledger.inventory.repository.ProductRepository;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "rental", name = "seed-sample-data", havingValue = "true")
public class DataInitializer implements CommandLineRunner {

    private final ProductRepository productRepository;

    @Override
    @Transactional
    public void run(String... args) {
        initializeCatalog();
    }

    private void initializeCatalog() {
        if (productRepository.count() > 0) {
            log.info("Catalog already populated, skipping sample data: products={}", productRepository.count());
            return;
        }
        log.info("Initializing sample catalog...");

        List<Product> products = List.of(
                sample("PROD-001", "SKU-SCAF-01", "Scaffold frame", "unit", 100, 10, "12.50"),
                sample("PROD-002", "SKU-DRILL-02", "Hammer drill", "unit", 20, 5, "35.00"),
                sample("PROD-003", "SKU-MIX-03", "Concrete mixer", "unit", 4, 2, "80.00"),
                sample("PROD-004", "SKU-PLANK-04", "Steel plank", "m", 250, 50, "2.00"));
        productRepository.saveAll(products);

        log.info("Initialized catalog: PROD-001(100), PROD-002(20), PROD-003(4), PROD-004(250)");
    }

    private Product sample(String productId, String sku, String name, String unit,
                           int stockOnHand, int minimumStock, String unitPrice) {
        Product product = new Product();
        product.setProductId(productId);
        product.setSku(sku);
        product.setName(name);
        product.setUnit(unit);
        product.setStockOnHand(stockOnHand);
        product.setMinimumStock(minimumStock);
        product.setUnitPrice(new BigDecimal(unitPrice));
        return product;
    }
}
