package org.rentalledger.inventory.repository;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.rentalledger.inventory.entity.Product;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ProductRepository extends JpaRepository<Product, String> {

    String LOCK_TIMEOUT_MS = "3000";

    // PESSIMISTIC_WRITE holds an exclusive row lock until the surrounding transaction commits or
    // rolls back, so the stock check and the decrement cannot interleave with another writer.
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = LOCK_TIMEOUT_MS))
    @Query("SELECT p FROM Product p WHERE p.productId = :productId")
    Optional<Product> findByProductIdWithLock(@Param("productId") String productId);

    // Rows are locked in primary key order so two multi-product reservations never wait on each other in a cycle.
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = LOCK_TIMEOUT_MS))
    @Query("SELECT p FROM Product p WHERE p.productId IN :productIds ORDER BY p.productId")
    List<Product> findAllByProductIdInWithLock(@Param("productIds") Collection<String> productIds);

    @Query("SELECT p.stockOnHand FROM Product p WHERE p.productId = :productId")
    Optional<Integer> findStockOnHandByProductId(@Param("productId") String productId);

    @Query("SELECT p FROM Product p WHERE p.stockOnHand <= p.minimumStock ORDER BY p.stockOnHand, p.productId")
    List<Product> findAtOrBelowMinimumStock();

    @Query("SELECT p FROM Product p WHERE p.stockOnHand < p.minimumStock ORDER BY p.stockOnHand, p.productId")
    List<Product> findBelowMinimumStock();
}
