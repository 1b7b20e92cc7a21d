package com.loanorigination.repository;

import com.loanorigination.model.Product;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ProductRepository extends JpaRepository<Product, String> {

    Optional<Product> findByTenantIdAndProductId(String tenantId, String productId);
}
