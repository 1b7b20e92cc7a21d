package com.loanorigination.service;

import com.loanorigination.config.RedisConfig;
import com.loanorigination.exception.ResourceNotFoundException;
import com.loanorigination.model.Product;
import com.loanorigination.repository.ProductRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

/**
 * Product lookup, cached per tenant for an hour (see RedisConfig).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProductService {

    private final ProductRepository productRepository;

    @Cacheable(value = RedisConfig.PRODUCTS_CACHE, key = "#tenantId + ':' + #productId")
    public Product getProduct(String tenantId, String productId) {
        log.debug("Cache miss - fetching product {} for tenant {}", productId, tenantId);
        return productRepository.findByTenantIdAndProductId(tenantId, productId)
                .orElseThrow(() -> new ResourceNotFoundException("Product", productId));
    }
}
