package com.salesinsight.domain.importing;

import com.salesinsight.domain.exception.RowValidationException;
import com.salesinsight.infrastructure.persistence.entity.CustomerEntity;
import com.salesinsight.infrastructure.persistence.entity.MasterDataEntity;
import com.salesinsight.infrastructure.persistence.entity.ProductEntity;
import com.salesinsight.infrastructure.persistence.entity.StoreEntity;
import com.salesinsight.infrastructure.persistence.repository.CustomerRepository;
import com.salesinsight.infrastructure.persistence.repository.MasterDataRepository;
import com.salesinsight.infrastructure.persistence.repository.ProductRepository;
import com.salesinsight.infrastructure.persistence.repository.StoreRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Lookup-or-create of customers, products and stores by normalized name,
 * and maintenance of their running aggregates.
 *
 * Concurrency:
 * - The insert of a new entity runs in its own (REQUIRES_NEW) transaction
 *   and is flushed immediately, so a lost race surfaces right here as a
 *   unique-constraint violation on normalized_name
 * - The loser re-reads and uses the winner's row
 * - A violation with no competing row behind it is the row's own fault
 *   (a value the table rejects) and rejects that row only
 * - Aggregates are changed with a single UPDATE ... SET x = x + :delta
 *
 * A created entity stays even if the row that created it later rolls back;
 * it simply has no facts yet.
 */
@Slf4j
@Component
public class EntityResolver {

    enum Kind {
        CUSTOMER,
        PRODUCT,
        STORE
    }

    private final CustomerRepository customerRepository;
    private final ProductRepository productRepository;
    private final StoreRepository storeRepository;
    private final TransactionTemplate insertTemplate;

    public EntityResolver(CustomerRepository customerRepository,
                          ProductRepository productRepository,
                          StoreRepository storeRepository,
                          PlatformTransactionManager transactionManager) {
        this.customerRepository = customerRepository;
        this.productRepository = productRepository;
        this.storeRepository = storeRepository;
        this.insertTemplate = new TransactionTemplate(transactionManager);
        this.insertTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public ResolverSession openSession() {
        return new ResolverSession();
    }

    /**
     * Resolve the entities a sales row refers to, creating missing ones.
     */
    public ResolvedEntities resolve(SalesRowCandidate row, ResolverSession session) {
        UUID customerId = lookupOrCreate(Kind.CUSTOMER, customerRepository, row.getCustomerKey(), session,
                () -> CustomerEntity.builder()
                        .name(row.getCustomerName())
                        .normalizedName(row.getCustomerKey())
                        .region(row.getRegion())
                        .build());

        UUID productId = null;
        if (row.hasProduct()) {
            productId = lookupOrCreate(Kind.PRODUCT, productRepository, row.getProductKey(), session,
                    () -> ProductEntity.builder()
                            .name(row.getProductName())
                            .normalizedName(row.getProductKey())
                            .category(row.getCategory() != null ? row.getCategory() : ProductEntity.DEFAULT_CATEGORY)
                            .listPrice(row.getUnitPrice())
                            .build());
        }

        UUID storeId = null;
        if (row.hasStore()) {
            storeId = lookupOrCreate(Kind.STORE, storeRepository, row.getStoreKey(), session,
                    () -> StoreEntity.builder()
                            .name(row.getStoreName())
                            .normalizedName(row.getStoreKey())
                            .code(row.getStoreCode())
                            .region(row.getRegion())
                            .channel(row.getChannel())
                            .build());
        }

        return new ResolvedEntities(customerId, productId, storeId);
    }

    /**
     * Add one fact's amount to every referenced entity's aggregates.
     * Must run in the same transaction as the fact insert.
     */
    public void applyContribution(ResolvedEntities entities, BigDecimal amount, LocalDate saleDate) {
        customerRepository.incrementAggregates(entities.getCustomerId(), amount, saleDate);
        if (entities.getProductId() != null) {
            productRepository.incrementAggregates(entities.getProductId(), amount, saleDate);
        }
        if (entities.getStoreId() != null) {
            storeRepository.incrementAggregates(entities.getStoreId(), amount, saleDate);
        }
    }

    /**
     * Create or update a customer from a master-data row. Attributes present
     * in the row overwrite stored ones; aggregates are left alone.
     */
    public UUID upsertCustomer(MasterDataCandidate row, ResolverSession session) {
        UUID id = lookupOrCreate(Kind.CUSTOMER, customerRepository, row.getKey(), session,
                () -> CustomerEntity.builder()
                        .name(row.getName())
                        .normalizedName(row.getKey())
                        .region(row.getRegion())
                        .email(row.getEmail())
                        .phone(row.getPhone())
                        .build());

        customerRepository.findById(id).ifPresent(customer -> {
            customer.setName(row.getName());
            if (row.getRegion() != null) {
                customer.setRegion(row.getRegion());
            }
            if (row.getEmail() != null) {
                customer.setEmail(row.getEmail());
            }
            if (row.getPhone() != null) {
                customer.setPhone(row.getPhone());
            }
            customerRepository.save(customer);
        });
        return id;
    }

    public UUID upsertProduct(MasterDataCandidate row, ResolverSession session) {
        UUID id = lookupOrCreate(Kind.PRODUCT, productRepository, row.getKey(), session,
                () -> ProductEntity.builder()
                        .name(row.getName())
                        .normalizedName(row.getKey())
                        .category(row.getCategory() != null ? row.getCategory() : ProductEntity.DEFAULT_CATEGORY)
                        .sku(row.getSku())
                        .listPrice(row.getPrice())
                        .build());

        productRepository.findById(id).ifPresent(product -> {
            product.setName(row.getName());
            if (row.getCategory() != null) {
                product.setCategory(row.getCategory());
            }
            if (row.getSku() != null) {
                product.setSku(row.getSku());
            }
            if (row.getPrice() != null) {
                product.setListPrice(row.getPrice());
            }
            productRepository.save(product);
        });
        return id;
    }

    <T extends MasterDataEntity> UUID lookupOrCreate(Kind kind,
                                                    MasterDataRepository<T> repository,
                                                    String normalizedName,
                                                    ResolverSession session,
                                                    Supplier<T> factory) {
        Map<String, UUID> known = session.cacheFor(kind);
        UUID cached = known.get(normalizedName);
        if (cached != null) {
            return cached;
        }

        Optional<T> existing = repository.findByNormalizedName(normalizedName);
        if (existing.isPresent()) {
            known.put(normalizedName, existing.get().getId());
            return existing.get().getId();
        }

        try {
            T created = insertTemplate.execute(status -> repository.saveAndFlush(factory.get()));
            UUID id = created.getId();
            known.put(normalizedName, id);
            session.recordCreated(id);
            log.debug("Created {} '{}' ({})", kind, normalizedName, id);
            return id;

        } catch (DataIntegrityViolationException e) {
            // another import inserted the same name first; read theirs
            Optional<T> winner = repository.findByNormalizedName(normalizedName);
            if (winner.isPresent()) {
                log.debug("Lost create race for {} '{}'", kind, normalizedName);
                known.put(normalizedName, winner.get().getId());
                return winner.get().getId();
            }
            throw new RowValidationException("cannot store " + kind + " '" + normalizedName + "': "
                    + e.getMostSpecificCause().getMessage(), e);
        }
    }
}
