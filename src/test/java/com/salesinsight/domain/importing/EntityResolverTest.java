package com.salesinsight.domain.importing;

import com.salesinsight.domain.exception.RowValidationException;
import com.salesinsight.infrastructure.persistence.entity.CustomerEntity;
import com.salesinsight.infrastructure.persistence.entity.ProductEntity;
import com.salesinsight.infrastructure.persistence.entity.StoreEntity;
import com.salesinsight.infrastructure.persistence.repository.CustomerRepository;
import com.salesinsight.infrastructure.persistence.repository.ProductRepository;
import com.salesinsight.infrastructure.persistence.repository.StoreRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for EntityResolver.
 *
 * The lost-race path is the interesting one: two imports creating the same
 * customer at once must end up pointing at one row.
 */
@ExtendWith(MockitoExtension.class)
class EntityResolverTest {

    @Mock
    private CustomerRepository customerRepository;

    @Mock
    private ProductRepository productRepository;

    @Mock
    private StoreRepository storeRepository;

    @Mock
    private PlatformTransactionManager transactionManager;

    private EntityResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new EntityResolver(customerRepository, productRepository, storeRepository, transactionManager);
    }

    @Test
    void testResolve_ExistingCustomer_NoInsert() {
        // Given
        CustomerEntity ivanov = customer("ivanov");
        when(customerRepository.findByNormalizedName("ivanov")).thenReturn(Optional.of(ivanov));
        ResolverSession session = resolver.openSession();

        // When
        ResolvedEntities entities = resolver.resolve(sale("Ivanov", "ivanov"), session);

        // Then
        assertEquals(ivanov.getId(), entities.getCustomerId());
        assertNull(entities.getProductId());
        assertNull(entities.getStoreId());
        assertTrue(session.getCreatedEntityIds().isEmpty());
        verify(customerRepository, never()).saveAndFlush(any());
    }

    @Test
    void testResolve_NewCustomer_CreatedOnceAndMemoized() {
        // Given
        when(customerRepository.findByNormalizedName("petrov")).thenReturn(Optional.empty());
        when(customerRepository.saveAndFlush(any(CustomerEntity.class))).thenAnswer(inv -> {
            CustomerEntity entity = inv.getArgument(0);
            entity.setId(UUID.randomUUID());
            return entity;
        });
        ResolverSession session = resolver.openSession();

        // When
        ResolvedEntities first = resolver.resolve(sale("Petrov", "petrov"), session);
        ResolvedEntities second = resolver.resolve(sale("PETROV", "petrov"), session);

        // Then
        assertEquals(first.getCustomerId(), second.getCustomerId());
        assertEquals(1, session.getCreatedEntityIds().size());
        assertTrue(session.getCreatedEntityIds().contains(first.getCustomerId()));
        verify(customerRepository, times(1)).findByNormalizedName("petrov");
        verify(customerRepository).saveAndFlush(argThat((CustomerEntity c) -> "Petrov".equals(c.getName())
                && "petrov".equals(c.getNormalizedName())));
    }

    @Test
    void testResolve_ProductAndStore() {
        // Given
        when(customerRepository.findByNormalizedName("ivanov")).thenReturn(Optional.of(customer("ivanov")));
        when(productRepository.findByNormalizedName("widget")).thenReturn(Optional.empty());
        when(productRepository.saveAndFlush(any(ProductEntity.class))).thenAnswer(inv -> {
            ProductEntity entity = inv.getArgument(0);
            entity.setId(UUID.randomUUID());
            return entity;
        });
        StoreEntity store = StoreEntity.builder().id(UUID.randomUUID()).name("Main").normalizedName("s-01").build();
        when(storeRepository.findByNormalizedName("s-01")).thenReturn(Optional.of(store));

        SalesRowCandidate row = SalesRowCandidate.builder()
                .rowNumber(2)
                .saleDate(LocalDate.of(2024, 1, 15))
                .customerName("Ivanov")
                .customerKey("ivanov")
                .productName("Widget")
                .productKey("widget")
                .storeCode("S-01")
                .storeName("S-01")
                .storeKey("s-01")
                .quantity(BigDecimal.ONE)
                .unitPrice(new BigDecimal("10.00"))
                .amount(new BigDecimal("10.00"))
                .build();

        // When
        ResolvedEntities entities = resolver.resolve(row, resolver.openSession());

        // Then
        assertNotNull(entities.getProductId());
        assertEquals(store.getId(), entities.getStoreId());
        verify(productRepository).saveAndFlush(argThat((ProductEntity p) -> ProductEntity.DEFAULT_CATEGORY.equals(p.getCategory())));
    }

    @Test
    void testLookupOrCreate_LostRace_UsesWinnersRow() {
        // Given: the insert hits the unique constraint, the re-read finds the other job's row
        CustomerEntity winner = customer("ivanov");
        when(customerRepository.findByNormalizedName("ivanov"))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(winner));
        when(customerRepository.saveAndFlush(any(CustomerEntity.class)))
                .thenThrow(new DataIntegrityViolationException("duplicate key value violates unique constraint"));
        ResolverSession session = resolver.openSession();

        // When
        ResolvedEntities entities = resolver.resolve(sale("Ivanov", "ivanov"), session);

        // Then
        assertEquals(winner.getId(), entities.getCustomerId());
        assertTrue(session.getCreatedEntityIds().isEmpty());
        verify(customerRepository, times(2)).findByNormalizedName("ivanov");
    }

    @Test
    void testLookupOrCreate_ViolationWithoutCompetingRow_RejectsRow() {
        // Given: the insert is refused but the re-read finds nobody else's row
        when(customerRepository.findByNormalizedName("ivanov")).thenReturn(Optional.empty());
        when(customerRepository.saveAndFlush(any(CustomerEntity.class)))
                .thenThrow(new DataIntegrityViolationException("value too long for type character varying(500)"));
        ResolverSession session = resolver.openSession();

        // When
        RowValidationException e = assertThrows(RowValidationException.class,
                () -> resolver.resolve(sale("Ivanov", "ivanov"), session));

        // Then: one insert, no retries, nothing memoized
        assertEquals("cannot store CUSTOMER 'ivanov': value too long for type character varying(500)", e.getMessage());
        verify(customerRepository, times(1)).saveAndFlush(any(CustomerEntity.class));
        verify(customerRepository, times(2)).findByNormalizedName("ivanov");
        assertTrue(session.getCreatedEntityIds().isEmpty());
    }

    @Test
    void testApplyContribution_OnlyReferencedEntities() {
        // Given
        UUID customerId = UUID.randomUUID();
        UUID storeId = UUID.randomUUID();
        LocalDate date = LocalDate.of(2024, 1, 15);

        // When
        resolver.applyContribution(new ResolvedEntities(customerId, null, storeId), new BigDecimal("100.00"), date);

        // Then
        verify(customerRepository).incrementAggregates(customerId, new BigDecimal("100.00"), date);
        verify(storeRepository).incrementAggregates(storeId, new BigDecimal("100.00"), date);
        verifyNoInteractions(productRepository);
    }

    @Test
    void testUpsertCustomer_UpdatesAttributesOfExisting() {
        // Given
        CustomerEntity existing = customer("сидоров");
        existing.setRegion("North");
        when(customerRepository.findByNormalizedName("сидоров")).thenReturn(Optional.of(existing));
        when(customerRepository.findById(existing.getId())).thenReturn(Optional.of(existing));

        MasterDataCandidate row = MasterDataCandidate.builder()
                .rowNumber(2)
                .name("ИП Сидоров")
                .key("сидоров")
                .email("s@example.com")
                .build();

        // When
        UUID id = resolver.upsertCustomer(row, resolver.openSession());

        // Then
        assertEquals(existing.getId(), id);
        assertEquals("ИП Сидоров", existing.getName());
        assertEquals("s@example.com", existing.getEmail());
        assertEquals("North", existing.getRegion());
        verify(customerRepository).save(existing);
    }

    // Helper methods

    private CustomerEntity customer(String key) {
        return CustomerEntity.builder()
                .id(UUID.randomUUID())
                .name(key)
                .normalizedName(key)
                .build();
    }

    private SalesRowCandidate sale(String customerName, String customerKey) {
        return SalesRowCandidate.builder()
                .rowNumber(2)
                .saleDate(LocalDate.of(2024, 1, 15))
                .customerName(customerName)
                .customerKey(customerKey)
                .quantity(BigDecimal.ONE)
                .unitPrice(new BigDecimal("100.00"))
                .amount(new BigDecimal("100.00"))
                .build();
    }
}
