package com.salesinsight.domain.importing;

import lombok.Value;

import java.util.UUID;

/**
 * Entity ids a sales row resolved to. Product and store may be null.
 */
@Value
public class ResolvedEntities {

    UUID customerId;
    UUID productId;
    UUID storeId;
}
