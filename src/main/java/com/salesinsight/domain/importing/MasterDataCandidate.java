package com.salesinsight.domain.importing;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A validated customer or product row. Attributes that are null leave the
 * stored value alone on upsert.
 */
@Value
@Builder
public class MasterDataCandidate {

    int rowNumber;
    String name;
    String key;

    // customers
    String region;
    String email;
    String phone;

    // products
    String category;
    String sku;
    BigDecimal price;
}
