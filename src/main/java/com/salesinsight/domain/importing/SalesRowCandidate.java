package com.salesinsight.domain.importing;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A validated sales row. Keys are normalized names; product and store are
 * optional, the customer is not.
 */
@Value
@Builder
public class SalesRowCandidate {

    int rowNumber;
    LocalDate saleDate;

    String customerName;
    String customerKey;

    String productName;
    String productKey;
    String category;

    String storeName;
    String storeCode;
    String storeKey;
    String region;
    String channel;

    String agentCode;

    BigDecimal quantity;
    BigDecimal unitPrice;
    BigDecimal amount;

    public boolean hasProduct() {
        return productKey != null;
    }

    public boolean hasStore() {
        return storeKey != null;
    }
}
