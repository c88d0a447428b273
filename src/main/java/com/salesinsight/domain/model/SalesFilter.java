package com.salesinsight.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.UUID;

/**
 * Optional slice applied to every fact query. Null means "not filtered".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SalesFilter {

    private UUID customerId;
    private UUID productId;
    private UUID storeId;
    private String region;
    private String category;
    private String agentCode;

    public static SalesFilter none() {
        return new SalesFilter();
    }

    public void appendTo(Map<String, Object> cacheParameters) {
        cacheParameters.put("customerId", customerId);
        cacheParameters.put("productId", productId);
        cacheParameters.put("storeId", storeId);
        cacheParameters.put("region", region);
        cacheParameters.put("category", category);
        cacheParameters.put("agentCode", agentCode);
    }
}
