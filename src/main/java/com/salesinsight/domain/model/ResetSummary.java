package com.salesinsight.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What a full reset of the imported data removed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResetSummary {

    private int deletedFacts;
    private int deletedImports;
    private int removedFiles;
}
