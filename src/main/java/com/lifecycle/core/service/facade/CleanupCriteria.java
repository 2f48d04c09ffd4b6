package com.lifecycle.core.service.facade;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * What to clean: a retention policy, or an explicit age threshold.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CleanupCriteria {

    private String policyId;
    private String sourcePath;

    @Builder.Default
    private List<String> dataTypes = new ArrayList<>();

    private Integer olderThanDays;
}
