package com.lifecycle.core.service.facade;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * What to archive.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArchiveCriteria {

    private String sourcePath;

    @Builder.Default
    private List<String> files = new ArrayList<>();

    private Integer olderThanDays;

    private String policyId;
}
