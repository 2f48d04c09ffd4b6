package com.lifecycle.core.service;

import com.lifecycle.core.service.archive.ArchiveManager;
import com.lifecycle.core.service.cleanup.CleanupManager;
import com.lifecycle.core.service.facade.ArchiveCriteria;
import com.lifecycle.core.service.facade.ArchiveOptions;
import com.lifecycle.core.service.facade.ArchiveSubmission;
import com.lifecycle.core.service.facade.StorageFacade;
import com.lifecycle.core.service.job.JobStatus;
import com.lifecycle.core.service.testutil.TestLifecycle;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Smoke tests for the data lifecycle service.
 *
 * Boots the full context against a temporary storage tree.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class DataLifecycleServiceSmokeTest {

    private static final Path ROOT;

    static {
        try {
            ROOT = Files.createTempDirectory("lifecycle-smoke");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @DynamicPropertySource
    static void storageProperties(DynamicPropertyRegistry registry) {
        registry.add("lifecycle.storage.base-dir", () -> ROOT.resolve("storage").toString());
        registry.add("lifecycle.archive.archive-path", () -> ROOT.resolve("archives").toString());
        registry.add("lifecycle.archive.temp-path", () -> ROOT.resolve("restore").toString());
        registry.add("lifecycle.persistence.data-dir", () -> ROOT.resolve("data").toString());
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private StorageFacade storageFacade;

    @Autowired
    private ArchiveManager archiveManager;

    @Autowired
    private CleanupManager cleanupManager;

    @Test
    void contextLoadsAndSeedsDefaults() {
        assertThat(archiveManager.listPolicies()).hasSize(2);
        assertThat(cleanupManager.listPolicies()).hasSize(3);
    }

    @Test
    void healthEndpointReportsLifecycleStorage() throws Exception {
        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.components.lifecycle.status").value("UP"))
                .andExpect(jsonPath("$.components.lifecycle.details.archiveRootWritable").value(true));
    }

    @Test
    void lifecycleMetricsAreRegistered() throws Exception {
        mockMvc.perform(get("/actuator/metrics/lifecycle.cleanup.completed"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("lifecycle.cleanup.completed"));
        mockMvc.perform(get("/actuator/metrics/lifecycle.archive.jobs.running"))
                .andExpect(status().isOk());
    }

    @Test
    void archiveThroughFacade() throws IOException {
        Path reports = Files.createDirectories(ROOT.resolve("storage/reports"));
        TestLifecycle.writeAged(reports.resolve("q1.csv"), 512, Instant.now().minus(60, ChronoUnit.DAYS));

        ArchiveSubmission submission = storageFacade.archive(
                ArchiveCriteria.builder().sourcePath("reports").olderThanDays(30).build(),
                ArchiveOptions.builder().name("smoke").build());

        assertThat(submission.job().getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(submission.job().getItemsProcessed()).isEqualTo(1);
    }
}
