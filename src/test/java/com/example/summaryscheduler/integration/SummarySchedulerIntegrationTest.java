package com.example.summaryscheduler.integration;

import com.example.summaryscheduler.domain.entity.ContentItem;
import com.example.summaryscheduler.domain.entity.Destination;
import com.example.summaryscheduler.domain.entity.SummaryArtifact;
import com.example.summaryscheduler.domain.entity.SummaryOptions;
import com.example.summaryscheduler.domain.enums.DestinationType;
import com.example.summaryscheduler.domain.enums.ScheduleType;
import com.example.summaryscheduler.domain.repository.TaskStore;
import com.example.summaryscheduler.dto.CreateTaskRequest;
import com.example.summaryscheduler.service.collaborator.ArtifactProducer;
import com.example.summaryscheduler.service.collaborator.ContentSource;
import com.example.summaryscheduler.service.collaborator.ProductionResult;
import com.example.summaryscheduler.service.scheduler.TaskSchedulerService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.MOCK,
        properties = {
                "spring.main.web-application-type=servlet",
                "slack.enabled=false"
        }
)
@AutoConfigureMockMvc
@DisplayName("Summary Scheduler Integration Tests")
class SummarySchedulerIntegrationTest {

    private static final Path STORAGE_DIR = createTempDir("summary-tasks");
    private static final Path OUTPUT_DIR = createTempDir("summary-output");
    private static final Path BACKUP_DIR = createTempDir("summary-backups");

    @DynamicPropertySource
    static void storageProperties(DynamicPropertyRegistry registry) {
        registry.add("summary-scheduler.storage-path", STORAGE_DIR::toString);
        registry.add("summary-scheduler.backup-dir", BACKUP_DIR::toString);
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TaskSchedulerService schedulerService;

    @Autowired
    private TaskStore taskStore;

    @MockBean
    private ContentSource contentSource;

    @MockBean
    private ArtifactProducer artifactProducer;

    @AfterEach
    void tearDown() {
        taskStore.loadAll().forEach(task -> schedulerService.cancel(task.getId()));
    }

    private static Path createTempDir(String prefix) {
        try {
            return Files.createTempDirectory(prefix);
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }

    private CreateTaskRequest dailyRequest(String id) {
        return CreateTaskRequest.builder()
                .id(id)
                .name("Engineering daily")
                .sourceRef("channel-1")
                .scheduleType(ScheduleType.DAILY)
                .timeOfDay(LocalTime.of(9, 0))
                .destinations(List.of(Destination.builder()
                        .type(DestinationType.FILE)
                        .target(OUTPUT_DIR.toString())
                        .format("markdown")
                        .build()))
                .summaryOptions(SummaryOptions.builder().minItems(2).build())
                .build();
    }

    private String create(CreateTaskRequest request) throws Exception {
        var response = mockMvc.perform(post("/api/v1/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(response).path("data").path("id").asText();
    }

    @Nested
    @DisplayName("Task Creation API")
    class TaskCreationApiTests {

        @Test
        @DisplayName("Should schedule a task via API")
        void shouldScheduleTaskViaApi() throws Exception {
            mockMvc.perform(post("/api/v1/tasks")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(dailyRequest("api-daily"))))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.success").value(true))
                    .andExpect(jsonPath("$.data.id").value("api-daily"))
                    .andExpect(jsonPath("$.data.scheduleType").value("DAILY"))
                    .andExpect(jsonPath("$.data.schedule").value("Daily at 09:00"))
                    .andExpect(jsonPath("$.data.active").value(true))
                    .andExpect(jsonPath("$.data.nextRun").exists());

            assertThat(taskStore.load("api-daily")).isPresent();
        }

        @Test
        @DisplayName("Should reject an invalid schedule without persisting it")
        void shouldRejectInvalidSchedule() throws Exception {
            var request = dailyRequest("bad-weekly");
            request.setScheduleType(ScheduleType.WEEKLY);
            request.setDays(List.of());

            mockMvc.perform(post("/api/v1/tasks")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(request)))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.success").value(false));

            assertThat(taskStore.load("bad-weekly")).isEmpty();
        }

        @Test
        @DisplayName("Should reject a request missing required fields")
        void shouldRejectMissingFields() throws Exception {
            var request = CreateTaskRequest.builder().name("No source").build();

            mockMvc.perform(post("/api/v1/tasks")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(request)))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.errors").isArray());
        }

        @Test
        @DisplayName("Should reject a duplicate task id with a conflict")
        void shouldRejectDuplicate() throws Exception {
            create(dailyRequest("dup"));

            mockMvc.perform(post("/api/v1/tasks")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(dailyRequest("dup"))))
                    .andExpect(status().isConflict());
        }
    }

    @Nested
    @DisplayName("Task Management API")
    class TaskManagementApiTests {

        @Test
        @DisplayName("Should return 404 for an unknown task")
        void shouldReturnNotFound() throws Exception {
            mockMvc.perform(get("/api/v1/tasks/missing"))
                    .andExpect(status().isNotFound());
        }

        @Test
        @DisplayName("Should pause and resume a task")
        void shouldPauseAndResume() throws Exception {
            var id = create(dailyRequest("pausable"));

            mockMvc.perform(post("/api/v1/tasks/{id}/pause", id))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.active").value(false));

            mockMvc.perform(post("/api/v1/tasks/{id}/resume", id))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.active").value(true));
        }

        @Test
        @DisplayName("Should cancel a task")
        void shouldCancelTask() throws Exception {
            var id = create(dailyRequest("cancellable"));

            mockMvc.perform(delete("/api/v1/tasks/{id}", id))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data").value(true));

            mockMvc.perform(delete("/api/v1/tasks/{id}", id))
                    .andExpect(status().isNotFound());
        }

        @Test
        @DisplayName("Should list tasks by source")
        void shouldListBySource() throws Exception {
            create(dailyRequest("listed"));
            var other = dailyRequest("other-source");
            other.setSourceRef("channel-2");
            other.setScheduleType(ScheduleType.WEEKLY);
            other.setDays(List.of(DayOfWeek.MONDAY));
            create(other);

            mockMvc.perform(get("/api/v1/tasks").param("sourceRef", "channel-2"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data", hasSize(1)))
                    .andExpect(jsonPath("$.data[0].id").value("other-source"));
        }

        @Test
        @DisplayName("Should report scheduler stats")
        void shouldReportStats() throws Exception {
            create(dailyRequest("stats"));

            mockMvc.perform(get("/api/v1/tasks/stats"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.running").value(true))
                    .andExpect(jsonPath("$.data.activeTasks").value(1))
                    .andExpect(jsonPath("$.data.nextRunTimes[0].taskId").value("stats"));
        }
    }

    @Nested
    @DisplayName("Manual Runs")
    class ManualRunTests {

        @Test
        @DisplayName("Should run a task now and deliver to its destinations")
        void shouldRunTaskNow() throws Exception {
            // Given
            var id = create(dailyRequest("run-now"));
            var items = IntStream.range(0, 3)
                    .mapToObj(i -> ContentItem.builder().id("m" + i).author("user").content("message " + i).timestamp(Instant.now()).build())
                    .toList();
            when(contentSource.fetch(eq("channel-1"), any(), any(), any())).thenReturn(items);
            when(artifactProducer.produce(any(), anyList())).thenReturn(ProductionResult.produced(SummaryArtifact.builder()
                    .id("artifact-1")
                    .title("Engineering daily")
                    .summaryText("Three messages were exchanged.")
                    .createdAt(Instant.now())
                    .build()));

            // When / Then
            mockMvc.perform(post("/api/v1/tasks/{id}/run", id))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.success").value(true))
                    .andExpect(jsonPath("$.data.artifactId").value("artifact-1"))
                    .andExpect(jsonPath("$.data.deliveryResults", hasSize(1)))
                    .andExpect(jsonPath("$.data.deliveryResults[0].success").value(true));

            mockMvc.perform(get("/api/v1/tasks/{id}/history", id))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data", hasSize(1)));

            mockMvc.perform(get("/api/v1/tasks/{id}/status", id))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.runCount").value(1))
                    .andExpect(jsonPath("$.data.failureCount").value(0));

            try (var files = Files.list(OUTPUT_DIR)) {
                assertThat(files.filter(file -> file.getFileName().toString().startsWith("run-now-"))).hasSize(1);
            }
        }

        @Test
        @DisplayName("Should report insufficient content without counting a failure")
        void shouldReportInsufficientContent() throws Exception {
            var id = create(dailyRequest("quiet"));
            when(contentSource.fetch(eq("channel-1"), any(), any(), any())).thenReturn(List.of());

            mockMvc.perform(post("/api/v1/tasks/{id}/run", id))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.success").value(false))
                    .andExpect(jsonPath("$.data.errorKind").value("INSUFFICIENT_CONTENT"));

            mockMvc.perform(get("/api/v1/tasks/{id}/status", id))
                    .andExpect(jsonPath("$.data.failureCount").value(0))
                    .andExpect(jsonPath("$.data.insufficientContentCount").value(1))
                    .andExpect(jsonPath("$.data.active").value(true));
        }
    }

    @Nested
    @DisplayName("Backup API")
    class BackupApiTests {

        @Test
        @DisplayName("Should export into the backup directory")
        void shouldExportIntoBackupDirectory() throws Exception {
            create(dailyRequest("backed-up"));

            mockMvc.perform(post("/api/v1/tasks/export").param("file", "nightly/tasks.json"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data").value(true));

            assertThat(BACKUP_DIR.resolve("nightly/tasks.json")).exists();
        }

        @Test
        @DisplayName("Should reject backup files outside the backup directory")
        void shouldRejectPathsOutsideBackupDirectory() throws Exception {
            mockMvc.perform(post("/api/v1/tasks/export").param("file", "../escaped.json"))
                    .andExpect(status().isBadRequest());

            mockMvc.perform(post("/api/v1/tasks/import").param("file", STORAGE_DIR.resolve("any.json").toString()))
                    .andExpect(status().isBadRequest());

            assertThat(BACKUP_DIR.resolveSibling("escaped.json")).doesNotExist();
        }
    }
}
