package com.example.summaryscheduler.domain.repository;

import com.example.summaryscheduler.domain.entity.DeliveryOutcome;
import com.example.summaryscheduler.domain.entity.Destination;
import com.example.summaryscheduler.domain.entity.RecurrenceRule;
import com.example.summaryscheduler.domain.entity.ScheduledTask;
import com.example.summaryscheduler.domain.entity.SummaryOptions;
import com.example.summaryscheduler.domain.entity.TaskExecutionResult;
import com.example.summaryscheduler.domain.enums.DestinationType;
import com.example.summaryscheduler.domain.enums.ErrorKind;
import com.example.summaryscheduler.domain.enums.ExecutionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

@DisplayName("JsonFileTaskStore Tests")
class JsonFileTaskStoreTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    @TempDir
    Path storageDir;

    private JsonFileTaskStore store;

    @BeforeEach
    void setUp() {
        store = new JsonFileTaskStore(storageDir, 3, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private ScheduledTask task(String id) {
        return ScheduledTask.builder()
                .id(id)
                .name("Digest " + id)
                .sourceRef("channel-" + id)
                .sourceGroup("guild-1")
                .recurrence(RecurrenceRule.daily(LocalTime.of(9, 0)))
                .createdAt(NOW.minus(Duration.ofDays(1)))
                .build();
    }

    @Nested
    @DisplayName("Task records")
    class TaskRecordTests {

        @Test
        @DisplayName("Should preserve every field through save and load")
        void shouldRoundTripAllFields() {
            // Given
            var task = ScheduledTask.builder()
                    .id("weekly-report")
                    .name("Weekly report")
                    .sourceRef("channel-42")
                    .sourceGroup("guild-7")
                    .recurrence(RecurrenceRule.weekly(LocalTime.of(17, 30), List.of(DayOfWeek.MONDAY, DayOfWeek.FRIDAY)))
                    .destinations(List.of(
                            Destination.builder().type(DestinationType.CHANNEL).target("channel-99").format("embed").build(),
                            Destination.builder().type(DestinationType.WEBHOOK).target("https://hooks.example.com/x").enabled(false).build()))
                    .summaryOptions(SummaryOptions.builder().summaryLength("brief").model("gpt-4o").minItems(10)
                            .extra(Map.of("language", "en")).build())
                    .active(false)
                    .createdAt(NOW.minus(Duration.ofDays(10)))
                    .createdBy("user-1")
                    .updatedAt(NOW)
                    .lastRun(NOW.minus(Duration.ofHours(3)))
                    .nextRun(NOW.plus(Duration.ofHours(5)))
                    .runCount(12)
                    .failureCount(2)
                    .maxFailures(5)
                    .retryDelayMinutes(15)
                    .lastError("Summary service unavailable")
                    .lastErrorKind(ErrorKind.INFRASTRUCTURE)
                    .lastExecutionStatus(ExecutionStatus.FAILED)
                    .insufficientContentCount(4)
                    .build();

            // When
            store.save(task);
            var loaded = store.load("weekly-report");

            // Then
            assertThat(loaded).contains(task);
        }

        @Test
        @DisplayName("Should keep the seconds of the time of day")
        void shouldKeepSecondsOfTimeOfDay() {
            var task = task("t1");
            task.setRecurrence(RecurrenceRule.daily(LocalTime.of(9, 0, 30)));

            store.save(task);

            var loaded = store.load("t1").orElseThrow();
            assertThat(loaded.getRecurrence().getTimeOfDay()).isEqualTo(LocalTime.of(9, 0, 30));
            assertThat(loaded).isEqualTo(task);
        }

        @Test
        @DisplayName("Should drop the lock of a deleted task")
        void shouldDropLockOnDelete() {
            store.save(task("t1"));
            store.save(task("t2"));

            store.delete("t1");

            assertThat(store.lockCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should write snake_case JSON with an is_active flag")
        void shouldWriteSnakeCase() throws IOException {
            store.save(task("t1"));

            var json = Files.readString(storageDir.resolve("t1.json"));

            assertThat(json).contains("\"source_ref\"", "\"is_active\"", "\"next_run\"");
        }

        @Test
        @DisplayName("Should skip a corrupt record and load the valid ones")
        void shouldSkipCorruptRecords() throws IOException {
            // Given
            store.save(task("t1"));
            store.save(task("t2"));
            store.save(task("t3"));
            Files.writeString(storageDir.resolve("broken.json"), "{ not json");

            // When
            var tasks = store.loadAll();

            // Then
            assertThat(tasks).extracting(ScheduledTask::getId).containsExactlyInAnyOrder("t1", "t2", "t3");
        }

        @Test
        @DisplayName("Should return empty for an unknown or malformed id")
        void shouldReturnEmptyForUnknownId() {
            assertThat(store.load("missing")).isEmpty();
            assertThat(store.load("../etc/passwd")).isEmpty();
        }

        @Test
        @DisplayName("Should not recreate a deleted task on update")
        void shouldNotRecreateOnUpdate() {
            var task = task("t1");
            store.save(task);
            assertThat(store.delete("t1")).isTrue();

            task.setRunCount(5);
            var updated = store.update(task);

            assertThat(updated).isFalse();
            assertThat(store.load("t1")).isEmpty();
        }

        @Test
        @DisplayName("Should report whether delete removed anything")
        void shouldReportDelete() {
            store.save(task("t1"));

            assertThat(store.delete("t1")).isTrue();
            assertThat(store.delete("t1")).isFalse();
        }

        @Test
        @DisplayName("Should leave no temp files behind")
        void shouldLeaveNoTempFiles() throws IOException {
            var task = task("t1");
            store.save(task);
            task.setRunCount(1);
            store.update(task);

            try (var files = Files.list(storageDir)) {
                assertThat(files.filter(Files::isRegularFile).map(file -> file.getFileName().toString()))
                        .containsExactly("t1.json");
            }
        }

        @Test
        @DisplayName("Should list tasks by source or source group")
        void shouldListBySource() {
            store.save(task("t1"));
            var other = task("t2");
            other.setSourceGroup("guild-2");
            store.save(other);

            assertThat(store.listBySource("channel-t1")).extracting(ScheduledTask::getId).containsExactly("t1");
            assertThat(store.listBySource("guild-1")).extracting(ScheduledTask::getId).containsExactly("t1");
            assertThat(store.listBySource("guild-2")).extracting(ScheduledTask::getId).containsExactly("t2");
        }
    }

    @Nested
    @DisplayName("Execution results")
    class ResultTests {

        private TaskExecutionResult result(String taskId, Instant completedAt) {
            var result = TaskExecutionResult.success(taskId, "artifact-" + completedAt.getEpochSecond());
            result.setDeliveryResults(List.of(DeliveryOutcome.builder()
                    .destinationType(DestinationType.FILE).target("/tmp/out").success(true).message("written").build()));
            return result.timed(completedAt.minusSeconds(5), completedAt);
        }

        @Test
        @DisplayName("Should return results newest first up to the limit")
        void shouldReturnNewestFirst() {
            store.save(task("t1"));
            store.saveResult(result("t1", NOW.minusSeconds(30)));
            store.saveResult(result("t1", NOW.minusSeconds(20)));
            store.saveResult(result("t1", NOW.minusSeconds(10)));

            var results = store.loadResults("t1", 2);

            assertThat(results).extracting(TaskExecutionResult::getCompletedAt)
                    .containsExactly(NOW.minusSeconds(10), NOW.minusSeconds(20));
            assertThat(results.get(0).getDeliveryResults()).hasSize(1);
        }

        @Test
        @DisplayName("Should keep only the most recent results per task")
        void shouldTrimHistory() {
            store.save(task("t1"));
            for (var i = 4; i >= 0; i--) {
                store.saveResult(result("t1", NOW.minusSeconds(i * 10L)));
            }

            assertThat(store.loadResults("t1", 10)).hasSize(3);
        }

        @Test
        @DisplayName("Should remove results completed before the cutoff")
        void shouldCleanupOldResults() {
            store.save(task("t1"));
            store.saveResult(result("t1", NOW.minus(Duration.ofDays(40))));
            store.saveResult(result("t1", NOW.minus(Duration.ofDays(1))));

            var removed = store.cleanupResultsOlderThan(NOW.minus(Duration.ofDays(30)));

            assertThat(removed).isEqualTo(1);
            assertThat(store.loadResults("t1", 10)).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Cleanup")
    class CleanupTests {

        @Test
        @DisplayName("Should only remove tasks that are inactive and older than the threshold")
        void shouldRemoveOnlyOldInactiveTasks() {
            // Given
            var oldInactive = task("old-inactive");
            oldInactive.setActive(false);
            oldInactive.setLastRun(NOW.minus(Duration.ofDays(40)));

            var oldActive = task("old-active");
            oldActive.setLastRun(NOW.minus(Duration.ofDays(40)));

            var recentInactive = task("recent-inactive");
            recentInactive.setActive(false);
            recentInactive.setLastRun(NOW.minus(Duration.ofDays(2)));

            store.save(oldInactive);
            store.save(oldActive);
            store.save(recentInactive);

            // When
            var removed = store.cleanupOlderThan(30);

            // Then
            assertThat(removed).isEqualTo(1);
            assertThat(store.loadAll()).extracting(ScheduledTask::getId)
                    .containsExactlyInAnyOrder("old-active", "recent-inactive");
        }

        @Test
        @DisplayName("Should measure inactivity from the moment the task was paused")
        void shouldKeepRecentlyPausedOldTask() {
            // Given - created and last run long ago, paused an hour ago
            var paused = task("paused");
            paused.setCreatedAt(NOW.minus(Duration.ofDays(40)));
            paused.setLastRun(NOW.minus(Duration.ofDays(35)));
            paused.setActive(false);
            paused.setUpdatedAt(NOW.minus(Duration.ofHours(1)));

            var longPaused = task("long-paused");
            longPaused.setCreatedAt(NOW.minus(Duration.ofDays(40)));
            longPaused.setActive(false);
            longPaused.setUpdatedAt(NOW.minus(Duration.ofDays(31)));

            store.save(paused);
            store.save(longPaused);

            // When
            var removed = store.cleanupOlderThan(30);

            // Then
            assertThat(removed).isEqualTo(1);
            assertThat(store.load("paused")).isPresent();
            assertThat(store.load("long-paused")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Export and import")
    class ExportImportTests {

        @Test
        @DisplayName("Should import every task of an export")
        void shouldImportExport(@TempDir Path otherDir) {
            store.save(task("t1"));
            store.save(task("t2"));
            var exportFile = otherDir.resolve("backup/tasks.json");

            assertThat(store.export(exportFile)).isTrue();

            var target = new JsonFileTaskStore(otherDir.resolve("store"), 3, Clock.fixed(NOW, ZoneOffset.UTC));
            assertThat(target.importFrom(exportFile)).isEqualTo(2);
            assertThat(target.loadAll()).extracting(ScheduledTask::getId).containsExactlyInAnyOrder("t1", "t2");
        }

        @Test
        @DisplayName("Should carry execution history through export and import")
        void shouldExportHistory(@TempDir Path otherDir) {
            // Given
            store.save(task("t1"));
            store.saveResult(TaskExecutionResult.failure("t1", ErrorKind.TIMEOUT, "Content fetch timed out")
                    .timed(NOW.minusSeconds(70), NOW.minusSeconds(60)));
            store.saveResult(TaskExecutionResult.success("t1", "artifact-1").timed(NOW.minusSeconds(20), NOW.minusSeconds(10)));
            var exportFile = otherDir.resolve("tasks.json");
            store.export(exportFile);

            // When
            var target = new JsonFileTaskStore(otherDir.resolve("store"), 3, Clock.fixed(NOW, ZoneOffset.UTC));
            var imported = target.importFrom(exportFile);

            // Then
            assertThat(imported).isEqualTo(1);
            assertThat(target.load("t1")).contains(store.load("t1").orElseThrow());
            assertThat(target.loadResults("t1", 10))
                    .extracting(TaskExecutionResult::getArtifactId, TaskExecutionResult::getErrorKind)
                    .containsExactly(
                            tuple("artifact-1", null),
                            tuple(null, ErrorKind.TIMEOUT));
        }

        @Test
        @DisplayName("Should skip records rejected by the validator")
        void shouldSkipRejectedRecords(@TempDir Path otherDir) {
            store.save(task("t1"));
            store.save(task("t2"));
            var exportFile = otherDir.resolve("tasks.json");
            store.export(exportFile);

            var target = new JsonFileTaskStore(otherDir.resolve("store"), 3, Clock.fixed(NOW, ZoneOffset.UTC));
            var imported = target.importFrom(exportFile, task -> {
                if (task.getId().equals("t2")) {
                    throw new IllegalArgumentException("rejected");
                }
            });

            assertThat(imported).isEqualTo(1);
            assertThat(target.loadAll()).extracting(ScheduledTask::getId).containsExactly("t1");
        }

        @Test
        @DisplayName("Should write the export header")
        void shouldWriteExportHeader(@TempDir Path otherDir) throws IOException {
            store.save(task("t1"));
            var exportFile = otherDir.resolve("tasks.json");

            store.export(exportFile);

            assertThat(Files.readString(exportFile)).contains("\"export_date\"", "\"task_count\" : 1", "\"tasks\"");
        }

        @Test
        @DisplayName("Should import valid records and skip invalid ones")
        void shouldSkipInvalidRecords(@TempDir Path otherDir) throws IOException {
            var exportFile = otherDir.resolve("tasks.json");
            Files.writeString(exportFile, """
                    {
                      "export_date": "2024-03-01T00:00:00Z",
                      "task_count": 3,
                      "tasks": [
                        {"id": "good-1", "name": "Good", "source_ref": "c1", "recurrence": {"type": "DAILY", "time_of_day": "09:00"}},
                        {"id": "bad id!", "name": "Bad", "source_ref": "c2", "recurrence": {"type": "DAILY"}},
                        {"id": "no-schedule", "name": "Missing", "source_ref": "c3"}
                      ]
                    }
                    """);

            var imported = store.importFrom(exportFile);

            assertThat(imported).isEqualTo(1);
            assertThat(store.load("good-1")).isPresent();
        }

        @Test
        @DisplayName("Should import nothing from an unreadable file")
        void shouldReturnZeroForUnreadableFile(@TempDir Path otherDir) throws IOException {
            var exportFile = otherDir.resolve("tasks.json");
            Files.writeString(exportFile, "not json at all");

            assertThat(store.importFrom(exportFile)).isZero();
            assertThat(store.importFrom(otherDir.resolve("missing.json"))).isZero();
        }
    }
}
