package com.example.summaryscheduler.mapper;

import com.example.summaryscheduler.domain.entity.RecurrenceRule;
import com.example.summaryscheduler.domain.entity.ScheduledTask;
import com.example.summaryscheduler.domain.entity.SummaryOptions;
import com.example.summaryscheduler.domain.entity.TaskExecutionResult;
import com.example.summaryscheduler.dto.CreateTaskRequest;
import com.example.summaryscheduler.dto.ExecutionResultResponse;
import com.example.summaryscheduler.dto.TaskResponse;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

import java.util.List;

/**
 * MapStruct mapper for converting between domain objects and DTOs
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE, imports = SummaryOptions.class)
public interface TaskMapper {

    /**
     * Convert a create request into an unscheduled task
     */
    @Mapping(target = "recurrence", source = ".")
    @Mapping(target = "summaryOptions", source = "summaryOptions", defaultExpression = "java(SummaryOptions.defaults())")
    ScheduledTask toTask(CreateTaskRequest request);

    @Mapping(target = "type", source = "scheduleType")
    RecurrenceRule toRecurrence(CreateTaskRequest request);

    TaskResponse toResponse(ScheduledTask task);

    List<TaskResponse> toResponseList(List<ScheduledTask> tasks);

    ExecutionResultResponse toResultResponse(TaskExecutionResult result);

    List<ExecutionResultResponse> toResultResponses(List<TaskExecutionResult> results);
}
