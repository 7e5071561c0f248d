package io.github.galkahana.extractionrunner;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one task that reached completion or exhausted its retries.
 * Created once by the worker that processed the task, never mutated afterwards.
 *
 * @param taskId Identity of the task in the remote repository
 * @param displayName Document name, written as {@code document_id}
 * @param status Terminal status
 * @param note Optional free text (error description, extraction remarks)
 * @param usage Optional token usage reported by the extraction service
 * @param fields Extracted structure, empty for failures
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResult(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("document_id") String displayName,
        @JsonProperty("read_status") TaskStatus status,
        @JsonProperty("comment") String note,
        @JsonProperty("usage") Usage usage,
        @JsonProperty("fields") Map<String, Object> fields) {

    /**
     * Input/output units consumed by the extraction service for one task.
     */
    public record Usage(
            @JsonProperty("input_tokens") long inputUnits,
            @JsonProperty("output_tokens") long outputUnits) {

        public static final Usage NONE = new Usage(0, 0);
    }

    public TaskResult {
        Objects.requireNonNull(status, "status");
        fields = fields == null ? Map.of() : Map.copyOf(fields);
    }

    public static TaskResult success(Task task, Map<String, Object> fields, Usage usage) {
        return new TaskResult(task.id(), task.displayName(), TaskStatus.SUCCESS, null, usage, fields);
    }

    public static TaskResult failed(Task task, String note) {
        return new TaskResult(task.id(), task.displayName(), TaskStatus.FAILED, note, null, Map.of());
    }

    /**
     * Extraction clients do not know the repository id, so the worker stamps it onto their result.
     */
    public TaskResult withTask(Task task) {
        String name = displayName != null && !displayName.isBlank() ? displayName : task.displayName();
        return new TaskResult(task.id(), name, status, note, usage, fields);
    }

    @JsonIgnore
    public Usage usageOrNone() {
        return usage != null ? usage : Usage.NONE;
    }
}
