package io.github.galkahana.extractionrunner;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Terminal status of a single task.
 */
public enum TaskStatus {
    SUCCESS("success"),
    PARTIAL_SUCCESS("partial_success"),
    FAILED("failed");

    private final String wireName;

    TaskStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Unknown or missing values map to {@link #FAILED}, so a malformed extraction never counts as a success.
     */
    @JsonCreator
    public static TaskStatus fromWireName(String value) {
        if (value != null) {
            for (TaskStatus status : values()) {
                if (status.wireName.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                    return status;
                }
            }
        }
        return FAILED;
    }
}
