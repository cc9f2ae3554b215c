package com.userintel.common.reflection;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of one fleet-level reflection sweep.
 *
 * @param processed profiles picked up by the sweep
 * @param skipped   profiles that were no longer eligible or already running
 * @param errors    one entry per failed profile, {@code userId: message}
 */
public record BatchReflectionSummary(
    @JsonProperty("processed") int processed,
    @JsonProperty("succeeded") int succeeded,
    @JsonProperty("failed")    int failed,
    @JsonProperty("skipped")   int skipped,
    @JsonProperty("errors")    List<String> errors
) {
    public BatchReflectionSummary {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static BatchReflectionSummary empty() {
        return new BatchReflectionSummary(0, 0, 0, 0, List.of());
    }
}
