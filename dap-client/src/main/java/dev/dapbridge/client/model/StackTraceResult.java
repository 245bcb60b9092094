package dev.dapbridge.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StackTraceResult(List<StackFrame> stackFrames, Integer totalFrames) {

    public StackTraceResult {
        stackFrames = stackFrames == null ? List.of() : List.copyOf(stackFrames);
    }
}
