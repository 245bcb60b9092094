package dev.dapbridge.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SetBreakpointsResult(List<Breakpoint> breakpoints) {

    public SetBreakpointsResult {
        breakpoints = breakpoints == null ? List.of() : List.copyOf(breakpoints);
    }
}
