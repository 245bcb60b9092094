package dev.dapbridge.client;

import dev.dapbridge.client.model.SetBreakpointsResult;
import java.util.Map;

/**
 * Result of {@link DapClient#launchAndConfigure}: the launch handle and, per file, what the debugger
 * made of the breakpoints sent during configuration.
 */
public record LaunchOutcome(PendingLaunch launch, Map<String, SetBreakpointsResult> breakpoints) {

    public LaunchOutcome {
        breakpoints = Map.copyOf(breakpoints);
    }
}
