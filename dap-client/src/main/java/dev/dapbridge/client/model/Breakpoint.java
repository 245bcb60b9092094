package dev.dapbridge.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A breakpoint as reported back by the debugger. {@code line} may differ from the requested line
 * when the debugger moved it to the nearest executable line.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Breakpoint(Integer id, boolean verified, Integer line, String message, Source source) {
}
