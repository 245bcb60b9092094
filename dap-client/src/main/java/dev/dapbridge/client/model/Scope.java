package dev.dapbridge.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A variable scope of a stack frame; Godot reports Locals, Members and Globals.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Scope(String name, int variablesReference, boolean expensive, Integer namedVariables,
                    Integer indexedVariables) {
}
