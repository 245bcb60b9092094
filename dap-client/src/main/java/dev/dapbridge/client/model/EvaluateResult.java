package dev.dapbridge.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record EvaluateResult(String result, String type, int variablesReference) {
}
