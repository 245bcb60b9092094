package dev.dapbridge.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record VariablesResult(List<Variable> variables) {

    public VariablesResult {
        variables = variables == null ? List.of() : List.copyOf(variables);
    }
}
