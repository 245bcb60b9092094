package dev.dapbridge.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ScopesResult(List<Scope> scopes) {

    public ScopesResult {
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
    }
}
