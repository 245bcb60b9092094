package dev.dapbridge.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ThreadsResult(List<DapThread> threads) {

    public ThreadsResult {
        threads = threads == null ? List.of() : List.copyOf(threads);
    }
}
