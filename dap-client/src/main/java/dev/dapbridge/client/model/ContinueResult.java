package dev.dapbridge.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ContinueResult(Boolean allThreadsContinued) {

    /** An omitted flag means every thread was resumed. */
    public boolean resumedAllThreads() {
        return allThreadsContinued == null || allThreadsContinued;
    }
}
