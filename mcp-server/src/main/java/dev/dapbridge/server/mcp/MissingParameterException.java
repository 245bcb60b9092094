package dev.dapbridge.server.mcp;

/**
 * A required tool parameter was absent and has no default.
 */
public class MissingParameterException extends Exception {

    private final String parameter;

    public MissingParameterException(String parameter) {
        super("missing required parameter: " + parameter);
        this.parameter = parameter;
    }

    public String parameter() {
        return parameter;
    }
}
