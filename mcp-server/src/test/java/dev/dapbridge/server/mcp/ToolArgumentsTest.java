package dev.dapbridge.server.mcp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import org.junit.jupiter.api.Test;

class ToolArgumentsTest {

    @Test
    void integersAcceptWholeDecimals() {
        ToolArguments arguments = ToolArguments.of(Map.of("line", 12.0, "frame", 3));

        assertThat(arguments.integer("line")).isEqualTo(12);
        assertThat(arguments.integer("frame")).isEqualTo(3);
        assertThat(arguments.optionalInteger("missing")).isNull();
    }

    @Test
    void fractionalNumbersAreRejected() {
        ToolArguments arguments = ToolArguments.of(Map.of("line", 1.5));

        assertThatThrownBy(() -> arguments.integer("line"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("whole number");
    }

    @Test
    void wrongTypesAreRejected() {
        ToolArguments arguments = ToolArguments.of(Map.of("line", "12", "file", 5, "flag", "yes"));

        assertThatThrownBy(() -> arguments.integer("line")).hasMessage("line must be a number");
        assertThatThrownBy(() -> arguments.string("file")).hasMessage("file must be a string");
        assertThatThrownBy(() -> arguments.bool("flag")).hasMessage("flag must be a boolean");
    }

    @Test
    void requireStringRejectsBlankValues() {
        ToolArguments arguments = ToolArguments.of(Map.of("expression", "  "));

        assertThatThrownBy(() -> arguments.requireString("expression"))
            .hasMessage("expression is required and must be a non-empty string");
        assertThat(arguments.bool("absent")).isFalse();
    }
}
