package com.openforge.connectors.tool;

import com.openforge.connectors.error.ToolArgumentException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ToolSchemaTest {

    private final ToolSchema schema = ToolSchema.builder()
            .required("a", ParamType.INTEGER, "First operand")
            .optional("mode", ParamType.STRING, "Rounding mode", "floor").oneOf("floor", "ceil")
            .optional("limit", ParamType.INTEGER, "Page size", 100).between(1, 1000)
            .optional("tags", ParamType.ARRAY, "Labels").items(ParamType.STRING)
            .build();

    @Test
    void rendersDeterministicJsonSchemaInDeclarationOrder() {
        String expected = "{\"type\":\"object\",\"properties\":{"
                + "\"a\":{\"type\":\"integer\",\"description\":\"First operand\"},"
                + "\"mode\":{\"type\":\"string\",\"description\":\"Rounding mode\",\"enum\":[\"floor\",\"ceil\"],\"default\":\"floor\"},"
                + "\"limit\":{\"type\":\"integer\",\"description\":\"Page size\",\"minimum\":1.0,\"maximum\":1000.0,\"default\":100},"
                + "\"tags\":{\"type\":\"array\",\"description\":\"Labels\",\"items\":{\"type\":\"string\"}}},"
                + "\"required\":[\"a\"],\"additionalProperties\":false}";

        assertThat(schema.toJson().toString()).isEqualTo(expected);
        assertThat(schema.toJson().toString()).isEqualTo(schema.toJson().toString());
    }

    @Test
    void validArgumentsGetDefaultsFilledIn() {
        Map<String, Object> normalized = schema.validate("math_add", Map.of("a", 3));

        assertThat(normalized).containsExactly(
                Map.entry("a", 3L),
                Map.entry("mode", "floor"),
                Map.entry("limit", 100));
    }

    @Test
    void wrongParameterNameIsRejectedWithEveryViolation() {
        assertThatThrownBy(() -> schema.validate("math_add", Map.of("b", "x")))
                .isInstanceOf(ToolArgumentException.class)
                .satisfies(e -> assertThat(((ToolArgumentException) e).violations())
                        .containsExactly("unexpected argument 'b'", "missing required argument 'a'"));
    }

    @Test
    void laxCoercionAcceptsNumericStringsAndIntegralDoubles() {
        assertThat(schema.validate("t", Map.of("a", "42")).get("a")).isEqualTo(42L);
        assertThat(schema.validate("t", Map.of("a", 7.0)).get("a")).isEqualTo(7L);
    }

    @Test
    void rejectsFractionalIntegersEnumMissesAndOutOfRangeValues() {
        assertThatThrownBy(() -> schema.validate("t", Map.of("a", 1.5)))
                .isInstanceOf(ToolArgumentException.class)
                .hasMessageContaining("'a' must be of type integer");
        assertThatThrownBy(() -> schema.validate("t", Map.of("a", 1, "mode", "round")))
                .hasMessageContaining("'mode' must be one of [floor, ceil]");
        assertThatThrownBy(() -> schema.validate("t", Map.of("a", 1, "limit", 0)))
                .hasMessageContaining("'limit' must be >= 1");
    }

    @Test
    void arrayItemsAreCheckedIndividually() {
        assertThat(schema.validate("t", Map.of("a", 1, "tags", List.of("x", "y"))).get("tags"))
                .isEqualTo(List.of("x", "y"));
        assertThatThrownBy(() -> schema.validate("t", Map.of("a", 1, "tags", List.of("x", Map.of()))))
                .hasMessageContaining("'tags[1]' must be of type string");
    }

    @Test
    void declarationMistakesFailFast() {
        assertThatThrownBy(() -> ToolSchema.builder()
                .required("a", ParamType.STRING, null)
                .required("a", ParamType.STRING, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ToolSchema.builder().required("a", ParamType.STRING, null).items(ParamType.STRING))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void toolNamesAreSnakeCasedAndNamespaced() {
        assertThat(ToolNames.namespaced("slack", "sendMessage")).isEqualTo("slack_send_message");
        assertThat(ToolNames.normalize("Send-Message!")).isEqualTo("send_message");
    }
}
