package org.pragmatica.exprjson;

import org.junit.jupiter.api.Test;
import org.pragmatica.exprjson.emit.EmitException;
import org.pragmatica.exprjson.parser.ParserConfig;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExprJsonTest {

    @Test
    void toJson_pretty_byDefault() {
        assertThat(ExprJson.toJson("1")).isEqualTo("""
            {
              "kind": "Lit",
              "attrs": [],
              "lit": {
                "kind": "Int",
                "value": "1",
                "suffix": null
              }
            }""");
    }

    @Test
    void toJson_compact() {
        assertThat(ExprJson.toJson("x", false))
            .isEqualTo("{\"kind\":\"Path\",\"attrs\":[],\"qself\":null,\"path\":\"x\"}");
    }

    @Test
    void toValue_scenario() {
        var value = ExprJson.toValue("1 + 2 * 3");

        assertThat(value.get("right").get("op").asText()).isEqualTo("*");
    }

    @Test
    void toValue_parseFailure_throwsWithDiagnostic() {
        assertThatThrownBy(() -> ExprJson.toValue(""))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("expression:1:1: error: unexpected end of input, expected expression");
    }

    @Test
    void toJson_longFlatChain_written() {
        var json = ExprJson.toJson("a" + " + a".repeat(250), false);

        assertThat(json).startsWith("{\"kind\":\"Binary\",\"attrs\":[],\"left\":{\"kind\":\"Binary\"");
    }

    @Test
    void toValue_chainOverNestingLimit_throwsWithDiagnostic() {
        assertThatThrownBy(() -> ExprJson.toValue("a" + " + a".repeat(600)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("expression nesting exceeds the limit of 256 levels");
    }

    @Test
    void toJson_unencodableString_throwsEmitException() {
        assertThatThrownBy(() -> ExprJson.toJson("\"\uD800\""))
            .isInstanceOf(EmitException.class);
    }

    @Test
    void parse_withConfig_appliesLimit() {
        assertThat(ExprJson.parse("((1))", new ParserConfig(2)).isFailure()).isTrue();
        assertThat(ExprJson.parse("((1))").isSuccess()).isTrue();
    }
}
