package com.deepansh.gateway.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UsageTest {

    private final Usage a = new Usage(3, 4);
    private final Usage b = new Usage(10, 1);
    private final Usage c = new Usage(0, 7);

    @Test
    void plus_isAssociativeAndCommutative() {
        assertThat(a.plus(b).plus(c)).isEqualTo(a.plus(b.plus(c)));
        assertThat(a.plus(b)).isEqualTo(b.plus(a));
    }

    @Test
    void total_alwaysEqualsPromptPlusCompletion() {
        Usage sum = Usage.sum(Usage.sum(a, b), c);

        assertThat(sum.totalTokens()).isEqualTo(sum.promptTokens() + sum.completionTokens());
        assertThat(sum.totalTokens()).isEqualTo(25);
    }

    @Test
    void nullOperand_countsAsZero() {
        assertThat(a.plus(null)).isEqualTo(a);
        assertThat(Usage.sum(null, a)).isEqualTo(a);
        assertThat(Usage.sum(null, null)).isEqualTo(Usage.ZERO);
    }

    @Test
    void json_carriesDerivedTotal() {
        String json = JsonSupport.write(a);

        assertThat(json).contains("\"prompt_tokens\":3", "\"completion_tokens\":4", "\"total_tokens\":7");
    }

    @Test
    void json_ignoresReportedTotal() throws Exception {
        Usage parsed = JsonSupport.mapper().readValue(
                "{\"prompt_tokens\":2,\"completion_tokens\":5,\"total_tokens\":99}", Usage.class);

        assertThat(parsed.totalTokens()).isEqualTo(7);
    }
}
