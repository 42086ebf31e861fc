package com.ragguard.util;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class AttributeValuesTest {

    @Test
    void shouldSplitPipeDelimitedStrings() {
        assertThat(AttributeValues.toStringList(" finance | execs ||")).containsExactly("finance", "execs");
    }

    @Test
    void shouldFlattenCollectionsAndScalars() {
        assertThat(AttributeValues.toStringList(Arrays.asList("a|b", null, " c ")))
                .containsExactly("a", "b", "c");
        assertThat(AttributeValues.toStringList(42)).containsExactly("42");
        assertThat(AttributeValues.toStringList(null)).isEmpty();
    }

    @Test
    void shouldReturnFirstNonBlankValue() {
        assertThat(AttributeValues.firstString(Arrays.asList(" ", "first", "second"), "none")).isEqualTo("first");
        assertThat(AttributeValues.firstString("", "none")).isEqualTo("none");
        assertThat(AttributeValues.firstString(null, "none")).isEqualTo("none");
    }

    @Test
    void shouldJoinWithPipe() {
        assertThat(AttributeValues.join(List.of("a", "b"))).isEqualTo("a|b");
        assertThat(AttributeValues.join(null)).isEmpty();
    }
}
