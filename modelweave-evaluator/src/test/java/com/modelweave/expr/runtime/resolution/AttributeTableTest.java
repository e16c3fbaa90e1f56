package com.modelweave.expr.runtime.resolution;

import com.modelweave.expr.api.model.MetaAttribute;
import com.modelweave.expr.api.model.MetaClass;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AttributeTableTest {

    private static final MetaClass PLACE = new MetaClass("mc-place", "Place",
            List.of(new MetaAttribute("a1", "tokens", "number"), new MetaAttribute("a2", "capacity", "number")));

    @Test
    @DisplayName("Should fold id, name and legacy keys into one entry per attribute")
    void shouldFoldKeys() {
        AttributeTable table = AttributeTable.of(Map.of("a1", 5, "attr-capacity", 8), PLACE);

        assertThat(table.lookup("tokens")).isEqualTo(5);
        assertThat(table.lookup("a1")).isEqualTo(5);
        assertThat(table.lookup("capacity")).isEqualTo(8);
        assertThat(table.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should prefer a plain key over its legacy variant")
    void shouldPreferPlainKey() {
        AttributeTable table = AttributeTable.of(Map.of("tokens", 6, "attr-tokens", 4), PLACE);

        assertThat(table.lookup("tokens")).isEqualTo(6);
        assertThat(table.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should key by name when the metaclass is unknown")
    void shouldWorkWithoutMetaClass() {
        AttributeTable table = AttributeTable.of(Map.of("tokens", 1, "attr-weight", 2), null);

        assertThat(table.lookup("tokens")).isEqualTo(1);
        assertThat(table.lookup("weight")).isEqualTo(2);
        assertThat(table.contains("capacity")).isFalse();
        assertThat(AttributeTable.of(null, PLACE).size()).isZero();
    }
}
