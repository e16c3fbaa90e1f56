package com.modelweave.expr.script.sandbox;

import com.modelweave.expr.api.model.Metamodel;
import com.modelweave.expr.api.model.Model;
import com.modelweave.expr.api.model.ModelElement;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ScriptContextBuilderTest {

    private final ScriptContextBuilder builder = new ScriptContextBuilder();

    private final ModelElement p1 = new ModelElement("p1", "Place", Map.of("name", "P1", "tokens", 3));
    private final ModelElement p2 = new ModelElement("p2", "Place", Map.of("name", "P2", "tokens", 0));
    private final ModelElement t1 = new ModelElement("t1", "Transition", Map.of("name", "T1"),
            Map.of("inputs", List.of("p1", "missing", "p2"), "output", "p2", "dangling", "nope"));
    private final Model model = new Model("m1", "Net", "mm1", List.of(p1, p2, t1));
    private final Metamodel metamodel = new Metamodel("mm1", "PetriNets", List.of());

    @Test
    @DisplayName("self should carry style, id and type")
    @SuppressWarnings("unchecked")
    void selfCarriesStyleIdAndType() {
        Map<String, Object> self = (Map<String, Object>) builder.build(p1, model, metamodel).get("self");

        assertThat(self).containsEntry("name", "P1")
                .containsEntry("tokens", 3)
                .containsEntry("id", "p1")
                .containsEntry("type", "Place");
    }

    @Test
    @DisplayName("References should be expanded into the referenced elements, dropping unknown ids")
    @SuppressWarnings("unchecked")
    void referencesExpanded() {
        Map<String, Object> self = builder.selfView(t1, model);

        List<Map<String, Object>> inputs = (List<Map<String, Object>>) self.get("inputs");
        assertThat(inputs).extracting(m -> m.get("id")).containsExactly("p1", "p2");
        assertThat((Map<String, Object>) self.get("output")).containsEntry("tokens", 0);
        assertThat(self).doesNotContainKey("dangling");
    }

    @Test
    @DisplayName("model should list flattened elements and metamodel only id and name")
    @SuppressWarnings("unchecked")
    void modelAndMetamodelViews() {
        Map<String, Object> context = builder.build(p1, model, metamodel);

        Map<String, Object> modelView = (Map<String, Object>) context.get("model");
        assertThat(modelView).containsEntry("id", "m1").containsEntry("name", "Net");
        assertThat((List<Map<String, Object>>) modelView.get("elements"))
                .hasSize(3)
                .first()
                .satisfies(e -> assertThat(e).containsEntry("type", "Place").containsEntry("name", "P1"));
        assertThat((Map<String, Object>) context.get("metamodel"))
                .containsOnlyKeys("id", "name")
                .containsEntry("name", "PetriNets");
    }
}
