package com.dikit.core.sql;

import com.dikit.core.model.FieldNode;
import com.dikit.core.model.ModelNode;
import com.dikit.core.model.Relation;
import com.dikit.core.model.RelationType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link DependencyOrder}.
 */
class DependencyOrderTest {

    private static ModelNode model(String name, String... references) {
        List<FieldNode> fields = new ArrayList<>();
        fields.add(FieldNode.builder("id", "int").primaryKey(true).build());
        for (String target : references) {
            fields.add(FieldNode.builder(target + "_id", "int").build());
            fields.add(FieldNode.builder(target, target)
                .relation(new Relation(RelationType.MANY_TO_ONE, target + "_id"))
                .build());
        }
        return new ModelNode(name, fields, List.of(), 1, 1);
    }

    private static List<String> names(List<ModelNode> models) {
        return models.stream().map(ModelNode::name).toList();
    }

    @Test
    void sort_placesReferencedModelsFirst() {
        List<ModelNode> sorted = DependencyOrder.sort(List.of(
            model("comment", "post", "author"),
            model("post", "author"),
            model("author")));

        assertThat(names(sorted)).containsExactly("author", "post", "comment");
    }

    @Test
    void sort_keepsDeclarationOrderForIndependentModels() {
        List<ModelNode> sorted = DependencyOrder.sort(List.of(model("b"), model("a"), model("c")));

        assertThat(names(sorted)).containsExactly("b", "a", "c");
    }

    @Test
    void sort_ignoresSelfReferences() {
        List<ModelNode> sorted = DependencyOrder.sort(List.of(model("employee", "employee"), model("team")));

        assertThat(names(sorted)).containsExactly("employee", "team");
    }

    @Test
    void sort_withCycle_appendsRemainingModelsInDeclarationOrder() {
        List<ModelNode> sorted = DependencyOrder.sort(List.of(
            model("a", "b"),
            model("b", "a"),
            model("c")));

        assertThat(names(sorted)).containsExactly("c", "a", "b");
    }

    @Test
    void isForeignKeyField_requiresLocalColumn() {
        FieldNode relation = FieldNode.builder("owner", "user")
            .relation(new Relation(RelationType.MANY_TO_ONE, "owner_id"))
            .build();
        ModelNode withColumn = new ModelNode("pet",
            List.of(FieldNode.builder("owner_id", "int").build(), relation), List.of(), 1, 1);
        ModelNode withoutColumn = new ModelNode("pet", List.of(relation), List.of(), 1, 1);

        assertThat(DependencyOrder.isForeignKeyField(withColumn, relation)).isTrue();
        assertThat(DependencyOrder.isForeignKeyField(withoutColumn, relation)).isFalse();
    }
}
