package com.dikit.core.sql;

import com.dikit.core.model.FieldNode;
import com.dikit.core.model.ModelNode;
import com.dikit.core.model.RelationType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Orders models so that every referenced table precedes the tables referencing it.
 *
 * <p>Edges come from foreign-key relation fields only; many-to-many relations and
 * self-references are ignored. Among models whose dependencies are satisfied, the one
 * declared first is emitted first, so the result is deterministic. Models caught in a
 * cycle are appended in declaration order after a warning.
 */
final class DependencyOrder {

    private static final Logger log = LoggerFactory.getLogger(DependencyOrder.class);

    private DependencyOrder() {
    }

    /**
     * Returns whether a field declares a foreign key owned by its model: a many-to-one or
     * one-to-one relation whose foreign key names a column of the same model.
     */
    static boolean isForeignKeyField(ModelNode model, FieldNode field) {
        if (field.isColumn() || !field.hasRelation() || !field.relation().hasForeignKey()) {
            return false;
        }
        RelationType type = field.relation().type();
        if (type != RelationType.MANY_TO_ONE && type != RelationType.ONE_TO_ONE) {
            return false;
        }
        return model.field(field.relation().foreignKey())
            .map(FieldNode::isColumn)
            .orElse(false);
    }

    static List<ModelNode> sort(List<ModelNode> models) {
        Set<String> names = models.stream().map(ModelNode::name).collect(Collectors.toSet());
        List<ModelNode> pending = new ArrayList<>(models);
        List<ModelNode> ordered = new ArrayList<>(models.size());
        Set<String> emitted = new HashSet<>();

        boolean progressed = true;
        while (!pending.isEmpty() && progressed) {
            progressed = false;
            for (int i = 0; i < pending.size(); i++) {
                ModelNode candidate = pending.get(i);
                Set<String> dependencies = dependencies(candidate, names);
                if (emitted.containsAll(dependencies)) {
                    ordered.add(candidate);
                    emitted.add(candidate.name());
                    pending.remove(i);
                    progressed = true;
                    break;
                }
            }
        }

        if (!pending.isEmpty()) {
            log.warn("Circular foreign key dependency between models {}; creating them in declaration order",
                pending.stream().map(ModelNode::name).toList());
            ordered.addAll(pending);
        }
        return ordered;
    }

    private static Set<String> dependencies(ModelNode model, Set<String> names) {
        Set<String> dependencies = new LinkedHashSet<>();
        for (FieldNode field : model.fields()) {
            if (isForeignKeyField(model, field)
                && names.contains(field.fieldType())
                && !field.fieldType().equals(model.name())) {
                dependencies.add(field.fieldType());
            }
        }
        return dependencies;
    }
}
