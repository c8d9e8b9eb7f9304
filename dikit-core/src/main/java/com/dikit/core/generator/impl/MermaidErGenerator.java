package com.dikit.core.generator.impl;

import com.dikit.core.generator.ArtifactGenerator;
import com.dikit.core.generator.ArtifactType;
import com.dikit.core.generator.GeneratedArtifact;
import com.dikit.core.generator.GeneratorConfig;
import com.dikit.core.model.FieldNode;
import com.dikit.core.model.ModelNode;
import com.dikit.core.model.RelationType;
import com.dikit.core.model.SchemaNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Generates a Mermaid entity-relationship diagram from a validated schema.
 *
 * <p>Output is Markdown with an embedded {@code ```mermaid} block, suitable for review in
 * GitHub, GitLab or the Mermaid Live Editor. Each model becomes an entity listing its
 * columns with {@code PK}/{@code UK} markers. Relation fields become edges:
 * <ul>
 *   <li>many-to-one: {@code target ||--o{ model}</li>
 *   <li>one-to-one: {@code target ||--|| model}</li>
 *   <li>one-to-many without a matching many-to-one on the other side: {@code model ||--o{ target}</li>
 *   <li>many-to-many (once per pair): {@code a }o--o{ b}</li>
 * </ul>
 *
 * @see <a href="https://mermaid.js.org/syntax/entityRelationshipDiagram.html">Mermaid ER syntax</a>
 */
public class MermaidErGenerator implements ArtifactGenerator {

    private static final Logger log = LoggerFactory.getLogger(MermaidErGenerator.class);

    private static final String GENERATOR_ID = "mermaid-er";
    private static final String GENERATOR_DISPLAY_NAME = "Mermaid ER Diagram Generator";
    private static final String FILE_NAME = "schema-er";

    private static final String CODE_BLOCK_START = "```mermaid\n";
    private static final String CODE_BLOCK_END = "```\n";
    private static final String ER_DIAGRAM = "erDiagram\n";
    private static final String NAME_SANITIZATION_PATTERN = "[^a-zA-Z0-9_]";

    @Override
    public String getId() {
        return GENERATOR_ID;
    }

    @Override
    public String getDisplayName() {
        return GENERATOR_DISPLAY_NAME;
    }

    @Override
    public ArtifactType getArtifactType() {
        return ArtifactType.ER_DIAGRAM;
    }

    @Override
    public GeneratedArtifact generate(SchemaNode schema, GeneratorConfig config) {
        log.debug("Generating ER diagram for {} models", schema.models().size());

        StringBuilder sb = new StringBuilder();
        sb.append("# ").append(config.title()).append(" - Entity-Relationship Diagram\n\n");
        sb.append(CODE_BLOCK_START).append(ER_DIAGRAM);

        if (schema.isEmpty()) {
            appendPlaceholder(sb);
        } else {
            schema.models().forEach(model -> appendEntity(sb, model));
            appendRelationships(sb, schema);
        }

        sb.append(CODE_BLOCK_END);
        return new GeneratedArtifact(FILE_NAME + "." + ArtifactType.ER_DIAGRAM.fileExtension(),
            sb.toString(), ArtifactType.ER_DIAGRAM);
    }

    private void appendPlaceholder(StringBuilder sb) {
        sb.append("  PLACEHOLDER {\n");
        sb.append("    string note \"No models defined\"\n");
        sb.append("  }\n");
    }

    private void appendEntity(StringBuilder sb, ModelNode model) {
        sb.append("  ").append(sanitize(model.name())).append(" {\n");
        List<FieldNode> columns = model.columns();
        if (columns.isEmpty()) {
            sb.append("    string placeholder \"No columns\"\n");
        }
        for (FieldNode column : columns) {
            sb.append("    ").append(column.fieldType()).append(column.isArray() ? "[]" : "")
                .append(' ').append(sanitize(column.name()));
            String keys = keys(model, column);
            if (!keys.isEmpty()) {
                sb.append(' ').append(keys);
            }
            if (!column.isNotNull()) {
                sb.append(" \"nullable\"");
            }
            sb.append('\n');
        }
        sb.append("  }\n");
    }

    private String keys(ModelNode model, FieldNode column) {
        boolean foreignKey = model.fields().stream()
            .anyMatch(field -> !field.isColumn() && field.hasRelation()
                && column.name().equals(field.relation().foreignKey()));
        List<String> keys = new ArrayList<>();
        if (column.isPrimaryKey()) {
            keys.add("PK");
        }
        if (foreignKey) {
            keys.add("FK");
        }
        if (column.isUnique()) {
            keys.add("UK");
        }
        return String.join(", ", keys);
    }

    private void appendRelationships(StringBuilder sb, SchemaNode schema) {
        Set<String> manyToManyPairs = new HashSet<>();

        for (ModelNode model : schema.models()) {
            for (FieldNode field : model.fields()) {
                if (field.isColumn() || !field.hasRelation() || schema.model(field.fieldType()).isEmpty()) {
                    continue;
                }
                String source = sanitize(model.name());
                String target = sanitize(field.fieldType());
                String label = " : \"" + field.name() + "\"\n";

                switch (field.relation().type()) {
                    case MANY_TO_ONE -> sb.append("  ").append(target).append(" ||--o{ ").append(source).append(label);
                    case ONE_TO_ONE -> sb.append("  ").append(target).append(" ||--|| ").append(source).append(label);
                    case ONE_TO_MANY -> {
                        if (!hasInverseManyToOne(schema, model, field)) {
                            sb.append("  ").append(source).append(" ||--o{ ").append(target).append(label);
                        }
                    }
                    case MANY_TO_MANY -> {
                        String first = model.name().compareTo(field.fieldType()) <= 0 ? model.name() : field.fieldType();
                        String second = first.equals(model.name()) ? field.fieldType() : model.name();
                        if (manyToManyPairs.add(first + ":" + second)) {
                            sb.append("  ").append(sanitize(first)).append(" }o--o{ ").append(sanitize(second))
                                .append(label);
                        }
                    }
                }
            }
        }
    }

    private boolean hasInverseManyToOne(SchemaNode schema, ModelNode model, FieldNode field) {
        return schema.model(field.fieldType())
            .map(target -> target.fields().stream()
                .anyMatch(candidate -> candidate.hasRelation(RelationType.MANY_TO_ONE)
                    && candidate.fieldType().equals(model.name())))
            .orElse(false);
    }

    private String sanitize(String name) {
        return name.replaceAll(NAME_SANITIZATION_PATTERN, "_");
    }
}
