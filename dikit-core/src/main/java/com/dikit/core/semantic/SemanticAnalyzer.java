package com.dikit.core.semantic;

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
import java.util.regex.Pattern;

/**
 * Validates naming and uniqueness rules over a parsed schema.
 *
 * <p>The pass never aborts early; every violation is returned. In strict mode it also
 * checks that relation targets name declared models, that foreign keys name existing
 * fields and that composite unique constraints only list declared fields.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * List<SemanticError> errors = new SemanticAnalyzer().analyze(schema);
 * if (!errors.isEmpty()) {
 *     errors.forEach(System.err::println);
 * }
 * }</pre>
 */
public class SemanticAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(SemanticAnalyzer.class);
    private static final Pattern SNAKE_CASE = Pattern.compile("^[a-z0-9]+(_[a-z0-9]+)*$");

    private final boolean strict;

    public SemanticAnalyzer() {
        this(false);
    }

    /**
     * @param strict whether relation targets and foreign keys are validated as well
     */
    public SemanticAnalyzer(boolean strict) {
        this.strict = strict;
    }

    public boolean isStrict() {
        return strict;
    }

    /**
     * Analyzes a schema.
     *
     * @param schema parsed schema
     * @return all violations in source order, empty if the schema is valid
     */
    public List<SemanticError> analyze(SchemaNode schema) {
        List<SemanticError> errors = new ArrayList<>();
        Set<String> declaredModels = new HashSet<>();

        for (ModelNode model : schema.models()) {
            visitModel(model, declaredModels, errors);
        }

        if (strict) {
            for (ModelNode model : schema.models()) {
                checkReferences(schema, model, errors);
            }
        }

        log.debug("Semantic analysis of {} models found {} errors", schema.models().size(), errors.size());
        return errors;
    }

    private void visitModel(ModelNode model, Set<String> declaredModels, List<SemanticError> errors) {
        if (!declaredModels.add(model.name())) {
            errors.add(new SemanticError(
                "Duplicate model name '" + model.name() + "'. Model names must be unique.",
                model.line(), model.column()));
        }

        if (!isSnakeCase(model.name())) {
            errors.add(new SemanticError(
                "Model name '" + model.name() + "' must be in snake_case (e.g., 'user_profile'). "
                    + "Do not use capital letters or hyphens.",
                model.line(), model.column()));
        }

        Set<String> declaredFields = new HashSet<>();
        for (FieldNode field : model.fields()) {
            if (!declaredFields.add(field.name())) {
                errors.add(new SemanticError(
                    "Duplicate field name '" + field.name() + "' in model. "
                        + "Field names within a model must be unique.",
                    field.line(), field.column()));
            }
            if (!isSnakeCase(field.name())) {
                errors.add(new SemanticError(
                    "Field name '" + field.name() + "' must be in snake_case (e.g., 'first_name'). "
                        + "Do not use capital letters or hyphens.",
                    field.line(), field.column()));
            }
        }
    }

    private void checkReferences(SchemaNode schema, ModelNode model, List<SemanticError> errors) {
        for (FieldNode field : model.fields()) {
            if (!field.hasRelation()) {
                continue;
            }
            if (field.isColumn()) {
                checkLocalForeignKey(model, field, errors);
                continue;
            }

            ModelNode target = schema.model(field.fieldType()).orElse(null);
            if (target == null) {
                errors.add(new SemanticError(
                    "Relation target '" + field.fieldType() + "' of field '" + field.name()
                        + "' is not a declared model.",
                    field.line(), field.column()));
                continue;
            }

            String foreignKey = field.relation().foreignKey();
            if (foreignKey == null) {
                continue;
            }
            switch (field.relation().type()) {
                case MANY_TO_ONE, ONE_TO_ONE -> checkLocalForeignKey(model, field, errors);
                case ONE_TO_MANY -> {
                    if (target.field(foreignKey).isEmpty()) {
                        errors.add(new SemanticError(
                            "Foreign key '" + foreignKey + "' of field '" + field.name()
                                + "' is not a field of model '" + target.name() + "'.",
                            field.line(), field.column()));
                    }
                }
                case MANY_TO_MANY -> {
                    // names the join table, not a field
                }
            }
        }

        for (List<String> unique : model.combinedUniques()) {
            for (String fieldName : unique) {
                if (model.field(fieldName).isEmpty()) {
                    errors.add(new SemanticError(
                        "Composite unique constraint references unknown field '" + fieldName
                            + "' in model '" + model.name() + "'.",
                        model.line(), model.column()));
                }
            }
        }
    }

    private void checkLocalForeignKey(ModelNode model, FieldNode field, List<SemanticError> errors) {
        String foreignKey = field.relation().foreignKey();
        if (foreignKey == null || field.relation().type() == RelationType.MANY_TO_MANY) {
            return;
        }
        if (model.field(foreignKey).isEmpty()) {
            errors.add(new SemanticError(
                "Foreign key '" + foreignKey + "' of field '" + field.name()
                    + "' is not a field of model '" + model.name() + "'.",
                field.line(), field.column()));
        }
    }

    private static boolean isSnakeCase(String name) {
        return SNAKE_CASE.matcher(name).matches();
    }
}
