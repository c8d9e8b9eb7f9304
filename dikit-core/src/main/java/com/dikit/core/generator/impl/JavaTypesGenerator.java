package com.dikit.core.generator.impl;

import com.dikit.core.generator.ArtifactGenerator;
import com.dikit.core.generator.ArtifactType;
import com.dikit.core.generator.GeneratedArtifact;
import com.dikit.core.generator.GeneratorConfig;
import com.dikit.core.model.FieldNode;
import com.dikit.core.model.JsonField;
import com.dikit.core.model.ModelNode;
import com.dikit.core.model.ScalarType;
import com.dikit.core.model.SchemaNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Generates a Java source file declaring one record per model.
 *
 * <p>The file holds a single top-level class containing:
 * <ul>
 *   <li>a sealed {@code Model} interface permitting every model record</li>
 *   <li>one record per model with boxed component types, in field declaration order</li>
 *   <li>one record per declared JSON shape, named after the owning record and field</li>
 *   <li>a {@code ModelName} enum carrying the schema names</li>
 *   <li>a {@code MODELS} map from schema name to record class</li>
 * </ul>
 *
 * <p>Components that are neither required nor primary keys carry a trailing
 * {@code optional} block comment. The file is meant to be overwritten on every compile.
 *
 * <p>Record names never collide with the enclosing class, the {@code Model} and
 * {@code ModelName} declarations, the JDK types the file refers to, or each other:
 * a clashing name gets a {@code Type} suffix, then a counter.
 */
public class JavaTypesGenerator implements ArtifactGenerator {

    private static final Logger log = LoggerFactory.getLogger(JavaTypesGenerator.class);

    static final String HEADER = "// AUTO-GENERATED FILE. DO NOT EDIT.";

    private static final String INDENT = "    ";
    private static final String OPTIONAL_MARKER = " /* optional */";
    private static final Set<String> RESERVED_WORDS = Set.of(
        "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class", "const",
        "continue", "default", "do", "double", "else", "enum", "extends", "final", "finally", "float",
        "for", "goto", "if", "implements", "import", "instanceof", "int", "interface", "long", "native",
        "new", "package", "private", "protected", "public", "return", "short", "static", "strictfp",
        "super", "switch", "synchronized", "this", "throw", "throws", "transient", "try", "void",
        "volatile", "while", "true", "false", "null", "record", "var", "yield", "sealed", "permits");
    private static final Set<String> FIXED_TYPE_NAMES = Set.of(
        "Model", "ModelName", "Map", "List", "OffsetDateTime", "LocalDate",
        "String", "Integer", "Double", "Boolean", "Object", "Class");

    @Override
    public String getId() {
        return "java-types";
    }

    @Override
    public String getDisplayName() {
        return "Java Record Type Generator";
    }

    @Override
    public ArtifactType getArtifactType() {
        return ArtifactType.TYPE_DECLARATIONS;
    }

    @Override
    public GeneratedArtifact generate(SchemaNode schema, GeneratorConfig config) {
        log.debug("Generating Java types for {} models into {}.{}",
            schema.models().size(), config.packageName(), config.className());

        TypeScope scope = new TypeScope(schema, config.className());
        List<String> modelRecords = new ArrayList<>();

        for (ModelNode model : schema.models()) {
            modelRecords.add(modelRecord(model, scope));
        }

        StringBuilder sb = new StringBuilder();
        sb.append(HEADER).append("\n");
        if (!config.packageName().isEmpty()) {
            sb.append("package ").append(config.packageName()).append(";\n");
        }
        sb.append("\n");

        scope.imports.add("java.util.Map");
        scope.imports.forEach(type -> sb.append("import ").append(type).append(";\n"));
        sb.append("\n");

        sb.append("public final class ").append(config.className()).append(" {\n\n");
        sb.append(INDENT).append("private ").append(config.className()).append("() {\n");
        sb.append(INDENT).append("}\n\n");

        appendModelInterface(sb, scope);
        modelRecords.forEach(record -> sb.append(record).append("\n"));
        scope.shapeRecords.forEach(record -> sb.append(record).append("\n"));
        appendModelNameEnum(sb, schema);
        appendModelsMap(sb, scope);

        sb.append("}\n");

        return new GeneratedArtifact(relativePath(config), sb.toString(), ArtifactType.TYPE_DECLARATIONS);
    }

    private static String relativePath(GeneratorConfig config) {
        String fileName = config.className() + "." + ArtifactType.TYPE_DECLARATIONS.fileExtension();
        if (config.packageName().isEmpty()) {
            return fileName;
        }
        return config.packageName().replace('.', '/') + "/" + fileName;
    }

    private void appendModelInterface(StringBuilder sb, TypeScope scope) {
        if (scope.recordNames.isEmpty()) {
            sb.append(INDENT).append("public interface Model {\n");
        } else {
            String permitted = String.join(", ", scope.recordNames.values());
            sb.append(INDENT).append("public sealed interface Model permits ").append(permitted).append(" {\n");
        }
        sb.append(INDENT).append("}\n\n");
    }

    private String modelRecord(ModelNode model, TypeScope scope) {
        String recordName = scope.recordNames.get(model.name());
        List<String> components = new ArrayList<>();

        for (FieldNode field : model.fields()) {
            String type = componentType(scope, recordName, field);
            boolean optional = !field.isRequired() && !field.isPrimaryKey();
            components.add(type + " " + memberName(field.name()) + (optional ? OPTIONAL_MARKER : ""));
        }

        return record(recordName, components, " implements Model");
    }

    private String componentType(TypeScope scope, String owner, FieldNode field) {
        String elementType = field.scalarType()
            .map(scalar -> scalarType(scalar, owner, field, scope))
            .orElseGet(() -> scope.recordNames.getOrDefault(field.fieldType(), "Object"));
        if (field.isArray()) {
            scope.imports.add("java.util.List");
            return "List<" + elementType + ">";
        }
        return elementType;
    }

    private String scalarType(ScalarType scalar, String owner, FieldNode field, TypeScope scope) {
        return switch (scalar) {
            case INT -> "Integer";
            case FLOAT -> "Double";
            case STRING -> "String";
            case BOOLEAN -> "Boolean";
            case DATETIME -> {
                scope.imports.add("java.time.OffsetDateTime");
                yield "OffsetDateTime";
            }
            case DATE -> {
                scope.imports.add("java.time.LocalDate");
                yield "LocalDate";
            }
            case JSON -> {
                if (field.jsonTypeDefinition() == null || field.jsonTypeDefinition().fields().isEmpty()) {
                    yield "Map<String, Object>";
                }
                String shapeName = scope.claim(owner + typeName(field.name()));
                scope.shapeRecords.add(shapeRecord(shapeName, field.jsonTypeDefinition().fields(), scope));
                yield shapeName;
            }
        };
    }

    private String shapeRecord(String name, List<JsonField> fields, TypeScope scope) {
        List<String> components = new ArrayList<>();
        for (JsonField field : fields) {
            String type;
            if (field.isObject()) {
                type = scope.claim(name + typeName(field.name()));
                scope.shapeRecords.add(shapeRecord(type, field.fields(), scope));
            } else {
                type = jsonShapeType(field.type(), scope.imports);
            }
            if (field.isArray()) {
                scope.imports.add("java.util.List");
                type = "List<" + type + ">";
            }
            components.add(type + " " + memberName(field.name()) + (field.optional() ? OPTIONAL_MARKER : ""));
        }
        return record(name, components, "");
    }

    private static String jsonShapeType(String type, Set<String> imports) {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "int", "integer" -> "Integer";
            case "number", "float", "double" -> "Double";
            case "string" -> "String";
            case "boolean", "bool" -> "Boolean";
            case "date" -> {
                imports.add("java.time.LocalDate");
                yield "LocalDate";
            }
            case "datetime" -> {
                imports.add("java.time.OffsetDateTime");
                yield "OffsetDateTime";
            }
            default -> "Object";
        };
    }

    private static String record(String name, List<String> components, String implementsClause) {
        StringBuilder sb = new StringBuilder();
        sb.append(INDENT).append("public record ").append(name).append("(");
        if (!components.isEmpty()) {
            sb.append("\n");
            for (int i = 0; i < components.size(); i++) {
                sb.append(INDENT).append(INDENT).append(components.get(i));
                sb.append(i < components.size() - 1 ? ",\n" : "\n");
            }
            sb.append(INDENT);
        }
        sb.append(")").append(implementsClause).append(" {\n");
        sb.append(INDENT).append("}\n");
        return sb.toString();
    }

    private void appendModelNameEnum(StringBuilder sb, SchemaNode schema) {
        sb.append(INDENT).append("public enum ModelName {\n");
        String constants = schema.models().stream()
            .map(model -> INDENT + INDENT + constantName(model.name()) + "(\"" + model.name() + "\")")
            .collect(Collectors.joining(",\n"));
        if (!constants.isEmpty()) {
            sb.append(constants).append("\n");
        }
        sb.append(INDENT).append(INDENT).append(";\n\n");
        sb.append(INDENT).append(INDENT).append("private final String schemaName;\n\n");
        sb.append(INDENT).append(INDENT).append("ModelName(String schemaName) {\n");
        sb.append(INDENT).append(INDENT).append(INDENT).append("this.schemaName = schemaName;\n");
        sb.append(INDENT).append(INDENT).append("}\n\n");
        sb.append(INDENT).append(INDENT).append("public String schemaName() {\n");
        sb.append(INDENT).append(INDENT).append(INDENT).append("return schemaName;\n");
        sb.append(INDENT).append(INDENT).append("}\n");
        sb.append(INDENT).append("}\n\n");
    }

    private void appendModelsMap(StringBuilder sb, TypeScope scope) {
        sb.append(INDENT).append("public static final Map<String, Class<? extends Model>> MODELS = Map.ofEntries(");
        String entries = scope.recordNames.entrySet().stream()
            .map(entry -> INDENT + INDENT + "Map.entry(\"" + entry.getKey() + "\", " + entry.getValue() + ".class)")
            .collect(Collectors.joining(",\n"));
        if (!entries.isEmpty()) {
            sb.append("\n").append(entries).append("\n").append(INDENT);
        }
        sb.append(");\n");
    }

    /**
     * Converts a snake_case name to PascalCase.
     */
    static String typeName(String name) {
        StringBuilder sb = new StringBuilder();
        for (String part : name.split("[_\\-]+")) {
            if (!part.isEmpty()) {
                sb.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
            }
        }
        String result = sb.toString();
        return result.isEmpty() || Character.isDigit(result.charAt(0)) ? "_" + result : result;
    }

    /**
     * Converts a snake_case name to camelCase, escaping Java reserved words.
     */
    static String memberName(String name) {
        String pascal = typeName(name);
        String camel = pascal.startsWith("_")
            ? pascal
            : Character.toLowerCase(pascal.charAt(0)) + pascal.substring(1);
        return RESERVED_WORDS.contains(camel) ? camel + "_" : camel;
    }

    private static String constantName(String name) {
        String constant = name.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9_]", "_");
        return Character.isDigit(constant.charAt(0)) ? "_" + constant : constant;
    }

    /**
     * Type names taken within one generated file, plus the imports and shape records collected so far.
     */
    private static final class TypeScope {

        private final Set<String> taken = new HashSet<>(FIXED_TYPE_NAMES);
        private final Map<String, String> recordNames = new LinkedHashMap<>();
        private final Set<String> imports = new TreeSet<>();
        private final List<String> shapeRecords = new ArrayList<>();

        TypeScope(SchemaNode schema, String className) {
            taken.add(className);
            for (ModelNode model : schema.models()) {
                recordNames.putIfAbsent(model.name(), claim(typeName(model.name())));
            }
        }

        String claim(String candidate) {
            String name = candidate;
            if (taken.contains(name)) {
                name = candidate + "Type";
                for (int counter = 2; taken.contains(name); counter++) {
                    name = candidate + "Type" + counter;
                }
            }
            taken.add(name);
            return name;
        }
    }
}
