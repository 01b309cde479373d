package io.clientforge.generators.java;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.squareup.javapoet.AnnotationSpec;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.FieldSpec;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.TypeSpec;
import io.clientforge.spec.Names;

import javax.lang.model.element.Modifier;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Renders one Jackson-mapped class per {@link SchemaDefinition}.
 */
public final class SchemaFileWriter {

    private static final ClassName OBJECTS = ClassName.get(Objects.class);

    private static final AnnotationSpec IGNORE_UNKNOWN = AnnotationSpec.builder(JsonIgnoreProperties.class)
        .addMember("ignoreUnknown", "true")
        .build();
    private static final AnnotationSpec INCLUDE_NON_NULL = AnnotationSpec.builder(JsonInclude.class)
        .addMember("value", "$T.NON_NULL", JsonInclude.Include.class)
        .build();

    public List<JavaFile> render(List<SchemaDefinition> definitions) {
        List<JavaFile> files = new ArrayList<>();
        for (SchemaDefinition definition : definitions) {
            files.add(render(definition));
        }
        return files;
    }

    public JavaFile render(SchemaDefinition definition) {
        ClassName className = definition.className();
        TypeSpec.Builder tb = TypeSpec.classBuilder(className)
            .addModifiers(Modifier.PUBLIC)
            .addAnnotation(IGNORE_UNKNOWN)
            .addAnnotation(INCLUDE_NON_NULL);
        if (hasText(definition.description())) {
            tb.addJavadoc("$L\n", JavaNames.javadoc(definition.description()));
        }

        for (SchemaField field : definition.fields()) {
            FieldSpec.Builder fb = FieldSpec.builder(field.type().typeName(), field.fieldName(), Modifier.PRIVATE)
                .addAnnotation(AnnotationSpec.builder(JsonProperty.class)
                    .addMember("value", "$S", field.jsonName())
                    .addMember("required", "$L", field.required())
                    .build());
            if (hasText(field.description())) {
                fb.addJavadoc("$L\n", JavaNames.javadoc(field.description()));
            }
            tb.addField(fb.build());
        }

        tb.addMethod(MethodSpec.constructorBuilder()
            .addModifiers(Modifier.PUBLIC)
            .build());
        addAccessors(tb, definition.fields());
        addEqualsHashCodeToString(tb, className, definition.fields());

        return JavaFile.builder(className.packageName(), tb.build())
            .skipJavaLangImports(true)
            .build();
    }

    private static void addAccessors(TypeSpec.Builder tb, List<SchemaField> fields) {
        for (SchemaField f : fields) {
            String property = Names.capitalize(f.fieldName());
            tb.addMethod(MethodSpec.methodBuilder("get" + property)
                .addModifiers(Modifier.PUBLIC)
                .returns(f.type().typeName())
                .addStatement("return $L", f.fieldName())
                .build());
            tb.addMethod(MethodSpec.methodBuilder("set" + property)
                .addModifiers(Modifier.PUBLIC)
                .addParameter(f.type().typeName(), f.fieldName())
                .addStatement("this.$L = $L", f.fieldName(), f.fieldName())
                .build());
        }
    }

    private static void addEqualsHashCodeToString(TypeSpec.Builder tb, ClassName className, List<SchemaField> fields) {
        MethodSpec.Builder equalsMethod = MethodSpec.methodBuilder("equals")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC)
            .returns(boolean.class)
            .addParameter(ClassName.get(Object.class), "o");
        equalsMethod.addStatement("if (this == o) return true");
        equalsMethod.addStatement("if (!(o instanceof $T)) return false", className);
        if (fields.isEmpty()) {
            equalsMethod.addStatement("return true");
        } else {
            equalsMethod.addStatement("$T that = ($T) o", className, className);
        }
        StringBuilder condExpr = new StringBuilder("return ");
        List<Object> condArgs = new ArrayList<>();
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) condExpr.append("\n    && ");
            condExpr.append("$T.equals($L, that.$L)");
            condArgs.add(OBJECTS);
            condArgs.add(fields.get(i).fieldName());
            condArgs.add(fields.get(i).fieldName());
        }
        if (!fields.isEmpty()) {
            equalsMethod.addStatement(condExpr.toString(), condArgs.toArray());
        }
        tb.addMethod(equalsMethod.build());

        String hashArgs = fields.stream().map(SchemaField::fieldName).collect(Collectors.joining(", "));
        tb.addMethod(MethodSpec.methodBuilder("hashCode")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC)
            .returns(int.class)
            .addStatement("return $T.hash($L)", OBJECTS, hashArgs)
            .build());

        StringBuilder tsExpr = new StringBuilder("return $S");
        List<Object> tsArgs = new ArrayList<>();
        tsArgs.add(className.simpleName() + "{");
        for (int i = 0; i < fields.size(); i++) {
            tsExpr.append(" + $S + $L");
            tsArgs.add((i > 0 ? ", " : "") + fields.get(i).fieldName() + "=");
            tsArgs.add(fields.get(i).fieldName());
        }
        tsExpr.append(" + $S");
        tsArgs.add("}");
        tb.addMethod(MethodSpec.methodBuilder("toString")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC)
            .returns(ClassName.get(String.class))
            .addStatement(tsExpr.toString(), tsArgs.toArray())
            .build());
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
