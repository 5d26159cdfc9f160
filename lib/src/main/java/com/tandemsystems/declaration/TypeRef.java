package com.tandemsystems.declaration;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A type as written in a declaration: a name and optional type arguments, e.g. {@code Optional<Double>}.
 * Names are kept as written; the engine never resolves them.
 */
public record TypeRef(String name, List<TypeRef> arguments) {

    private static final Map<String, String> BOXES = Map.of(
            "boolean", "Boolean",
            "byte", "Byte",
            "short", "Short",
            "char", "Character",
            "int", "Integer",
            "long", "Long",
            "float", "Float",
            "double", "Double",
            "void", "Void");

    public TypeRef {
        Objects.requireNonNull(name, "name cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Type name cannot be blank");
        }
        arguments = List.copyOf(arguments);
    }

    public static TypeRef of(String name) {
        return new TypeRef(name, List.of());
    }

    public static TypeRef of(String name, TypeRef... arguments) {
        return new TypeRef(name, List.of(arguments));
    }

    /**
     * @return the name without any package qualifier
     */
    public String simpleName() {
        int dot = name.lastIndexOf('.');
        return dot < 0 ? name : name.substring(dot + 1);
    }

    /**
     * @return the wrapper type for a primitive, this type otherwise
     */
    public TypeRef boxed() {
        String box = arguments.isEmpty() ? BOXES.get(name) : null;
        return box == null ? this : of(box);
    }

    public boolean isGeneric() {
        return !arguments.isEmpty();
    }

    /**
     * Renders this type in Java source syntax.
     *
     * @return e.g. {@code Map<String, List<Integer>>}
     */
    public String render() {
        if (arguments.isEmpty()) {
            return name;
        }
        return arguments.stream()
                .map(TypeRef::render)
                .collect(Collectors.joining(", ", name + "<", ">"));
    }

    @Override
    public String toString() {
        return render();
    }
}
