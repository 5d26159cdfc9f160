package com.tandemsystems.synthesis;

import com.tandemsystems.declaration.TypeRef;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Collects the imports of a rendered source while its body is written.
 * Each qualified name is shortened to its simple name unless another type already took that
 * simple name, in which case it stays qualified.
 */
final class ImportTracker {
    private static final String JAVA_LANG = "java.lang";

    private final String currentPackage;
    private final Map<String, String> simpleToQualified = new LinkedHashMap<>();

    ImportTracker(String currentPackage) {
        this.currentPackage = currentPackage == null ? "" : currentPackage;
    }

    /**
     * Registers a type with all its arguments.
     *
     * @return the type as it should appear in the body
     */
    String use(TypeRef type) {
        String raw = use(type.name());
        if (!type.isGeneric()) {
            return raw;
        }
        return type.arguments().stream()
                .map(this::use)
                .collect(Collectors.joining(", ", raw + "<", ">"));
    }

    String use(String qualifiedName) {
        if (qualifiedName.indexOf('<') >= 0) {
            // already rendered with qualified arguments, valid as written
            return qualifiedName;
        }
        if (qualifiedName.endsWith("[]")) {
            return use(qualifiedName.substring(0, qualifiedName.length() - 2)) + "[]";
        }
        int dot = qualifiedName.lastIndexOf('.');
        if (dot < 0) {
            return qualifiedName;
        }
        String simpleName = qualifiedName.substring(dot + 1);
        String existing = simpleToQualified.putIfAbsent(simpleName, qualifiedName);
        if (existing == null || existing.equals(qualifiedName)) {
            return simpleName;
        }
        return qualifiedName;
    }

    List<String> imports() {
        return simpleToQualified.values().stream()
                .filter(name -> !isDirectlyIn(JAVA_LANG, name) && !isDirectlyIn(currentPackage, name))
                .sorted()
                .toList();
    }

    private static boolean isDirectlyIn(String packageName, String qualifiedName) {
        if (packageName.isEmpty()) {
            return qualifiedName.indexOf('.') < 0;
        }
        return qualifiedName.startsWith(packageName + ".")
                && qualifiedName.indexOf('.', packageName.length() + 1) < 0;
    }
}
