package com.tandemsystems;

import com.tandemsystems.synthesis.CallForm;
import com.tandemsystems.synthesis.HandleDefinition;
import com.tandemsystems.synthesis.OperationDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves the reply type of each wait operation to a class, so a reply of the wrong type is
 * rejected where the handler sends it. Types that cannot be loaded are not checked.
 */
final class ReplyTypes {
    private static final Logger logger = LoggerFactory.getLogger(ReplyTypes.class);

    private ReplyTypes() {
    }

    static Map<String, Class<?>> resolve(HandleDefinition handle, ClassLoader loader) {
        Map<String, Class<?>> types = new HashMap<>();
        for (OperationDefinition operation : handle.operations()) {
            if (operation.form() != CallForm.WAIT) {
                continue;
            }
            String name = operation.resultValueType().name();
            Optional<Class<?>> type = load(name, loader);
            if (type.isPresent()) {
                types.put(operation.name(), type.get());
            } else {
                logger.debug("Reply type {} of {}.{} not loadable, replies are not checked",
                        name, handle.name(), operation.name());
            }
        }
        return Map.copyOf(types);
    }

    static Optional<Class<?>> load(String name, ClassLoader loader) {
        for (String candidate : binaryNames(name)) {
            Optional<Class<?>> type = tryLoad(candidate, loader);
            if (type.isPresent()) {
                return type;
            }
        }
        return Optional.empty();
    }

    /**
     * Binary names a written type name may stand for: itself, a {@code java.lang} type,
     * or a nested type with some of its trailing dots meaning {@code $}.
     */
    private static List<String> binaryNames(String name) {
        List<String> names = new ArrayList<>();
        if (name.indexOf('<') >= 0 || name.endsWith("[]")) {
            return names;
        }
        if (name.indexOf('.') < 0) {
            names.add("java.lang." + name);
            names.add(name);
            return names;
        }
        String candidate = name;
        names.add(candidate);
        for (int dot = candidate.lastIndexOf('.'); dot > 0; dot = candidate.lastIndexOf('.')) {
            candidate = candidate.substring(0, dot) + "$" + candidate.substring(dot + 1);
            names.add(candidate);
        }
        return names;
    }

    private static Optional<Class<?>> tryLoad(String binaryName, ClassLoader loader) {
        try {
            return Optional.of(Class.forName(binaryName, false, loader));
        } catch (ClassNotFoundException | LinkageError e) {
            return Optional.empty();
        }
    }
}
