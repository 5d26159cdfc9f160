package com.tandemsystems.reflect;

import com.tandemsystems.Call;
import com.tandemsystems.declaration.Declaration;
import com.tandemsystems.declaration.FieldDeclaration;
import com.tandemsystems.declaration.MemberDeclaration;
import com.tandemsystems.declaration.MessageDeclaration;
import com.tandemsystems.declaration.ParameterDeclaration;
import com.tandemsystems.declaration.PassingMode;
import com.tandemsystems.declaration.ProcessorDeclaration;
import com.tandemsystems.declaration.TypeRef;
import com.tandemsystems.declaration.VariantDeclaration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Field;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * Reads compiled classes into declarations.
 * <ul>
 *   <li>A sealed interface is a message type; each permitted record is a variant and its components are the fields.</li>
 *   <li>Any other class is a processor: its instance fields are its data, its public methods, inherited ones
 *   included, are its members. A method returning a {@link CompletionStage} is asynchronous, and a {@link Call Call&lt;X&gt;} parameter
 *   takes {@code X} by exclusive reference.</li>
 * </ul>
 * Message and field types are recorded by canonical name so rendered sources can import them;
 * processors and variants by simple name.
 */
public class ClassDeclarationReader {
    private static final Logger logger = LoggerFactory.getLogger(ClassDeclarationReader.class);

    public List<Declaration> read(Class<?>... types) {
        return Arrays.stream(types).map(this::read).toList();
    }

    public Declaration read(Class<?> type) {
        if (type.isInterface() && type.isSealed()) {
            return readMessage(type);
        }
        if (type.isInterface() || type.isRecord() || type.isEnum() || type.isAnnotation()) {
            throw new IllegalArgumentException(type.getName() + " is neither a sealed message interface nor a processor class");
        }
        return readProcessor(type);
    }

    public MessageDeclaration readMessage(Class<?> type) {
        if (!type.isInterface() || !type.isSealed()) {
            throw new IllegalArgumentException(type.getName() + " is not a sealed interface");
        }
        List<VariantDeclaration> variants = new ArrayList<>();
        for (Class<?> permitted : type.getPermittedSubclasses()) {
            if (!permitted.isRecord()) {
                throw new IllegalArgumentException("Variant " + permitted.getName() + " of "
                        + type.getSimpleName() + " is not a record");
            }
            List<FieldDeclaration> fields = new ArrayList<>();
            for (RecordComponent component : permitted.getRecordComponents()) {
                fields.add(new FieldDeclaration(component.getName(), typeOf(component.getGenericType())));
            }
            variants.add(new VariantDeclaration(permitted.getSimpleName(), fields));
        }
        logger.debug("Read message {} with {} variants", type.getSimpleName(), variants.size());
        return new MessageDeclaration(nameOf(type), variants);
    }

    public ProcessorDeclaration readProcessor(Class<?> type) {
        List<FieldDeclaration> fields = new ArrayList<>();
        for (Field field : type.getDeclaredFields()) {
            if (!Modifier.isStatic(field.getModifiers()) && !field.isSynthetic()) {
                fields.add(new FieldDeclaration(field.getName(), typeOf(field.getGenericType())));
            }
        }

        List<MemberDeclaration> members = new ArrayList<>();
        Method[] methods = type.getMethods();
        Arrays.sort(methods, Comparator.comparing(Method::getName).thenComparing(Method::getParameterCount));
        for (Method listed : methods) {
            Optional<Method> found = unbridged(listed);
            if (found.isEmpty()) {
                continue;
            }
            Method method = found.get();
            if (method.getDeclaringClass() == Object.class || Modifier.isStatic(method.getModifiers())
                    || method.isSynthetic()) {
                continue;
            }
            List<ParameterDeclaration> parameters = new ArrayList<>();
            for (Parameter parameter : method.getParameters()) {
                parameters.add(readParameter(parameter));
            }
            boolean asynchronous = CompletionStage.class.isAssignableFrom(method.getReturnType());
            members.add(new MemberDeclaration(method.getName(), parameters, asynchronous));
        }

        Optional<String> boundMessage = Optional.ofNullable(type.getAnnotation(ActorSpec.class))
                .map(spec -> nameOf(spec.message()));
        logger.debug("Read processor {} with members {}", type.getSimpleName(),
                members.stream().map(MemberDeclaration::name).toList());
        return new ProcessorDeclaration(type.getSimpleName(), fields, members, boundMessage);
    }

    /**
     * A public class inheriting from a non-public one gets bridges that republish the inherited methods.
     * Those resolve to the inherited method; generic bridges resolve to nothing.
     */
    private static Optional<Method> unbridged(Method method) {
        if (!method.isBridge()) {
            return Optional.of(method);
        }
        for (Class<?> owner = method.getDeclaringClass().getSuperclass(); owner != null; owner = owner.getSuperclass()) {
            for (Method inherited : owner.getDeclaredMethods()) {
                if (!inherited.isBridge()
                        && inherited.getName().equals(method.getName())
                        && inherited.getReturnType() == method.getReturnType()
                        && Arrays.equals(inherited.getParameterTypes(), method.getParameterTypes())) {
                    return Optional.of(inherited);
                }
            }
        }
        return Optional.empty();
    }

    private ParameterDeclaration readParameter(Parameter parameter) {
        Type type = parameter.getParameterizedType();
        if (type instanceof ParameterizedType parameterized && parameterized.getRawType() == Call.class) {
            return new ParameterDeclaration(parameter.getName(),
                    typeOf(parameterized.getActualTypeArguments()[0]), PassingMode.EXCLUSIVE_REFERENCE);
        }
        return new ParameterDeclaration(parameter.getName(), typeOf(type), PassingMode.VALUE);
    }

    static TypeRef typeOf(Type type) {
        if (type instanceof Class<?> clazz) {
            return TypeRef.of(nameOf(clazz));
        }
        if (type instanceof ParameterizedType parameterized) {
            TypeRef[] arguments = Arrays.stream(parameterized.getActualTypeArguments())
                    .map(ClassDeclarationReader::typeOf)
                    .toArray(TypeRef[]::new);
            return TypeRef.of(nameOf((Class<?>) parameterized.getRawType()), arguments);
        }
        if (type instanceof GenericArrayType array) {
            return TypeRef.of(typeOf(array.getGenericComponentType()).render() + "[]");
        }
        if (type instanceof WildcardType wildcard) {
            return typeOf(wildcard.getUpperBounds()[0]);
        }
        if (type instanceof TypeVariable<?> variable) {
            return TypeRef.of(variable.getName());
        }
        throw new IllegalArgumentException("Unsupported type " + type);
    }

    // local and anonymous classes have no canonical name
    private static String nameOf(Class<?> type) {
        String canonical = type.getCanonicalName();
        return canonical != null ? canonical : type.getSimpleName();
    }
}
