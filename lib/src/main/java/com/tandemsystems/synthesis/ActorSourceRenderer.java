package com.tandemsystems.synthesis;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Objects;

/**
 * Renders the typed handle of a blueprint as Java source: one method per operation, named as derived,
 * each delegating to a runtime {@code ActorHandle} by operation name. Qualified type names are imported;
 * a simple name already taken by another type stays qualified in the body.
 *
 * <p>For a processor {@code Calc} with message {@code CalcMsg} and a variant {@code Add(int a, int b, Optional<Integer> resp)}:
 * <pre>{@code
 * public final class ActorCalc implements AutoCloseable {
 *     public Result<Integer> add(CalcMsg message) { ... }
 *     public Result<Void> add_no_wait(CalcMsg message) { ... }
 *     public ActorCalc share() { ... }
 *     public void close() { ... }
 * }
 * }</pre>
 */
public class ActorSourceRenderer {

    private static final String INDENT = "    ";
    private static final String RUNTIME_PACKAGE = "com.tandemsystems";

    public String render(ActorBlueprint blueprint, String packageName) {
        Objects.requireNonNull(blueprint, "blueprint cannot be null");
        var handle = blueprint.handle();
        var imports = new ImportTracker(packageName);
        imports.use(qualified(packageName, handle.name()));
        var handleType = imports.use(RUNTIME_PACKAGE + ".ActorHandle") + "<" + imports.use(handle.messageTypeName()) + ">";
        var resultType = imports.use(RUNTIME_PACKAGE + ".Result");

        // body first, so every type it mentions is registered before the imports are written
        var body = new StringWriter();
        try (var writer = new PrintWriter(body)) {
            writer.println("/**");
            writer.println(" * Handle to a running " + blueprint.processorName() + ", served by "
                    + blueprint.worker().name() + ".");
            writer.println(" */");
            writer.println("public final class " + handle.name() + " implements AutoCloseable {");
            writer.println(INDENT + "private final " + handleType + " handle;");
            writer.println();
            writer.println(INDENT + "public " + handle.name() + "(" + handleType + " handle) {");
            writer.println(INDENT + INDENT + "this.handle = handle;");
            writer.println(INDENT + "}");

            var messageType = imports.use(handle.messageTypeName());
            for (var operation : handle.operations()) {
                writer.println();
                writeOperation(writer, messageType, resultType + "<" + imports.use(operation.resultValueType()) + ">",
                        operation);
            }

            writer.println();
            writer.println(INDENT + "public " + handle.name() + " share() {");
            writer.println(INDENT + INDENT + "return new " + handle.name() + "(handle.share());");
            writer.println(INDENT + "}");
            writer.println();
            writer.println(INDENT + "@Override");
            writer.println(INDENT + "public void close() {");
            writer.println(INDENT + INDENT + "handle.close();");
            writer.println(INDENT + "}");
            writer.println("}");
        }

        var source = new StringWriter();
        try (var writer = new PrintWriter(source)) {
            if (packageName != null && !packageName.isEmpty()) {
                writer.println("package " + packageName + ";");
                writer.println();
            }
            for (var importName : imports.imports()) {
                writer.println("import " + importName + ";");
            }
            writer.println();
            writer.print(body);
        }
        return source.toString();
    }

    private void writeOperation(PrintWriter writer, String messageType, String resultType, OperationDefinition operation) {
        if (operation.form() == CallForm.NO_WAIT) {
            writer.println(INDENT + "/** Enqueues a " + operation.variantName() + " without waiting for the reply. */");
        }
        writer.println(INDENT + "public " + resultType + " " + operation.name() + "(" + messageType + " message) {");
        writer.println(INDENT + INDENT + "return handle.call(\"" + operation.name() + "\", message);");
        writer.println(INDENT + "}");
    }

    private static String qualified(String packageName, String simpleName) {
        return packageName == null || packageName.isEmpty() ? simpleName : packageName + "." + simpleName;
    }
}
