package com.tandemsystems.declaration;

/**
 * A named declaration handed to the engine by a front end.
 * The engine only sees processors and messages; everything else the front end parsed is dropped before.
 */
public sealed interface Declaration permits ProcessorDeclaration, MessageDeclaration {

    /**
     * @return the declared type name, unqualified
     */
    String name();
}
