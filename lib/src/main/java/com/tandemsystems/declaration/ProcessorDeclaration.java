package com.tandemsystems.declaration;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The type whose instance becomes the worker's exclusively owned state.
 *
 * @param name         processor type name
 * @param fields       data fields; opaque to the engine
 * @param members      method-like members
 * @param boundMessage explicit binding to a message type name; when empty the {@code Msg} suffix convention applies
 */
public record ProcessorDeclaration(String name,
                                   List<FieldDeclaration> fields,
                                   List<MemberDeclaration> members,
                                   Optional<String> boundMessage) implements Declaration {

    public ProcessorDeclaration {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(boundMessage, "boundMessage cannot be null");
        fields = List.copyOf(fields);
        members = List.copyOf(members);
    }

    public ProcessorDeclaration(String name, List<FieldDeclaration> fields, List<MemberDeclaration> members) {
        this(name, fields, members, Optional.empty());
    }

    public List<MemberDeclaration> membersNamed(String memberName) {
        return members.stream()
                .filter(member -> member.name().equals(memberName))
                .toList();
    }
}
