package com.mathtext.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One positional argument of a construct. An absent slot has no content at
 * all, which is not the same as a present slot with an empty node list.
 */
@ToString
@EqualsAndHashCode
public final class ArgumentSlot {
    @Getter
    private final ArgumentKind kind;
    private final List<MarkupNode> content;

    private ArgumentSlot(ArgumentKind kind, List<MarkupNode> content) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.content = content != null ? List.copyOf(content) : null;
    }

    public static ArgumentSlot present(ArgumentKind kind, List<MarkupNode> content) {
        return new ArgumentSlot(kind, Objects.requireNonNull(content, "content"));
    }

    public static ArgumentSlot absent(ArgumentKind kind) {
        return new ArgumentSlot(kind, null);
    }

    public static ArgumentSlot mandatory(MarkupNode... content) {
        return present(ArgumentKind.MANDATORY, List.of(content));
    }

    public static ArgumentSlot optional(MarkupNode... content) {
        return present(ArgumentKind.OPTIONAL, List.of(content));
    }

    public boolean isPresent() {
        return content != null;
    }

    public Optional<List<MarkupNode>> getContent() {
        return Optional.ofNullable(content);
    }
}
