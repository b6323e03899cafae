package com.mathtext.render.registry;

import com.mathtext.model.ArgumentSlot;
import com.mathtext.model.MarkupNode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Optional;

/**
 * Arguments of a construct occurrence after resolution. Present arguments
 * have already been rendered in document order; absent ones are
 * {@link Optional#empty()}, never an empty string. The raw slots stay
 * available for handlers that inspect structure.
 */
@ToString
public final class MacroArguments {
    @Getter
    private final String name;
    @Getter
    private final List<ArgumentSlot> slots;
    private final List<Optional<String>> rendered;

    public MacroArguments(String name, List<ArgumentSlot> slots, List<Optional<String>> rendered) {
        if (slots.size() != rendered.size()) {
            throw new IllegalArgumentException("Slot count " + slots.size()
                    + " does not match rendered count " + rendered.size() + " for " + name);
        }
        this.name = name;
        this.slots = List.copyOf(slots);
        this.rendered = List.copyOf(rendered);
    }

    public int size() {
        return slots.size();
    }

    public boolean isPresent(int index) {
        return index < rendered.size() && rendered.get(index).isPresent();
    }

    /**
     * Rendered text of the argument, or empty when absent or out of range.
     */
    public Optional<String> text(int index) {
        if (index < 0 || index >= rendered.size()) {
            return Optional.empty();
        }
        return rendered.get(index);
    }

    /**
     * Rendered text of an argument the handler requires; blank when missing.
     */
    public String required(int index) {
        return text(index).orElse("");
    }

    /**
     * Rendered text of the last argument, which for most constructs is the
     * mandatory body after any optional prefixes.
     */
    public String last() {
        return rendered.isEmpty() ? "" : required(rendered.size() - 1);
    }

    public Optional<List<MarkupNode>> content(int index) {
        if (index < 0 || index >= slots.size()) {
            return Optional.empty();
        }
        return slots.get(index).getContent();
    }
}
