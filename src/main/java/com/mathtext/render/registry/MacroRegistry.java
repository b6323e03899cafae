package com.mathtext.render.registry;

import com.mathtext.model.ArgumentSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable table from construct name to signature and handler.
 *
 * <p>Entries are added on a {@link Builder}; a later registration for the
 * same name replaces the earlier one, which is how the custom layer overrides
 * the baseline layer. Once built the registry is read-only and safe to share
 * across threads. Names that were never registered resolve to a
 * pass-through entry that renders the bare name.
 */
public final class MacroRegistry {
    private static final Logger log = LoggerFactory.getLogger(MacroRegistry.class);
    private static final MacroHandler BARE_NAME = (arguments, context) -> arguments.getName();

    private final Map<String, MacroRegistryEntry> entries;

    private MacroRegistry(Map<String, MacroRegistryEntry> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the entry for the name, or the pass-through entry. Never fails.
     */
    public MacroRegistryEntry resolve(String name) {
        MacroRegistryEntry entry = entries.get(name);
        return entry != null ? entry : defaultEntry(name);
    }

    public boolean contains(String name) {
        return entries.containsKey(name);
    }

    public Set<String> names() {
        return entries.keySet();
    }

    public int size() {
        return entries.size();
    }

    /**
     * A builder pre-filled with this registry's entries.
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.entries.putAll(entries);
        return builder;
    }

    static MacroRegistryEntry defaultEntry(String name) {
        return new MacroRegistryEntry(name, ArgumentSignature.none(), BARE_NAME);
    }

    public static final class Builder {
        private final Map<String, MacroRegistryEntry> entries = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(String name, ArgumentSignature signature, MacroHandler handler) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(signature, "signature");
            Objects.requireNonNull(handler, "handler");
            MacroRegistryEntry previous = entries.put(name, new MacroRegistryEntry(name, signature, handler));
            if (previous != null) {
                log.debug("Replaced registration for construct '{}'", name);
            }
            return this;
        }

        public Builder register(String name, String signature, MacroHandler handler) {
            return register(name, ArgumentSignature.parse(signature), handler);
        }

        /**
         * Registers a zero-argument construct that always renders the same text.
         */
        public Builder literal(String name, String text) {
            return register(name, ArgumentSignature.none(), (arguments, context) -> text);
        }

        public MacroRegistry build() {
            return new MacroRegistry(entries);
        }
    }
}
