package com.mathtext.render.registry;

import com.mathtext.model.ArgumentSignature;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * A construct name bound to its argument signature and handler.
 */
@Getter
@ToString
@AllArgsConstructor
public final class MacroRegistryEntry {
    private final String name;
    private final ArgumentSignature signature;
    @ToString.Exclude
    private final MacroHandler handler;
}
