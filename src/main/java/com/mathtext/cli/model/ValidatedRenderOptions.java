package com.mathtext.cli.model;

import java.util.List;

import com.mathtext.render.style.StyleWeights;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps RenderCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedRenderOptions {
    List<String> expressions;
    StyleWeights weights;
}
