package com.mathtext.render;

/**
 * Thrown when a tree nests deeper than the configured render depth. The
 * failing call produces no output; shared state is untouched.
 */
public class RenderDepthExceededException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final int maxDepth;

    public RenderDepthExceededException(int maxDepth) {
        super("Markup nesting exceeds the maximum render depth of " + maxDepth);
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
