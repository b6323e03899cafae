package com.mathtext.cli.model;

/**
 * How the render command writes its variations.
 */
public enum OutputFormat {
    /** One rendering per line. */
    PLAIN,
    /** Templated report grouping variations under each input. */
    REPORT
}
