package com.mathtext;

import com.mathtext.cli.RenderCommand;
import picocli.CommandLine;

/**
 * Main entry point for the math text variations tool.
 * Renders LaTeX-style math markup as several randomly styled plain-text variants.
 */
public class MathTextApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new RenderCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
