package com.mathtext.cli;

import com.mathtext.MathTextConverter;
import com.mathtext.cli.exception.OptionsValidationException;
import com.mathtext.cli.model.OutputFormat;
import com.mathtext.cli.model.RenderCommandOptions;
import com.mathtext.cli.model.ValidatedRenderOptions;
import com.mathtext.cli.output.RenderResultsPrinter;
import com.mathtext.cli.output.VariationReport;
import com.mathtext.cli.output.VariationsReportWriter;
import com.mathtext.cli.validation.RenderOptionsValidator;
import com.mathtext.parser.MarkupParseException;
import com.mathtext.render.RenderDepthExceededException;
import com.mathtext.render.RenderOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;

/**
 * CLI command that renders each input expression several times with
 * independently drawn styles.
 */
@Command(
        name = "render",
        mixinStandardHelpOptions = true,
        version = "math-text 1.0.0",
        description = "Renders LaTeX-style math markup as plain-text variations."
)
public class RenderCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RenderCommand.class);

    @Mixin
    private RenderCommandOptions options = new RenderCommandOptions();

    @Spec
    private CommandSpec spec;

    private final MathTextConverter converter;
    private final RenderOptionsValidator validator = new RenderOptionsValidator();
    private final RenderResultsPrinter printer = new RenderResultsPrinter();

    public RenderCommand() {
        this(MathTextConverter.standard());
    }

    public RenderCommand(MathTextConverter converter) {
        this.converter = converter;
    }

    @Override
    public Integer call() {
        ValidatedRenderOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 1;
        }

        PrintWriter out = spec.commandLine().getOut();
        try {
            if (options.isListMacros()) {
                printer.printMacros(converter.getRegistry(), out);
                if (validated.getExpressions().isEmpty()) {
                    return 0;
                }
            }

            printer.printBanner(options, validated.getExpressions().size());

            RenderOptions renderOptions = RenderOptions.builder()
                    .randomSource(options.getSeed() != null ? new Random(options.getSeed()) : new Random())
                    .weights(validated.getWeights())
                    .build();

            List<VariationReport> reports = new ArrayList<>();
            for (String expression : validated.getExpressions()) {
                reports.add(renderVariations(expression, renderOptions));
            }

            if (options.getFormat() == OutputFormat.REPORT) {
                new VariationsReportWriter().write(reports, out);
            } else {
                printer.printPlain(reports, out);
            }
            printer.printSummary(reports);

            return reports.stream().anyMatch(VariationReport::isFailed) ? 1 : 0;

        } catch (Exception e) {
            log.error("Rendering failed with exception", e);
            return 1;
        }
    }

    private VariationReport renderVariations(String expression, RenderOptions renderOptions) {
        try {
            List<String> variations = new ArrayList<>(options.getVariations());
            for (int i = 0; i < options.getVariations(); i++) {
                variations.add(converter.renderToText(expression, renderOptions));
            }
            return VariationReport.builder()
                    .source(expression)
                    .variations(variations)
                    .build();
        } catch (MarkupParseException | RenderDepthExceededException e) {
            return VariationReport.failure(expression, e.getMessage());
        }
    }
}
