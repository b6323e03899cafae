package com.mathtext.cli.output;

import java.io.PrintWriter;
import java.util.List;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mathtext.cli.model.RenderCommandOptions;
import com.mathtext.render.registry.MacroRegistry;

/**
 * Responsible only for printing CLI output for the "render" command.
 * Renderings go to the command's output stream; diagnostics go to the log.
 */
public class RenderResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(RenderResultsPrinter.class);

    public void printBanner(RenderCommandOptions o, int expressionCount) {
        log.info("Rendering {} expression(s), {} variation(s) each", expressionCount, o.getVariations());
        log.info("Seed: {}", o.getSeed() != null ? o.getSeed() : "None (unseeded)");
        log.info("Format: {}", o.getFormat());
    }

    public void printPlain(List<VariationReport> reports, PrintWriter out) {
        for (VariationReport report : reports) {
            for (String variation : report.getVariations()) {
                out.println(variation);
            }
        }
        out.flush();
    }

    public void printMacros(MacroRegistry registry, PrintWriter out) {
        for (String name : new TreeSet<>(registry.names())) {
            out.println(name);
        }
        out.flush();
        log.info("{} constructs registered", registry.size());
    }

    public void printSummary(List<VariationReport> reports) {
        long failed = reports.stream().filter(VariationReport::isFailed).count();
        for (VariationReport report : reports) {
            if (report.isFailed()) {
                log.error("Could not render \"{}\": {}", report.getSource(), report.getError());
            }
        }
        if (failed > 0) {
            log.error("{} of {} expression(s) failed", failed, reports.size());
        } else {
            log.info("Rendered {} expression(s)", reports.size());
        }
    }
}
