package com.mathtext.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the "render" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class RenderCommandOptions {

	@Parameters(arity = "0..*", paramLabel = "EXPR", description = "Markup expressions to render")
	private List<String> expressions = new ArrayList<>();

	@Option(names = { "--input-file", "-i" }, description = "File with one expression per line")
	private Path inputFile;

	@Option(names = { "--variations",
			"-v" }, defaultValue = "3", description = "Renderings per expression (default: ${DEFAULT-VALUE})")
	private int variations;

	@Option(names = { "--seed", "-s" }, description = "Seed for reproducible output")
	private Long seed;

	@Option(names = { "--greek-weights" }, description = "Weights for name,symbol (e.g. 0.8,0.2)")
	private String greekWeights;

	@Option(names = { "--infinity-weights" }, description = "Weights for infinity,inf,symbol")
	private String infinityWeights;

	@Option(names = { "--pi-weights" }, description = "Weights for pi,symbol")
	private String piWeights;

	@Option(names = { "--root-weights" }, description = "Weights for radical,power root styles")
	private String rootWeights;

	@Option(names = {
			"--format" }, defaultValue = "PLAIN", description = "Output format: PLAIN or REPORT (default: ${DEFAULT-VALUE})")
	private OutputFormat format;

	@Option(names = { "--list-macros" }, description = "Print the registered construct names and exit")
	private boolean listMacros;

}
