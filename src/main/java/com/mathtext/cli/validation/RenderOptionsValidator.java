package com.mathtext.cli.validation;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import com.mathtext.cli.exception.OptionsValidationException;
import com.mathtext.cli.model.RenderCommandOptions;
import com.mathtext.cli.model.ValidatedRenderOptions;
import com.mathtext.render.style.StyleWeights;
import com.mathtext.render.style.WeightTable;

public class RenderOptionsValidator {

	public ValidatedRenderOptions validate(RenderCommandOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getVariations() < 1) {
			errors.add("Variations must be at least 1. Got: " + o.getVariations());
		}

		List<String> expressions = new ArrayList<>(o.getExpressions());
		if (o.getInputFile() != null) {
			if (!Files.isRegularFile(o.getInputFile())) {
				errors.add("Input file does not exist or is not a file: " + o.getInputFile());
			} else {
				expressions.addAll(readExpressions(o, errors));
			}
		}

		if (expressions.isEmpty() && !o.isListMacros() && errors.isEmpty()) {
			errors.add("At least one expression or --input-file is required.");
		}

		StyleWeights.StyleWeightsBuilder weights = StyleWeights.builder();
		applyWeights("--greek-weights", o.getGreekWeights(), weights::greekLetter, errors);
		applyWeights("--infinity-weights", o.getInfinityWeights(), weights::infinity, errors);
		applyWeights("--pi-weights", o.getPiWeights(), weights::pi, errors);
		applyWeights("--root-weights", o.getRootWeights(), weights::rootStyle, errors);

		StyleWeights built = null;
		try {
			built = weights.build();
		} catch (IllegalArgumentException e) {
			errors.add(e.getMessage());
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedRenderOptions(List.copyOf(expressions), built);
	}

	private static List<String> readExpressions(RenderCommandOptions o, List<String> errors) {
		try {
			return Files.readAllLines(o.getInputFile(), StandardCharsets.UTF_8).stream()
					.filter(line -> !line.isBlank())
					.toList();
		} catch (IOException e) {
			errors.add("Cannot read input file " + o.getInputFile() + ": " + e.getMessage());
			return List.of();
		}
	}

	private static void applyWeights(String option, String raw, Consumer<WeightTable> target, List<String> errors) {
		if (raw == null) {
			return;
		}
		try {
			target.accept(WeightTable.parse(raw));
		} catch (IllegalArgumentException e) {
			errors.add(option + ": " + e.getMessage());
		}
	}
}
