package com.mathtext.cli.output;

import java.util.List;

import lombok.Builder;
import lombok.Data;

/**
 * The renderings produced for one input expression, or the reason there are none.
 */
@Data
@Builder
public class VariationReport {
    private String source;
    @Builder.Default
    private List<String> variations = List.of();
    private String error;

    public boolean isFailed() {
        return error != null;
    }

    public static VariationReport failure(String source, String error) {
        return VariationReport.builder()
                .source(source)
                .error(error)
                .build();
    }
}
