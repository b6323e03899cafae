package com.mathtext.cli.output;

import java.io.IOException;
import java.io.Writer;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Writes variation reports through the {@code variations.ftl} template.
 */
public class VariationsReportWriter {

    private static final Logger log = LoggerFactory.getLogger(VariationsReportWriter.class);
    static final String TEMPLATE_NAME = "variations.ftl";

    private final Configuration freemarkerConfig;

    public VariationsReportWriter() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public void write(List<VariationReport> reports, Writer out) throws IOException, TemplateException {
        Template template = freemarkerConfig.getTemplate(TEMPLATE_NAME);
        Map<String, Object> model = new HashMap<>();
        model.put("reports", reports);
        template.process(model, out);
        out.flush();
        log.debug("Wrote report for {} expressions", reports.size());
    }
}
