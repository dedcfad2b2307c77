package com.plantmodel.flowsheet.expansion;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plantmodel.flowsheet.exception.FlowsheetException;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders a human-readable expansion report from {@code templates/expansion-report.ftl}.
 */
public class ExpansionReportWriter {
    private static final Logger log = LoggerFactory.getLogger(ExpansionReportWriter.class);

    static final String REPORT_TEMPLATE = "expansion-report.ftl";

    private final Configuration freemarkerConfig;

    public ExpansionReportWriter() {
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

    public String render(ExpansionResult result) {
        StringWriter out = new StringWriter();
        render(result, out);
        return out.toString();
    }

    public void write(ExpansionResult result, Path file) {
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                render(result, out);
            }
            log.info("Wrote expansion report to {}", file);
        } catch (IOException e) {
            throw new FlowsheetException("Failed to write expansion report " + file, e);
        }
    }

    private void render(ExpansionResult result, Writer out) {
        try {
            Template template = freemarkerConfig.getTemplate(REPORT_TEMPLATE);
            template.process(dataModel(result), out);
        } catch (IOException | TemplateException e) {
            throw new FlowsheetException("Failed to render expansion report for '" + result.getSourceBlock() + "'", e);
        }
    }

    private static Map<String, Object> dataModel(ExpansionResult result) {
        List<Map<String, Object>> equipment = new ArrayList<>();
        for (EquipmentInstance instance : result.getEquipment()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", instance.getId());
            row.put("tag", instance.getTag());
            row.put("componentClass", instance.getComponentClass());
            row.put("train", instance.isShared() ? "shared" : String.valueOf(instance.getTrainNumber()));
            row.put("nozzles", instance.getEquipment().getNozzles().size());
            equipment.add(row);
        }

        List<Map<String, Object>> connections = new ArrayList<>();
        for (ConnectionInstance connection : result.getConnections()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("from", connection.getFromEquipment() + "." + connection.getFromPort());
            row.put("to", connection.getToEquipment() + "." + connection.getToPort());
            row.put("streamKind", connection.getStreamKind());
            row.put("boundary", connection.touchesBoundary());
            connections.add(row);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        result.getMetadata().forEach((k, v) -> metadata.put(k, String.valueOf(v)));

        Map<String, Object> model = new LinkedHashMap<>();
        model.put("flowsheetId", result.getFlowsheetId());
        model.put("sourceBlock", result.getSourceBlock());
        model.put("equipment", equipment);
        model.put("connections", connections);
        model.put("metadata", metadata);
        return model;
    }
}
