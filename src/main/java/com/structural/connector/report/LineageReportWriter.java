package com.structural.connector.report;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.structural.connector.connect.model.ConnectionResult;
import com.structural.connector.connect.model.CrossSection;
import com.structural.connector.connect.model.GoverningSelection;
import com.structural.connector.connect.model.Tolerances;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;
import lombok.Value;

/**
 * Renders a Markdown report of the lineage maps from
 * {@code /templates/lineage-report.ftl}.
 */
public class LineageReportWriter {

    private static final Logger log = LoggerFactory.getLogger(LineageReportWriter.class);

    private static final String TEMPLATE_NAME = "lineage-report.ftl";

    private final Configuration freemarkerConfig;

    @Value
    public static class MotherRow {
        int motherId;
        String status;
        List<Integer> children;
        String governingSection;
    }

    public LineageReportWriter() {
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

    public void write(Path target, ConnectionResult result, Tolerances tolerances,
                      GoverningSelection selection) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, render(result, tolerances, selection));
        log.debug("Lineage report written to {}", target);
    }

    /**
     * @param selection governing sections, or null when no solver results were supplied
     */
    public String render(ConnectionResult result, Tolerances tolerances, GoverningSelection selection)
            throws IOException {
        Map<String, Object> model = new HashMap<>();
        model.put("tolerance", tolerances.getTolerance());
        model.put("elevationTolerance", tolerances.getElevationTolerance());
        model.put("nodeCount", result.getNodes().size());
        model.put("lineCount", result.getLines().size());
        model.put("memberCount", result.getMembers().size());
        model.put("splitCount", result.splitMotherCount());
        model.put("hasSelection", selection != null);
        model.put("unmatchedMothers", selection != null ? selection.getUnmatchedMothers() : List.of());
        model.put("mothers", rows(result, selection));

        try {
            Template template = freemarkerConfig.getTemplate(TEMPLATE_NAME);
            StringWriter out = new StringWriter();
            template.process(model, out);
            return out.toString();
        } catch (TemplateException e) {
            throw new IOException("Failed to render " + TEMPLATE_NAME + ": " + e.getMessage(), e);
        }
    }

    private static List<MotherRow> rows(ConnectionResult result, GoverningSelection selection) {
        List<MotherRow> rows = new ArrayList<>();
        for (Map.Entry<Integer, List<Integer>> entry : result.getMotherToChildren().entrySet()) {
            int motherId = entry.getKey();
            CrossSection governing = selection != null ? selection.getGoverningByMother().get(motherId) : null;
            rows.add(new MotherRow(motherId, status(result, motherId, entry.getValue()), entry.getValue(),
                    governing != null ? governing.getName() : null));
        }
        return rows;
    }

    private static String status(ConnectionResult result, int motherId, List<Integer> children) {
        if (!result.getLines().containsKey(motherId)) {
            return children.isEmpty() ? "removed" : "split";
        }
        if (children.isEmpty()) {
            return "attached";
        }
        return children.size() > 1 ? "augmented" : "unchanged";
    }
}
