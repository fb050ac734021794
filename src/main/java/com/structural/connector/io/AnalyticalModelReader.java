package com.structural.connector.io;

import java.io.IOException;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.structural.connector.connect.model.CrossSection;
import com.structural.connector.connect.model.Line;
import com.structural.connector.connect.model.Material;
import com.structural.connector.connect.model.Member;
import com.structural.connector.connect.model.Node;
import com.structural.connector.connect.model.StructuralModel;

/**
 * Reads the analytical-member export written by the authoring tool's worker.
 *
 * Format:
 * <pre>
 * { "analytical_members": [
 *     { "id": 12, "nodeI": 1, "nodeJ": 2,
 *       "endpoints": { "i": [x, y, z], "j": [x, y, z] },
 *       "section": { "type_id": 7, "type_name": "UB 254x146x43", "family_name": "UB" },
 *       "section_properties": { "STRUCTURAL_SECTION_AREA": 0.0055, ... } } ] }
 * </pre>
 * The line id is the member id. The first member that mentions a node defines
 * its coordinates. Entries that cannot be read are skipped.
 */
public class AnalyticalModelReader {

    private static final Logger log = LoggerFactory.getLogger(AnalyticalModelReader.class);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private int skippedCount;

    public StructuralModel read(Path exportFile) throws ModelParseException {
        try {
            return read(OBJECT_MAPPER.readTree(exportFile.toFile()));
        } catch (IOException e) {
            throw new ModelParseException("Unable to read export " + exportFile + ": " + e.getMessage(), e);
        }
    }

    public StructuralModel read(JsonNode root) throws ModelParseException {
        JsonNode membersRaw = membersArray(root);
        if (membersRaw == null || membersRaw.isEmpty()) {
            throw new ModelParseException("No members found in analysis output");
        }

        StructuralModel model = new StructuralModel();
        skippedCount = 0;
        int idx = 0;
        for (JsonNode raw : membersRaw) {
            try {
                readMember(raw, idx, model);
            } catch (IllegalArgumentException e) {
                skippedCount++;
                log.warn("Skipping member at index {}: {}", idx, e.getMessage());
            }
            idx++;
        }

        log.info("Read {} nodes, {} lines, {} cross sections ({} members skipped)",
                model.getNodes().size(), model.getLines().size(), model.getCrossSections().size(), skippedCount);
        return model;
    }

    public int getSkippedCount() {
        return skippedCount;
    }

    private static JsonNode membersArray(JsonNode root) {
        if (root == null) {
            return null;
        }
        JsonNode analytical = root.get("analytical_members");
        if (analytical != null && analytical.isArray() && !analytical.isEmpty()) {
            return analytical;
        }
        JsonNode members = root.get("members");
        return members != null && members.isArray() ? members : null;
    }

    private static void readMember(JsonNode raw, int idx, StructuralModel model) {
        int memberId = optionalInt(raw, "id", idx);
        int nodeI = requiredInt(raw, "nodeI");
        int nodeJ = requiredInt(raw, "nodeJ");

        JsonNode endpoints = raw.path("endpoints");
        double[] coordI = coordinate(endpoints, "i", "I");
        double[] coordJ = coordinate(endpoints, "j", "J");

        JsonNode section = raw.path("section");
        int crossSectionId = optionalInt(section, "type_id", memberId);
        CrossSection crossSection = model.hasCrossSection(crossSectionId)
                ? null
                : readCrossSection(crossSectionId, section, raw.path("section_properties"));
        Material material = readMaterial(raw);

        if (!model.hasNode(nodeI)) {
            model.addNode(new Node(nodeI, coordI[0], coordI[1], coordI[2]));
        }
        if (!model.hasNode(nodeJ)) {
            model.addNode(new Node(nodeJ, coordJ[0], coordJ[1], coordJ[2]));
        }
        model.addLine(new Line(memberId, nodeI, nodeJ));
        if (crossSection != null) {
            model.addCrossSection(crossSection);
        }
        model.addMember(new Member(memberId, crossSectionId, material));
    }

    private static CrossSection readCrossSection(int id, JsonNode section, JsonNode props) {
        double height = firstNonZero(props, 0.3, "STRUCTURAL_SECTION_COMMON_HEIGHT", "HEIGHT");
        double width = firstNonZero(props, height, "STRUCTURAL_SECTION_COMMON_WIDTH", "WIDTH");
        return CrossSection.builder()
                .id(id)
                .name(firstText(section, "Section", "type_name", "family_name"))
                .area(firstNonZero(props, 0.01, "STRUCTURAL_SECTION_AREA"))
                .iz(firstNonZero(props, 1e-4, "STRUCTURAL_SECTION_COMMON_MOMENT_OF_INERTIA_STRONG_AXIS"))
                .iy(firstNonZero(props, 1e-5, "STRUCTURAL_SECTION_COMMON_MOMENT_OF_INERTIA_WEAK_AXIS"))
                .jxx(firstNonZero(props, 1e-6, "STRUCTURAL_SECTION_COMMON_TORSIONAL_MOMENT_OF_INERTIA"))
                .b(width)
                .h(height)
                .build();
    }

    private static Material readMaterial(JsonNode raw) {
        JsonNode material = raw.get("material");
        return material == null || material.isNull() ? Material.STEEL : Material.fromName(material.asText());
    }

    private static double[] coordinate(JsonNode endpoints, String key, String altKey) {
        JsonNode point = endpoints.get(key);
        if (point == null || point.isNull() || point.isEmpty()) {
            point = endpoints.get(altKey);
        }
        if (point == null || point.isNull() || point.isEmpty()) {
            return new double[] { 0.0, 0.0, 0.0 };
        }
        if (!point.isArray() || point.size() < 3) {
            throw new IllegalArgumentException("endpoint '" + key + "' must be an [x, y, z] array");
        }
        double[] xyz = new double[3];
        for (int k = 0; k < 3; k++) {
            JsonNode value = point.get(k);
            if (!value.isNumber()) {
                throw new IllegalArgumentException("endpoint '" + key + "' has a non-numeric coordinate");
            }
            xyz[k] = value.asDouble();
        }
        return xyz;
    }

    private static int requiredInt(JsonNode raw, String field) {
        JsonNode value = raw.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("missing '" + field + "'");
        }
        return toInt(value, field);
    }

    private static int optionalInt(JsonNode raw, String field, int fallback) {
        JsonNode value = raw.get(field);
        if (value == null || value.isNull()) {
            return fallback;
        }
        return toInt(value, field);
    }

    private static int toInt(JsonNode value, String field) {
        if (value.canConvertToInt()) {
            return value.asInt();
        }
        if (value.isTextual()) {
            try {
                return Integer.parseInt(value.asText().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("'" + field + "' is not an integer: " + value.asText(), e);
            }
        }
        throw new IllegalArgumentException("'" + field + "' is not an integer: " + value);
    }

    private static double firstNonZero(JsonNode props, double fallback, String... keys) {
        for (String key : keys) {
            JsonNode value = props.get(key);
            if (value != null && value.isNumber() && value.asDouble() != 0.0) {
                return value.asDouble();
            }
        }
        return fallback;
    }

    private static String firstText(JsonNode node, String fallback, String... keys) {
        for (String key : keys) {
            JsonNode value = node.get(key);
            if (value != null && value.isTextual() && !value.asText().isEmpty()) {
                return value.asText();
            }
        }
        return fallback;
    }
}
