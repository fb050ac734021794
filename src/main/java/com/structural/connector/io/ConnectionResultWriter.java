package com.structural.connector.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.structural.connector.connect.model.ConnectionResult;
import com.structural.connector.connect.model.CrossSection;
import com.structural.connector.connect.model.Line;
import com.structural.connector.connect.model.Member;
import com.structural.connector.connect.model.Node;
import com.structural.connector.connect.model.Tolerances;

/**
 * Writes the connected model and its lineage maps as the solver input
 * document. Keys are ids rendered as strings.
 */
public class ConnectionResultWriter {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    public void write(Path target, ConnectionResult result, Map<Integer, CrossSection> crossSections,
                      Tolerances tolerances) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        OBJECT_MAPPER.writerWithDefaultPrettyPrinter()
                .writeValue(target.toFile(), toJson(result, crossSections, tolerances));
    }

    public ObjectNode toJson(ConnectionResult result, Map<Integer, CrossSection> crossSections,
                             Tolerances tolerances) {
        ObjectNode root = OBJECT_MAPPER.createObjectNode();

        ObjectNode nodes = root.putObject("nodes");
        for (Node node : result.getNodes().values()) {
            ObjectNode n = nodes.putObject(String.valueOf(node.getId()));
            n.put("id", node.getId());
            n.put("x", node.getX());
            n.put("y", node.getY());
            n.put("z", node.getZ());
        }

        ObjectNode lines = root.putObject("lines");
        for (Line line : result.getLines().values()) {
            ObjectNode l = lines.putObject(String.valueOf(line.getId()));
            l.put("id", line.getId());
            l.put("Ni", line.getNi());
            l.put("Nj", line.getNj());
        }

        ObjectNode members = root.putObject("members");
        for (Member member : result.getMembers().values()) {
            ObjectNode m = members.putObject(String.valueOf(member.getLineId()));
            m.put("line_id", member.getLineId());
            m.put("cross_section_id", member.getCrossSectionId());
            m.put("material_name", member.getMaterial().getDisplayName());
        }

        ObjectNode sections = root.putObject("crossSections");
        for (CrossSection section : crossSections.values()) {
            CrossSectionJson.write(sections.putObject(String.valueOf(section.getId())), section);
        }

        ObjectNode motherToChildren = root.putObject("motherToChildren");
        for (Map.Entry<Integer, List<Integer>> entry : result.getMotherToChildren().entrySet()) {
            ArrayNode children = motherToChildren.putArray(String.valueOf(entry.getKey()));
            entry.getValue().forEach(children::add);
        }

        ObjectNode childToMother = root.putObject("childToMother");
        result.getChildToMother().forEach((child, mother) -> childToMother.put(String.valueOf(child), mother));

        ObjectNode tol = root.putObject("tolerances");
        tol.put("tolerance", tolerances.getTolerance());
        tol.put("elevationTolerance", tolerances.getElevationTolerance());

        return root;
    }
}
