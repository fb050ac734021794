package com.structural.connector.connect.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;

/**
 * Analytical model as read from an authoring-tool export. Collections keep
 * the order in which entries were read.
 */
@Getter
public class StructuralModel {

    private final Map<Integer, Node> nodes = new LinkedHashMap<>();
    private final Map<Integer, Line> lines = new LinkedHashMap<>();
    private final Map<Integer, CrossSection> crossSections = new LinkedHashMap<>();
    private final Map<Integer, Member> members = new LinkedHashMap<>();

    public void addNode(Node node) {
        nodes.put(node.getId(), node);
    }

    public void addLine(Line line) {
        lines.put(line.getId(), line);
    }

    public void addCrossSection(CrossSection crossSection) {
        crossSections.put(crossSection.getId(), crossSection);
    }

    public void addMember(Member member) {
        members.put(member.getLineId(), member);
    }

    public void removeNode(int nodeId) {
        nodes.remove(nodeId);
    }

    public boolean hasNode(int nodeId) {
        return nodes.containsKey(nodeId);
    }

    public boolean hasCrossSection(int crossSectionId) {
        return crossSections.containsKey(crossSectionId);
    }

    /**
     * Distinct node elevations, lowest first.
     */
    public List<Double> elevations() {
        return nodes.values().stream()
                .map(Node::getZ)
                .distinct()
                .sorted()
                .toList();
    }

    /**
     * Ids of the nodes lying exactly at elevation {@code z}.
     */
    public List<Integer> nodeIdsAtElevation(double z) {
        return nodes.values().stream()
                .filter(n -> n.getZ() == z)
                .map(Node::getId)
                .toList();
    }
}
