package com.structural.connector.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.structural.connector.connect.model.CrossSection;

import lombok.experimental.UtilityClass;

/**
 * Cross-section property names shared by the solver documents and the export
 * write-back.
 */
@UtilityClass
public class CrossSectionJson {

    public static final String AREA = "A";
    public static final String IZ = "Iz";
    public static final String IY = "Iy";
    public static final String JXX = "Jxx";
    public static final String WIDTH = "b";
    public static final String HEIGHT = "h";

    /**
     * Writes the section properties (everything except id and name).
     */
    public static void writeProperties(ObjectNode target, CrossSection section) {
        target.put(AREA, section.getArea());
        target.put(IZ, section.getIz());
        target.put(IY, section.getIy());
        target.put(JXX, section.getJxx());
        target.put(WIDTH, section.getB());
        target.put(HEIGHT, section.getH());
    }

    public static void write(ObjectNode target, CrossSection section) {
        target.put("id", section.getId());
        target.put("name", section.getName());
        writeProperties(target, section);
    }

    public static CrossSection read(JsonNode node, int fallbackId) {
        CrossSection defaults = CrossSection.builder().id(fallbackId).build();
        return CrossSection.builder()
                .id(node.path("id").asInt(fallbackId))
                .name(node.path("name").asText(defaults.getName()))
                .area(node.path(AREA).asDouble(defaults.getArea()))
                .iz(node.path(IZ).asDouble(defaults.getIz()))
                .iy(node.path(IY).asDouble(defaults.getIy()))
                .jxx(node.path(JXX).asDouble(defaults.getJxx()))
                .b(node.path(WIDTH).asDouble(defaults.getB()))
                .h(node.path(HEIGHT).asDouble(defaults.getH()))
                .build();
    }
}
