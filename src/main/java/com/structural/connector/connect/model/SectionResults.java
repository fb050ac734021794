package com.structural.connector.connect.model;

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Getter;

/**
 * Sections chosen by the structural solver, one per analysed (child) line.
 */
@Getter
public class SectionResults {

    private final Map<Integer, Integer> sectionIdByLine = new LinkedHashMap<>();
    private final Map<Integer, CrossSection> crossSections = new LinkedHashMap<>();

    public void assign(int lineId, int crossSectionId) {
        sectionIdByLine.put(lineId, crossSectionId);
    }

    public void addCrossSection(CrossSection crossSection) {
        crossSections.put(crossSection.getId(), crossSection);
    }

    public boolean hasResultFor(int lineId) {
        return sectionIdByLine.containsKey(lineId);
    }

    /**
     * Section assigned to the line, or null when the line has no result or
     * references an unknown section.
     */
    public CrossSection sectionFor(int lineId) {
        Integer sectionId = sectionIdByLine.get(lineId);
        return sectionId == null ? null : crossSections.get(sectionId);
    }
}
