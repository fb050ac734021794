package com.structural.connector.io;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.structural.connector.connect.model.SectionResults;

/**
 * Reads the sections the structural solver selected per analysed line.
 *
 * Accepts either {@code {"members": {...}, "crossSections": {...}}} or the
 * solver worker's two-element array {@code [members, crossSections]}. Each
 * member carries {@code line_id} and {@code cross_section_id}; cross sections
 * are keyed by id.
 */
public class SectionResultsReader {

    private static final Logger log = LoggerFactory.getLogger(SectionResultsReader.class);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    public SectionResults read(Path file) throws ModelParseException {
        try {
            return read(OBJECT_MAPPER.readTree(file.toFile()));
        } catch (IOException e) {
            throw new ModelParseException("Unable to read section results " + file + ": " + e.getMessage(), e);
        }
    }

    public SectionResults read(JsonNode root) throws ModelParseException {
        JsonNode members;
        JsonNode crossSections;
        if (root != null && root.isArray() && root.size() >= 2) {
            members = root.get(0);
            crossSections = root.get(1);
        } else if (root != null && root.isObject()) {
            members = root.path("members");
            crossSections = root.path("crossSections");
        } else {
            throw new ModelParseException("Section results must be an object or a [members, crossSections] array");
        }

        SectionResults results = new SectionResults();
        Iterator<Map.Entry<String, JsonNode>> sections = crossSections.fields();
        while (sections.hasNext()) {
            Map.Entry<String, JsonNode> entry = sections.next();
            try {
                results.addCrossSection(CrossSectionJson.read(entry.getValue(), Integer.parseInt(entry.getKey())));
            } catch (NumberFormatException e) {
                log.warn("Ignoring cross section with non-numeric key '{}'", entry.getKey());
            }
        }

        for (JsonNode member : members) {
            JsonNode lineId = member.get("line_id");
            JsonNode sectionId = member.get("cross_section_id");
            if (lineId == null || sectionId == null || !lineId.canConvertToInt() || !sectionId.canConvertToInt()) {
                log.warn("Ignoring solver member without numeric line_id/cross_section_id: {}", member);
                continue;
            }
            results.assign(lineId.asInt(), sectionId.asInt());
        }

        log.info("Read {} solver section assignments over {} cross sections",
                results.getSectionIdByLine().size(), results.getCrossSections().size());
        return results;
    }
}
