package com.structural.connector.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.structural.connector.connect.model.CrossSection;
import com.structural.connector.connect.model.GoverningSelection;
import com.structural.connector.connect.model.SectionResults;

import lombok.Value;

/**
 * Writes solver sections back into the authoring-tool export so it can be
 * re-imported.
 *
 * An optional section override renames every member's section first.
 * Children that still exist in the export then get their own solver section;
 * every mother finally gets its governing section. Export members are matched
 * by {@code line_id}, falling back to {@code id}.
 */
public class SectionWriteBack {

    private static final Logger log = LoggerFactory.getLogger(SectionWriteBack.class);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    /** Override value that leaves the exported sections as they are. */
    public static final String ORIGINAL_SECTIONS = "Original Sections";

    @Value
    public static class Summary {
        int appliedChildren;
        int updatedMothers;
        int overriddenMembers;
    }

    public Summary apply(Path exportFile, Path targetFile, SectionResults results,
                         GoverningSelection selection) throws ModelParseException, IOException {
        return apply(exportFile, targetFile, null, results, selection);
    }

    /**
     * @param sectionOverride section name for every member, or null
     * @param results         solver sections, or null when only the override applies
     * @param selection       governing sections, or null when only the override applies
     */
    public Summary apply(Path exportFile, Path targetFile, String sectionOverride, SectionResults results,
                         GoverningSelection selection) throws ModelParseException, IOException {
        JsonNode root;
        try {
            root = OBJECT_MAPPER.readTree(exportFile.toFile());
        } catch (IOException e) {
            throw new ModelParseException("Unable to read export " + exportFile + ": " + e.getMessage(), e);
        }
        if (!(root instanceof ObjectNode)) {
            throw new ModelParseException("Export " + exportFile + " is not a JSON object");
        }

        ObjectNode exportRoot = (ObjectNode) root;
        int overridden = applyOverride(exportRoot, sectionOverride);
        Summary solver = results != null && selection != null
                ? apply(exportRoot, results, selection)
                : new Summary(0, 0, 0);
        Summary summary = new Summary(solver.getAppliedChildren(), solver.getUpdatedMothers(), overridden);

        Path parent = targetFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValue(targetFile.toFile(), root);
        return summary;
    }

    public Summary apply(ObjectNode exportRoot, SectionResults results, GoverningSelection selection) {
        MemberIndex index = MemberIndex.of(exportRoot);

        int appliedChildren = 0;
        for (Map.Entry<Integer, Integer> entry : results.getSectionIdByLine().entrySet()) {
            CrossSection section = results.getCrossSections().get(entry.getValue());
            ObjectNode member = index.find(entry.getKey());
            if (section == null || member == null) {
                continue;
            }
            assignSection(member, section);
            appliedChildren++;
        }

        int updatedMothers = 0;
        for (Map.Entry<Integer, CrossSection> entry : selection.getGoverningByMother().entrySet()) {
            ObjectNode member = index.find(entry.getKey());
            if (member == null) {
                continue;
            }
            String before = member.path("section").path("type_name").asText(null);
            assignSection(member, entry.getValue());
            log.info("Mother member {}: section '{}' -> '{}'", entry.getKey(), before, entry.getValue().getName());
            updatedMothers++;
        }

        log.info("Updated {} children from solver output and {} mothers from their governing child",
                appliedChildren, updatedMothers);
        return new Summary(appliedChildren, updatedMothers, 0);
    }

    /**
     * Sets {@code section.type_name} of every export member to the given name.
     * Null, blank or {@value #ORIGINAL_SECTIONS} changes nothing.
     *
     * @return number of members changed
     */
    public int applyOverride(ObjectNode exportRoot, String sectionName) {
        if (sectionName == null || sectionName.isBlank() || ORIGINAL_SECTIONS.equals(sectionName)) {
            return 0;
        }
        int modified = 0;
        for (JsonNode member : membersOf(exportRoot)) {
            if (!(member instanceof ObjectNode)) {
                continue;
            }
            sectionOf((ObjectNode) member).put("type_name", sectionName);
            modified++;
        }
        log.info("Section override '{}' applied to {} members", sectionName, modified);
        return modified;
    }

    private static void assignSection(ObjectNode member, CrossSection section) {
        ObjectNode target = sectionOf(member);
        target.put("type_name", section.getName());
        target.put("type_id", section.getId());
        target.put("family_name", section.getName());
        CrossSectionJson.writeProperties(member.putObject("section_properties"), section);
    }

    private static ObjectNode sectionOf(ObjectNode member) {
        JsonNode existing = member.get("section");
        return existing instanceof ObjectNode ? (ObjectNode) existing : member.putObject("section");
    }

    private static JsonNode membersOf(ObjectNode root) {
        JsonNode members = root.path("analytical_members");
        return members.isArray() && !members.isEmpty() ? members : root.path("members");
    }

    private static final class MemberIndex {
        private final Map<Integer, ObjectNode> byLine = new HashMap<>();
        private final Map<Integer, ObjectNode> byId = new HashMap<>();

        static MemberIndex of(ObjectNode root) {
            MemberIndex index = new MemberIndex();
            for (JsonNode member : membersOf(root)) {
                if (!(member instanceof ObjectNode)) {
                    continue;
                }
                if (member.path("line_id").canConvertToInt()) {
                    index.byLine.put(member.get("line_id").asInt(), (ObjectNode) member);
                }
                if (member.path("id").canConvertToInt()) {
                    index.byId.put(member.get("id").asInt(), (ObjectNode) member);
                }
            }
            return index;
        }

        ObjectNode find(int lineId) {
            ObjectNode member = byLine.get(lineId);
            return member != null ? member : byId.get(lineId);
        }
    }
}
