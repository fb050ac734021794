package com.structural.connector.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.structural.connector.connect.model.CrossSection;
import com.structural.connector.connect.model.GoverningSelection;
import com.structural.connector.connect.model.SectionResults;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SectionWriteBack.
 */
class SectionWriteBackTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String EXPORT = """
        { "analytical_members": [
            { "id": 1, "nodeI": 1, "nodeJ": 2, "section": { "type_id": 7, "type_name": "UB 203x133x25" } },
            { "id": 2, "line_id": 5, "nodeI": 2, "nodeJ": 3 }
        ] }
        """;

    @TempDir
    Path tempDir;

    private final SectionWriteBack writeBack = new SectionWriteBack();

    private static CrossSection section(int id, String name) {
        return CrossSection.builder().id(id).name(name).area(0.006).build();
    }

    @Test
    void testGoverningSectionIsWrittenToMother() throws Exception {
        ObjectNode root = (ObjectNode) MAPPER.readTree(EXPORT);
        GoverningSelection selection = GoverningSelection.builder()
                .governing(1, section(102, "UB 254x146x43"))
                .build();

        SectionWriteBack.Summary summary = writeBack.apply(root, new SectionResults(), selection);

        JsonNode member = root.get("analytical_members").get(0);
        assertThat(member.at("/section/type_name").asText()).isEqualTo("UB 254x146x43");
        assertThat(member.at("/section/type_id").asInt()).isEqualTo(102);
        assertThat(member.at("/section_properties/A").asDouble()).isEqualTo(0.006);
        assertThat(summary.getUpdatedMothers()).isEqualTo(1);
        assertThat(summary.getAppliedChildren()).isZero();
    }

    @Test
    void testChildResultsMatchByLineIdBeforeId() throws Exception {
        ObjectNode root = (ObjectNode) MAPPER.readTree(EXPORT);
        SectionResults results = new SectionResults();
        results.addCrossSection(section(101, "IPE300"));
        results.assign(5, 101);
        results.assign(99, 101);

        SectionWriteBack.Summary summary = writeBack.apply(root, results, GoverningSelection.builder().build());

        JsonNode second = root.get("analytical_members").get(1);
        assertThat(second.at("/section/type_name").asText()).isEqualTo("IPE300");
        assertThat(second.at("/section/family_name").asText()).isEqualTo("IPE300");
        assertThat(root.get("analytical_members").get(0).at("/section/type_name").asText()).isEqualTo("UB 203x133x25");
        assertThat(summary.getAppliedChildren()).isEqualTo(1);
    }

    @Test
    void testApplyWritesNewFileAndLeavesExportUntouched() throws Exception {
        Path export = tempDir.resolve("export.json");
        Path updated = tempDir.resolve("out/updated.json");
        Files.writeString(export, EXPORT);
        GoverningSelection selection = GoverningSelection.builder()
                .governing(2, section(103, "HEA 200"))
                .build();

        writeBack.apply(export, updated, new SectionResults(), selection);

        assertThat(Files.readString(export)).isEqualTo(EXPORT);
        JsonNode written = MAPPER.readTree(updated.toFile());
        assertThat(written.at("/analytical_members/1/section/type_name").asText()).isEqualTo("HEA 200");
    }

    @Test
    void testSectionOverrideRenamesEveryMember() throws Exception {
        ObjectNode root = (ObjectNode) MAPPER.readTree(EXPORT);

        int modified = writeBack.applyOverride(root, "UB406x178x60");

        assertThat(modified).isEqualTo(2);
        assertThat(root.at("/analytical_members/0/section/type_name").asText()).isEqualTo("UB406x178x60");
        assertThat(root.at("/analytical_members/0/section/type_id").asInt()).isEqualTo(7);
        assertThat(root.at("/analytical_members/1/section/type_name").asText()).isEqualTo("UB406x178x60");
    }

    @Test
    void testOriginalSectionsLeavesExportAlone() throws Exception {
        ObjectNode root = (ObjectNode) MAPPER.readTree(EXPORT);

        assertThat(writeBack.applyOverride(root, SectionWriteBack.ORIGINAL_SECTIONS)).isZero();
        assertThat(writeBack.applyOverride(root, " ")).isZero();
        assertThat(writeBack.applyOverride(root, null)).isZero();
        assertThat(root).isEqualTo(MAPPER.readTree(EXPORT));
    }

    @Test
    void testOverrideOnlyFileRun() throws Exception {
        Path export = tempDir.resolve("export.json");
        Path updated = tempDir.resolve("updated.json");
        Files.writeString(export, EXPORT);

        SectionWriteBack.Summary summary = writeBack.apply(export, updated, "UB254x102x28", null, null);

        assertThat(summary.getOverriddenMembers()).isEqualTo(2);
        assertThat(summary.getUpdatedMothers()).isZero();
        JsonNode written = MAPPER.readTree(updated.toFile());
        assertThat(written.at("/analytical_members/1/section/type_name").asText()).isEqualTo("UB254x102x28");
    }

    @Test
    void testNonObjectExportIsRejected() throws Exception {
        Path export = tempDir.resolve("export.json");
        Files.writeString(export, "[]");

        assertThatThrownBy(() -> writeBack.apply(export, tempDir.resolve("u.json"), new SectionResults(),
                GoverningSelection.builder().build()))
                .isInstanceOf(ModelParseException.class);
    }
}
