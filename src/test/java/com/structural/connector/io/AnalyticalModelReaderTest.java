package com.structural.connector.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.structural.connector.connect.model.CrossSection;
import com.structural.connector.connect.model.Line;
import com.structural.connector.connect.model.Material;
import com.structural.connector.connect.model.Member;
import com.structural.connector.connect.model.Node;
import com.structural.connector.connect.model.StructuralModel;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for AnalyticalModelReader.
 */
class AnalyticalModelReaderTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final AnalyticalModelReader reader = new AnalyticalModelReader();

    @TempDir
    Path tempDir;

    private StructuralModel read(String json) throws Exception {
        return reader.read(MAPPER.readTree(json));
    }

    @Test
    void testReadMembersWithEndpointsAndSections() throws Exception {
        String json = """
            {
              "analytical_members": [
                {
                  "id": 12, "nodeI": 1, "nodeJ": 2,
                  "endpoints": { "i": [0.0, 0.0, 3.0], "j": [6.0, 0.0, 3.0] },
                  "section": { "type_id": 7, "type_name": "UB 254x146x43", "family_name": "UB" },
                  "section_properties": {
                    "STRUCTURAL_SECTION_AREA": 0.0055,
                    "STRUCTURAL_SECTION_COMMON_MOMENT_OF_INERTIA_STRONG_AXIS": 6.5e-5,
                    "STRUCTURAL_SECTION_COMMON_HEIGHT": 0.26,
                    "STRUCTURAL_SECTION_COMMON_WIDTH": 0.147
                  }
                },
                {
                  "id": 13, "nodeI": 2, "nodeJ": 3,
                  "endpoints": { "I": [6.0, 0.0, 3.0], "J": [6.0, 5.0, 3.0] },
                  "section": { "type_id": 7 },
                  "material": "Concrete"
                }
              ]
            }
            """;

        StructuralModel model = read(json);

        assertThat(model.getNodes()).containsOnlyKeys(1, 2, 3);
        assertThat(model.getNodes().get(3)).isEqualTo(new Node(3, 6.0, 5.0, 3.0));
        assertThat(model.getLines()).containsOnlyKeys(12, 13);
        assertThat(model.getLines().get(12)).isEqualTo(new Line(12, 1, 2));
        assertThat(model.getMembers().get(12)).isEqualTo(new Member(12, 7, Material.STEEL));
        assertThat(model.getMembers().get(13).getMaterial()).isEqualTo(Material.CONCRETE);

        assertThat(model.getCrossSections()).containsOnlyKeys(7);
        CrossSection section = model.getCrossSections().get(7);
        assertThat(section.getName()).isEqualTo("UB 254x146x43");
        assertThat(section.getArea()).isEqualTo(0.0055);
        assertThat(section.getIz()).isEqualTo(6.5e-5);
        assertThat(section.getIy()).isEqualTo(1e-5);
        assertThat(section.getH()).isEqualTo(0.26);
        assertThat(section.getB()).isEqualTo(0.147);
    }

    @Test
    void testFirstOccurrenceDefinesNodeCoordinates() throws Exception {
        String json = """
            { "analytical_members": [
                { "id": 1, "nodeI": 1, "nodeJ": 2, "endpoints": { "i": [0, 0, 0], "j": [5, 0, 0] } },
                { "id": 2, "nodeI": 2, "nodeJ": 3, "endpoints": { "i": [5.001, 0, 0], "j": [5, 5, 0] } }
            ] }
            """;

        StructuralModel model = read(json);

        assertThat(model.getNodes().get(2).getX()).isEqualTo(5.0);
    }

    @Test
    void testMissingPropertiesFallBackToDefaults() throws Exception {
        String json = """
            { "analytical_members": [
                { "id": 4, "nodeI": 1, "nodeJ": 2,
                  "endpoints": { "i": [0, 0, 0], "j": [1, 0, 0] },
                  "section": { "family_name": "HEA" },
                  "section_properties": { "STRUCTURAL_SECTION_AREA": 0, "HEIGHT": 0.5 } }
            ] }
            """;

        StructuralModel model = read(json);

        // without a type_id the member id doubles as section id
        CrossSection section = model.getCrossSections().get(4);
        assertThat(section.getName()).isEqualTo("HEA");
        assertThat(section.getArea()).isEqualTo(0.01);
        assertThat(section.getH()).isEqualTo(0.5);
        assertThat(section.getB()).isEqualTo(0.5);
        assertThat(section.getJxx()).isEqualTo(1e-6);
        assertThat(model.getMembers().get(4).getCrossSectionId()).isEqualTo(4);
    }

    @Test
    void testMalformedEntriesAreSkipped() throws Exception {
        String json = """
            { "analytical_members": [
                { "id": 1, "nodeJ": 2, "endpoints": { "i": [0, 0, 0], "j": [1, 0, 0] } },
                { "id": 2, "nodeI": 1, "nodeJ": 2, "endpoints": { "i": [0, 0], "j": [1, 0, 0] } },
                { "id": 3, "nodeI": 1, "nodeJ": 2, "endpoints": { "i": [0, "a", 0], "j": [1, 0, 0] } },
                { "id": 4, "nodeI": 1, "nodeJ": 2, "endpoints": { "i": [0, 0, 0], "j": [1, 0, 0] }, "material": "Timber" },
                { "id": 5, "nodeI": 1, "nodeJ": 2, "endpoints": { "i": [0, 0, 0], "j": [1, 0, 0] } }
            ] }
            """;

        StructuralModel model = read(json);

        assertThat(model.getLines()).containsOnlyKeys(5);
        assertThat(reader.getSkippedCount()).isEqualTo(4);
    }

    @Test
    void testMembersKeyIsAccepted() throws Exception {
        String json = """
            { "members": [
                { "id": "8", "nodeI": "1", "nodeJ": 2, "endpoints": { "i": [0, 0, 0], "j": [1, 0, 0] } }
            ] }
            """;

        StructuralModel model = read(json);

        assertThat(model.getLines().get(8)).isEqualTo(new Line(8, 1, 2));
    }

    @Test
    void testNoMembersIsAnError() {
        assertThatThrownBy(() -> read("{ \"analytical_members\": [] }"))
                .isInstanceOf(ModelParseException.class)
                .hasMessageContaining("No members found");
        assertThatThrownBy(() -> read("{}"))
                .isInstanceOf(ModelParseException.class);
    }

    @Test
    void testReadFromFile() throws Exception {
        Path export = tempDir.resolve("export.json");
        Files.writeString(export, """
            { "analytical_members": [
                { "id": 1, "nodeI": 1, "nodeJ": 2, "endpoints": { "i": [0, 0, 0], "j": [1, 0, 0] } }
            ] }
            """);

        StructuralModel model = reader.read(export);

        assertThat(model.getLines()).hasSize(1);
    }

    @Test
    void testUnreadableFileIsParseError() throws IOException {
        Path export = tempDir.resolve("broken.json");
        Files.writeString(export, "{ not json");

        assertThatThrownBy(() -> reader.read(export))
                .isInstanceOf(ModelParseException.class)
                .hasMessageContaining("broken.json");
    }
}
