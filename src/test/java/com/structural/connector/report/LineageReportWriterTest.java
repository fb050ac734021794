package com.structural.connector.report;

import com.structural.connector.connect.model.ConnectionResult;
import com.structural.connector.connect.model.CrossSection;
import com.structural.connector.connect.model.GoverningSelection;
import com.structural.connector.connect.model.Line;
import com.structural.connector.connect.model.Node;
import com.structural.connector.connect.model.Tolerances;
import com.structural.connector.connect.service.IntersectionConnector;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for LineageReportWriter.
 */
class LineageReportWriterTest {

    @TempDir
    Path tempDir;

    private final LineageReportWriter writer = new LineageReportWriter();

    /** Line 1 is crossed by line 2; line 3 stands alone. */
    private ConnectionResult result() {
        Map<Integer, Node> nodes = new LinkedHashMap<>();
        nodes.put(1, new Node(1, 0, 0, 0));
        nodes.put(2, new Node(2, 10, 0, 0));
        nodes.put(3, new Node(3, 5, -5, 0));
        nodes.put(4, new Node(4, 5, 5, 0));
        nodes.put(5, new Node(5, 20, 0, 0));
        nodes.put(6, new Node(6, 20, 5, 0));
        Map<Integer, Line> lines = new LinkedHashMap<>();
        lines.put(1, new Line(1, 1, 2));
        lines.put(2, new Line(2, 3, 4));
        lines.put(3, new Line(3, 5, 6));
        return new IntersectionConnector().connect(nodes, lines, Map.of());
    }

    @Test
    void testReportListsMothersAndStatus() throws Exception {
        String report = writer.render(result(), Tolerances.defaults(), null);

        assertThat(report).contains("# Connection lineage report");
        assertThat(report).contains("| Split mothers | 2 |");
        assertThat(report).contains("| 1 | split | 4, 5 |");
        assertThat(report).contains("| 2 | split | 6, 7 |");
        assertThat(report).contains("| 3 | unchanged | 3 |");
        assertThat(report).doesNotContain("Governing section");
    }

    @Test
    void testReportShowsGoverningSections() throws Exception {
        GoverningSelection selection = GoverningSelection.builder()
                .governing(1, CrossSection.builder().id(9).name("UB 254x146x43").build())
                .unmatchedMother(3)
                .build();

        String report = writer.render(result(), Tolerances.defaults(), selection);

        assertThat(report).contains("| Mother | Status | Children | Governing section |");
        assertThat(report).contains("| 1 | split | 4, 5 | UB 254x146x43 |");
        assertThat(report).contains("| 2 | split | 6, 7 | - |");
        assertThat(report).contains("## Mothers without solver results");
    }

    @Test
    void testAttachedSubSegmentStatus() throws Exception {
        Map<Integer, Node> nodes = new LinkedHashMap<>();
        nodes.put(1, new Node(1, 0, 0, 0));
        nodes.put(2, new Node(2, 10, 0, 0));
        nodes.put(3, new Node(3, 2, 0, 0));
        nodes.put(4, new Node(4, 6, 0, 0));
        Map<Integer, Line> lines = new LinkedHashMap<>();
        lines.put(1, new Line(1, 1, 2));
        lines.put(2, new Line(2, 3, 4));

        String report = writer.render(new IntersectionConnector().connect(nodes, lines, Map.of()),
                Tolerances.defaults(), null);

        assertThat(report).contains("| 1 | augmented | 1, 2 |");
        assertThat(report).contains("| 2 | attached |  |");
    }

    @Test
    void testWriteToFile() throws Exception {
        Path target = tempDir.resolve("reports/lineage.md");

        writer.write(target, result(), Tolerances.defaults(), null);

        assertThat(Files.readString(target)).contains("| 3 | unchanged | 3 |");
    }
}
