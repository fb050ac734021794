package com.structural.connector.connect.service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.structural.connector.connect.model.ConnectionResult;
import com.structural.connector.connect.model.Line;
import com.structural.connector.connect.model.Member;
import com.structural.connector.connect.model.Node;
import com.structural.connector.connect.model.SplitPoint;
import com.structural.connector.connect.model.Tolerances;

/**
 * Connects lines that cross or touch in plan on the same story.
 *
 * Works on copies of the inputs and keeps no state between calls:
 * <ol>
 *   <li>collect plan intersections between lines of equal elevation,</li>
 *   <li>split mothers into children at the shared nodes,</li>
 *   <li>attach lines already lying on a mother's span,</li>
 *   <li>make sure every input line has a lineage entry.</li>
 * </ol>
 * A line that references a missing node aborts the pass with
 * {@link com.structural.connector.connect.model.ModelIntegrityException}.
 */
public class IntersectionConnector {

    private static final Logger log = LoggerFactory.getLogger(IntersectionConnector.class);

    public ConnectionResult connect(Map<Integer, Node> nodes,
                                    Map<Integer, Line> lines,
                                    Map<Integer, Member> members,
                                    Tolerances tolerances) {
        Map<Integer, Line> workingLines = new LinkedHashMap<>(lines);
        Map<Integer, Member> workingMembers = new LinkedHashMap<>(members);
        NodeRegistry registry = new NodeRegistry(nodes, tolerances.getTolerance());
        LineageBuilder lineage = new LineageBuilder();

        IntersectionCollector collector = new IntersectionCollector();
        Map<Integer, List<SplitPoint>> splitsByLine = collector.collect(workingLines, registry, tolerances);

        LineSplitter splitter = new LineSplitter(workingLines, workingMembers);
        splitter.split(splitsByLine, lineage);

        SubSegmentAugmenter augmenter = new SubSegmentAugmenter();
        augmenter.augment(lines, workingLines, registry, lineage, tolerances);

        new LineageFinalizer().finalizeMappings(lines, workingLines, lineage);

        log.info("Connected {} lines: {} intersections, {} new nodes, {} child lines, {} attached sub-segments",
                lines.size(), collector.getHitCount(), registry.getCreatedCount(),
                splitter.getChildCount(), augmenter.getAttachedCount());

        return new ConnectionResult(registry.getNodes(), workingLines, workingMembers,
                lineage.getMotherToChildren(), lineage.getChildToMother());
    }

    public ConnectionResult connect(Map<Integer, Node> nodes,
                                    Map<Integer, Line> lines,
                                    Map<Integer, Member> members) {
        return connect(nodes, lines, members, Tolerances.defaults());
    }
}
