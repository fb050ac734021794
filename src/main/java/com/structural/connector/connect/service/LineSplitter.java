package com.structural.connector.connect.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.structural.connector.connect.model.Line;
import com.structural.connector.connect.model.Member;
import com.structural.connector.connect.model.SplitPoint;

/**
 * Turns each line's split points into child lines.
 *
 * A mother that ends up with more than two distinct split nodes is replaced by
 * one child per consecutive node pair; its member is re-created on every
 * child. Child ids continue from max(input line ids) + 1.
 */
public class LineSplitter {

    private static final Logger log = LoggerFactory.getLogger(LineSplitter.class);

    private final Map<Integer, Line> lines;
    private final Map<Integer, Member> members;
    private int nextLineId;
    private int childCount;

    /**
     * @param lines   working line collection; children are added, split mothers removed
     * @param members working member collection keyed by line id
     */
    public LineSplitter(Map<Integer, Line> lines, Map<Integer, Member> members) {
        this.lines = lines;
        this.members = members;
        this.nextLineId = lines.keySet().stream().mapToInt(Integer::intValue).max().orElse(0) + 1;
    }

    public void split(Map<Integer, List<SplitPoint>> splitsByLine, LineageBuilder lineage) {
        List<Integer> mothersToRemove = new ArrayList<>();

        for (Map.Entry<Integer, List<SplitPoint>> entry : splitsByLine.entrySet()) {
            int motherId = entry.getKey();
            List<SplitPoint> points = dedupe(entry.getValue());

            if (points.size() <= 2) {
                lineage.selfMap(motherId);
                continue;
            }

            mothersToRemove.add(motherId);
            lineage.registerMother(motherId);
            Member motherMember = members.remove(motherId);

            for (int k = 0; k < points.size() - 1; k++) {
                int nodeA = points.get(k).getNodeId();
                int nodeB = points.get(k + 1).getNodeId();
                if (nodeA == nodeB) {
                    continue;
                }
                int childId = nextLineId++;
                lines.put(childId, new Line(childId, nodeA, nodeB));
                lineage.addChild(motherId, childId);
                if (motherMember != null) {
                    members.put(childId, motherMember.forLine(childId));
                }
                childCount++;
            }
            log.debug("Line {} split into {}", motherId, lineage.getMotherToChildren().get(motherId));
        }

        mothersToRemove.forEach(lines::remove);
    }

    public int getChildCount() {
        return childCount;
    }

    /**
     * Sorts by parameter (stable) and collapses consecutive points on the same node.
     */
    static List<SplitPoint> dedupe(List<SplitPoint> points) {
        List<SplitPoint> sorted = new ArrayList<>(points);
        sorted.sort(Comparator.comparingDouble(SplitPoint::getT));

        List<SplitPoint> result = new ArrayList<>();
        for (SplitPoint point : sorted) {
            if (result.isEmpty() || result.get(result.size() - 1).getNodeId() != point.getNodeId()) {
                result.add(point);
            }
        }
        return result;
    }
}
