package com.structural.connector.connect.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.structural.connector.connect.geometry.PlanGeometry;
import com.structural.connector.connect.geometry.PlanPoint;
import com.structural.connector.connect.geometry.SegmentHit;
import com.structural.connector.connect.model.Line;
import com.structural.connector.connect.model.Node;
import com.structural.connector.connect.model.SplitPoint;
import com.structural.connector.connect.model.Tolerances;

/**
 * Scans every unordered pair of lines on the same story and records where
 * they meet in plan.
 *
 * The scan is quadratic in the number of lines. Pairs are visited in line
 * insertion order so synthetic node ids are reproducible.
 */
public class IntersectionCollector {

    private static final Logger log = LoggerFactory.getLogger(IntersectionCollector.class);

    private int hitCount;

    /**
     * @return split points per line id, each list seeded with (0, Ni) and (1, Nj)
     */
    public Map<Integer, List<SplitPoint>> collect(Map<Integer, Line> lines,
                                                  NodeRegistry registry,
                                                  Tolerances tolerances) {
        Map<Integer, List<SplitPoint>> splitsByLine = initSplitPoints(lines);
        List<LinePlan> plans = new ArrayList<>(lines.size());
        for (Line line : lines.values()) {
            plans.add(LinePlan.of(line, registry));
        }

        double tol = tolerances.getTolerance();
        hitCount = 0;
        for (int i = 0; i < plans.size(); i++) {
            LinePlan a = plans.get(i);
            for (int j = i + 1; j < plans.size(); j++) {
                LinePlan b = plans.get(j);
                if (!tolerances.sameElevation(a.elevation, b.elevation)) {
                    continue;
                }

                Optional<SegmentHit> hit = PlanGeometry.intersectSegmentsXY(a.start, a.end, b.start, b.end, tol);
                if (hit.isEmpty()) {
                    continue;
                }

                SegmentHit h = hit.get();
                double z = (a.elevation + b.elevation) * 0.5;
                int nodeId = registry.findOrCreateNode(h.getX(), h.getY(), z);
                splitsByLine.get(a.lineId).add(new SplitPoint(h.getT(), nodeId));
                splitsByLine.get(b.lineId).add(new SplitPoint(h.getU(), nodeId));
                hitCount++;
                log.debug("Lines {} and {} meet at node {} (t={}, u={})",
                        a.lineId, b.lineId, nodeId, h.getT(), h.getU());
            }
        }
        return splitsByLine;
    }

    public int getHitCount() {
        return hitCount;
    }

    private static Map<Integer, List<SplitPoint>> initSplitPoints(Map<Integer, Line> lines) {
        Map<Integer, List<SplitPoint>> splits = new LinkedHashMap<>();
        for (Line line : lines.values()) {
            List<SplitPoint> points = new ArrayList<>();
            points.add(new SplitPoint(0.0, line.getNi()));
            points.add(new SplitPoint(1.0, line.getNj()));
            splits.put(line.getId(), points);
        }
        return splits;
    }

    private static final class LinePlan {
        final int lineId;
        final PlanPoint start;
        final PlanPoint end;
        final double elevation;

        private LinePlan(int lineId, PlanPoint start, PlanPoint end, double elevation) {
            this.lineId = lineId;
            this.start = start;
            this.end = end;
            this.elevation = elevation;
        }

        static LinePlan of(Line line, NodeRegistry registry) {
            Node ni = registry.start(line);
            Node nj = registry.end(line);
            return new LinePlan(line.getId(), PlanPoint.of(ni), PlanPoint.of(nj), (ni.getZ() + nj.getZ()) * 0.5);
        }
    }
}
