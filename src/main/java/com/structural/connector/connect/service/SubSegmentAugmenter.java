package com.structural.connector.connect.service;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.structural.connector.connect.geometry.PlanGeometry;
import com.structural.connector.connect.geometry.PlanPoint;
import com.structural.connector.connect.model.Line;
import com.structural.connector.connect.model.Tolerances;

/**
 * Attaches lines that already lie on part of a mother's span (for example a
 * shorter duplicate drawn over a longer member) to that mother's children.
 *
 * Only the lineage maps change. An attached line leaves its own entry empty,
 * cannot be attached to another mother and does not act as a mother itself
 * afterwards; mothers are visited in registration order, so the first match
 * wins.
 */
public class SubSegmentAugmenter {

    private static final Logger log = LoggerFactory.getLogger(SubSegmentAugmenter.class);

    private int attachedCount;

    /**
     * @param originalLines input lines, used for the geometry of split mothers
     * @param lines         final line collection; candidates are taken from here
     */
    public void augment(Map<Integer, Line> originalLines,
                        Map<Integer, Line> lines,
                        NodeRegistry registry,
                        LineageBuilder lineage,
                        Tolerances tolerances) {
        double tol = tolerances.getTolerance();

        for (int motherId : lineage.motherIds()) {
            if (lineage.isClaimedByOther(motherId)) {
                continue;
            }
            Line mother = originalLines.getOrDefault(motherId, lines.get(motherId));
            if (mother == null) {
                continue;
            }
            PlanPoint a = PlanPoint.of(registry.start(mother));
            PlanPoint b = PlanPoint.of(registry.end(mother));
            // a zero-length span would contain every point
            if (Math.abs(b.getX() - a.getX()) <= tol && Math.abs(b.getY() - a.getY()) <= tol) {
                continue;
            }
            double motherElevation = registry.averageElevation(mother);

            for (Line candidate : lines.values()) {
                int candidateId = candidate.getId();
                if (candidateId == motherId || lineage.isClaimedByOther(candidateId)) {
                    continue;
                }
                if (!tolerances.sameElevation(registry.averageElevation(candidate), motherElevation)) {
                    continue;
                }
                PlanPoint c1 = PlanPoint.of(registry.start(candidate));
                PlanPoint c2 = PlanPoint.of(registry.end(candidate));
                if (!PlanGeometry.collinearXY(a, b, c1, tol) || !PlanGeometry.collinearXY(a, b, c2, tol)) {
                    continue;
                }
                if (!PlanGeometry.pointOnSegmentXY(a, b, c1, tol) || !PlanGeometry.pointOnSegmentXY(a, b, c2, tol)) {
                    continue;
                }

                lineage.attach(motherId, candidateId);
                attachedCount++;
                log.debug("Line {} lies on line {}, attached as child", candidateId, motherId);
            }
        }
    }

    public int getAttachedCount() {
        return attachedCount;
    }
}
