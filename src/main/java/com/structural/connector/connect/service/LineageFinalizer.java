package com.structural.connector.connect.service;

import java.util.Map;

import com.structural.connector.connect.model.Line;

/**
 * Guarantees every input line id is a mother key; a surviving line without
 * children that no other mother has claimed maps to itself.
 */
public class LineageFinalizer {

    public void finalizeMappings(Map<Integer, Line> originalLines,
                                 Map<Integer, Line> lines,
                                 LineageBuilder lineage) {
        for (int lineId : originalLines.keySet()) {
            lineage.registerMother(lineId);
            if (lineage.hasNoChildren(lineId) && lines.containsKey(lineId) && !lineage.isClaimedByOther(lineId)) {
                lineage.selfMap(lineId);
            }
        }
    }
}
