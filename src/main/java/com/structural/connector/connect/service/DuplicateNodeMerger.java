package com.structural.connector.connect.service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.structural.connector.connect.model.Line;
import com.structural.connector.connect.model.Node;
import com.structural.connector.connect.model.StructuralModel;

/**
 * Merges nodes that share exactly the same coordinates. The smallest id is
 * kept and lines are rewired onto it.
 *
 * Runs before the connection pass, which itself never merges input nodes.
 */
public class DuplicateNodeMerger {

    private static final Logger log = LoggerFactory.getLogger(DuplicateNodeMerger.class);

    /**
     * @return number of nodes removed
     */
    public int merge(StructuralModel model) {
        Map<List<Double>, List<Integer>> idsByCoordinate = new LinkedHashMap<>();
        for (Node node : model.getNodes().values()) {
            idsByCoordinate.computeIfAbsent(coordinateKey(node), k -> new ArrayList<>()).add(node.getId());
        }

        Map<Integer, Integer> replacements = new HashMap<>();
        for (List<Integer> ids : idsByCoordinate.values()) {
            if (ids.size() <= 1) {
                continue;
            }
            int kept = ids.stream().mapToInt(Integer::intValue).min().getAsInt();
            for (int id : ids) {
                if (id != kept) {
                    replacements.put(id, kept);
                }
            }
        }
        if (replacements.isEmpty()) {
            return 0;
        }

        for (Line line : List.copyOf(model.getLines().values())) {
            int ni = replacements.getOrDefault(line.getNi(), line.getNi());
            int nj = replacements.getOrDefault(line.getNj(), line.getNj());
            if (ni != line.getNi() || nj != line.getNj()) {
                model.addLine(new Line(line.getId(), ni, nj));
            }
        }
        replacements.keySet().forEach(model::removeNode);

        log.info("Merged {} duplicate nodes", replacements.size());
        return replacements.size();
    }

    /**
     * Adding 0.0 turns -0.0 into 0.0, so both zeros share a key.
     */
    private static List<Double> coordinateKey(Node node) {
        return List.of(node.getX() + 0.0, node.getY() + 0.0, node.getZ() + 0.0);
    }
}
