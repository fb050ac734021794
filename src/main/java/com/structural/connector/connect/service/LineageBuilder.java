package com.structural.connector.connect.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable mother/child index filled by the splitter, the augmenter and the
 * finalizer. Mothers iterate in the order they were first registered.
 */
public class LineageBuilder {

    private final Map<Integer, List<Integer>> motherToChildren = new LinkedHashMap<>();
    private final Map<Integer, Integer> childToMother = new LinkedHashMap<>();

    public void registerMother(int motherId) {
        motherToChildren.computeIfAbsent(motherId, id -> new ArrayList<>());
    }

    public void addChild(int motherId, int childId) {
        motherToChildren.computeIfAbsent(motherId, id -> new ArrayList<>()).add(childId);
        childToMother.put(childId, motherId);
    }

    /**
     * Moves a surviving line, together with any lines it had already claimed,
     * under another mother. Its own entry stays as an empty key so the line id
     * is still covered, and lineage never nests deeper than one level.
     */
    public void attach(int motherId, int lineId) {
        List<Integer> own = motherToChildren.get(lineId);
        addChild(motherId, lineId);
        if (own == null) {
            return;
        }
        for (int claimed : own) {
            if (claimed != lineId) {
                addChild(motherId, claimed);
            }
        }
        own.clear();
    }

    public void selfMap(int lineId) {
        motherToChildren.put(lineId, new ArrayList<>(List.of(lineId)));
        childToMother.put(lineId, lineId);
    }

    public boolean hasNoChildren(int motherId) {
        List<Integer> children = motherToChildren.get(motherId);
        return children == null || children.isEmpty();
    }

    /**
     * True when the line has been attached to a mother other than itself.
     */
    public boolean isClaimedByOther(int lineId) {
        Integer mother = childToMother.get(lineId);
        return mother != null && mother != lineId;
    }

    public List<Integer> motherIds() {
        return List.copyOf(motherToChildren.keySet());
    }

    public Map<Integer, List<Integer>> getMotherToChildren() {
        return motherToChildren;
    }

    public Map<Integer, Integer> getChildToMother() {
        return childToMother;
    }
}
