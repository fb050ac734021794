package com.structural.connector.connect.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import lombok.Getter;

/**
 * Output of one connection pass: the repaired graph and its lineage maps.
 *
 * All views are unmodifiable and iterate in id-allocation order.
 */
@Getter
public class ConnectionResult {

    private final Map<Integer, Node> nodes;
    private final Map<Integer, Line> lines;
    private final Map<Integer, Member> members;
    private final Map<Integer, List<Integer>> motherToChildren;
    private final Map<Integer, Integer> childToMother;

    public ConnectionResult(Map<Integer, Node> nodes,
                            Map<Integer, Line> lines,
                            Map<Integer, Member> members,
                            Map<Integer, List<Integer>> motherToChildren,
                            Map<Integer, Integer> childToMother) {
        this.nodes = Collections.unmodifiableMap(nodes);
        this.lines = Collections.unmodifiableMap(lines);
        this.members = Collections.unmodifiableMap(members);
        motherToChildren.replaceAll((mother, children) -> Collections.unmodifiableList(children));
        this.motherToChildren = Collections.unmodifiableMap(motherToChildren);
        this.childToMother = Collections.unmodifiableMap(childToMother);
    }

    public List<Integer> childrenOf(int motherId) {
        return motherToChildren.getOrDefault(motherId, List.of());
    }

    public Integer motherOf(int childId) {
        return childToMother.get(childId);
    }

    public int splitMotherCount() {
        return (int) motherToChildren.entrySet().stream()
                .filter(e -> !lines.containsKey(e.getKey()))
                .count();
    }
}
