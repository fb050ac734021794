package com.structural.connector.connect.service;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.structural.connector.connect.model.CrossSection;
import com.structural.connector.connect.model.GoverningSelection;
import com.structural.connector.connect.model.SectionResults;

/**
 * Reduces per-child solver sections to one governing section per mother.
 *
 * Sections are ranked by the size number in their catalogue name: the part
 * after the last {@code x} ("UB 254x146x43" ranks 43), otherwise the largest
 * number in the name ("IPE400" ranks 400), otherwise -1. Ties keep the first
 * child in lineage order.
 */
public class GoverningSectionReducer {

    private static final Logger log = LoggerFactory.getLogger(GoverningSectionReducer.class);

    private static final Pattern NUMBER_PATTERN = Pattern.compile("\\d+(?:\\.\\d+)?");

    public GoverningSelection reduce(Map<Integer, List<Integer>> motherToChildren, SectionResults results) {
        GoverningSelection.GoverningSelectionBuilder selection = GoverningSelection.builder();

        for (Map.Entry<Integer, List<Integer>> entry : motherToChildren.entrySet()) {
            CrossSection best = null;
            double bestRank = 0;
            boolean matched = false;

            for (int childId : entry.getValue()) {
                if (results.hasResultFor(childId)) {
                    matched = true;
                }
                CrossSection section = results.sectionFor(childId);
                if (section == null) {
                    continue;
                }
                double rank = sizeNumber(section.getName());
                if (best == null || rank > bestRank) {
                    best = section;
                    bestRank = rank;
                }
            }

            if (!matched) {
                selection.unmatchedMother(entry.getKey());
            }
            if (best != null) {
                selection.governing(entry.getKey(), best);
                log.debug("Mother {} governed by section '{}'", entry.getKey(), best.getName());
            }
        }
        return selection.build();
    }

    static double sizeNumber(String sectionName) {
        if (sectionName == null) {
            return -1.0;
        }
        String[] parts = sectionName.split("x", -1);
        if (parts.length > 1) {
            try {
                return Double.parseDouble(parts[parts.length - 1].trim());
            } catch (NumberFormatException e) {
                log.trace("Section name '{}' has no numeric suffix", sectionName);
            }
        }

        double max = -1.0;
        Matcher matcher = NUMBER_PATTERN.matcher(sectionName);
        while (matcher.find()) {
            max = Math.max(max, Double.parseDouble(matcher.group()));
        }
        return max;
    }
}
