package com.structural.connector.connect.model;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Governing section per mother line, reduced from its children's solver
 * results.
 */
@Value
@Builder
public class GoverningSelection {

    @NonNull
    @Singular("governing")
    Map<Integer, CrossSection> governingByMother;

    /**
     * Mothers none of whose children had a solver result.
     */
    @NonNull
    @Singular
    List<Integer> unmatchedMothers;
}
