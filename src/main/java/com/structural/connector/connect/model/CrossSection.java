package com.structural.connector.connect.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Section catalogue entry referenced by {@link Member#getCrossSectionId()}.
 */
@Value
@Builder(toBuilder = true)
public class CrossSection {

    int id;

    @NonNull
    @Builder.Default
    String name = "Section";

    /** Area. */
    @Builder.Default
    double area = 0.01;

    /** Inertia around z, strong axis. */
    @Builder.Default
    double iz = 1e-4;

    /** Inertia around y, weak axis. */
    @Builder.Default
    double iy = 1e-5;

    /** Torsional inertia. */
    @Builder.Default
    double jxx = 1e-6;

    /** Section width. */
    @Builder.Default
    double b = 0.3;

    /** Section height. */
    @Builder.Default
    double h = 0.3;
}
