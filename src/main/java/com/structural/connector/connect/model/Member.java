package com.structural.connector.connect.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Section and material attributes of exactly one line.
 */
@Value
public class Member {
    int lineId;
    int crossSectionId;
    @NonNull
    Material material;

    /**
     * Same attributes, attached to another line.
     */
    public Member forLine(int otherLineId) {
        return new Member(otherLineId, crossSectionId, material);
    }
}
