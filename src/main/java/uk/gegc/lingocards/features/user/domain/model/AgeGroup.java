package uk.gegc.lingocards.features.user.domain.model;

import lombok.Getter;

@Getter
public enum AgeGroup {
    EARLY_CHILDHOOD("early_childhood"),
    EARLY_ELEMENTARY("early_elementary"),
    UPPER_ELEMENTARY("upper_elementary"),
    MIDDLE_SCHOOL("middle_school"),
    HIGH_SCHOOL("high_school"),
    ADULT("adult"),
    SENIOR("senior");

    private final String code;

    AgeGroup(String code) {
        this.code = code;
    }
}
