package uk.gegc.lingocards.features.interest.domain.model;

import lombok.Getter;

import java.util.Arrays;
import java.util.stream.Collectors;

@Getter
public enum InterestAction {
    CLICK("click", 0.1),
    VIEW_50_PERCENT("view_50_percent", 0.3),
    VIEW_100_PERCENT("view_100_percent", 0.5),
    SHARE("share", 0.8),
    EXPLICIT_TAG("explicit_tag", 1.0);

    private final String code;
    private final double weight;

    InterestAction(String code, double weight) {
        this.code = code;
        this.weight = weight;
    }

    /**
     * @throws IllegalArgumentException for codes outside the weight table
     */
    public static InterestAction fromCode(String code) {
        if (code != null) {
            for (InterestAction action : values()) {
                if (action.code.equals(code)) {
                    return action;
                }
            }
        }
        throw new IllegalArgumentException("Invalid action type '" + code + "'. Must be one of: "
                + Arrays.stream(values()).map(InterestAction::getCode).collect(Collectors.joining(", ")));
    }
}
