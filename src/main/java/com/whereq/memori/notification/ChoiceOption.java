package com.whereq.memori.notification;

import lombok.Value;

/**
 * A button offered to the user. The id comes back with the button press.
 */
@Value
public class ChoiceOption {

    String id;

    String label;

    /**
     * Option ids carry the anchor job so a press can be matched to its conversation
     */
    public static ChoiceOption of(String action, String anchorJobId, String label) {
        return new ChoiceOption(action + ":" + anchorJobId, label);
    }
}
