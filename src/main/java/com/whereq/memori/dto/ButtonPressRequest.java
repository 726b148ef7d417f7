package com.whereq.memori.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A press on one of the options of a choice message
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ButtonPressRequest {

    /**
     * Job whose notification carried the button. Taken from the option id when absent.
     */
    private String anchorJobId;

    /**
     * Option id as sent with the choice, {@code action:anchorJobId}
     */
    @NotBlank(message = "optionId is required")
    private String optionId;
}
