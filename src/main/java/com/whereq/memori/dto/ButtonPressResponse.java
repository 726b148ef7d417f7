package com.whereq.memori.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of a button press
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ButtonPressResponse {

    /**
     * False when the press concluded nothing (second press, other anchor, expired)
     */
    private boolean closed;

    private String anchorJobId;

    private String action;
}
