package com.portLogistics.aiAssistant.access.model;

import com.portLogistics.aiAssistant.classification.model.Intent;
import lombok.Value;

/**
 * Outcome of an authorization check. Computed per request, never stored.
 */
@Value
public class AccessDecision {

    boolean allowed;

    /**
     * Role as normalized for lookup (upper-cased), or "UNKNOWN" when none was given.
     */
    String role;

    Intent intent;
}
