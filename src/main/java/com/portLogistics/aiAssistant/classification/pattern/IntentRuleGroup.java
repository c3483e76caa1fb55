package com.portLogistics.aiAssistant.classification.pattern;

import com.portLogistics.aiAssistant.classification.model.Intent;
import lombok.Value;

import java.util.List;

/**
 * All rules of one intent, in declaration order.
 */
@Value
public class IntentRuleGroup {

    Intent intent;
    List<IntentRule> rules;

    public static IntentRuleGroup of(Intent intent, IntentRule... rules) {
        return new IntentRuleGroup(intent, List.of(rules));
    }
}
