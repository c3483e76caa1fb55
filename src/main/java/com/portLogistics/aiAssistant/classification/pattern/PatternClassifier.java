package com.portLogistics.aiAssistant.classification.pattern;

import com.portLogistics.aiAssistant.classification.model.Intent;
import com.portLogistics.aiAssistant.classification.model.IntentResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic, rule-based intent classifier.
 *
 * Scans every group of the {@link IntentRuleTable} in priority order. Within a group the maximum
 * confidence among matching rules is kept, together with the names of all matching rules. Across
 * groups the highest confidence wins; a tie keeps the earlier group. No external calls are made,
 * so the same text always yields the same result.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PatternClassifier {

    static final double NO_MATCH_CONFIDENCE = 0.5;
    static final double EMPTY_MESSAGE_CONFIDENCE = 1.0;

    private final IntentRuleTable ruleTable;

    /**
     * Classifies a message against the rule table.
     *
     * @param text Raw message text (may be null or blank)
     * @return Winning intent with its confidence and the matched rule names
     */
    public IntentResult classify(String text) {
        if (text == null || text.isBlank()) {
            return IntentResult.unknown(EMPTY_MESSAGE_CONFIDENCE, "empty_message");
        }

        GroupMatch best = null;
        for (IntentRuleGroup group : ruleTable.getGroups()) {
            GroupMatch match = scoreGroup(group, text);
            // strict comparison keeps the first-declared group on ties
            if (match != null && (best == null || match.confidence > best.confidence)) {
                best = match;
            }
        }

        if (best == null) {
            log.debug("No pattern matched - length: {}", text.length());
            return IntentResult.unknown(NO_MATCH_CONFIDENCE, "no_pattern_matched");
        }

        log.debug("Pattern classification - intent: {}, confidence: {}, rules: {}",
                best.intent, best.confidence, best.ruleNames);

        return IntentResult.builder()
                .intent(best.intent)
                .confidence(best.confidence)
                .reasoning(best.ruleNames)
                .build();
    }

    /**
     * Returns only the intent the keyword families point at, without its confidence or trace.
     * Used as the keyword fallback when an LLM answer cannot be parsed.
     *
     * @param text Raw text
     * @return Best matching intent, or {@link Intent#UNKNOWN}
     */
    public Intent matchKeywords(String text) {
        return classify(text).getIntent();
    }

    private GroupMatch scoreGroup(IntentRuleGroup group, String text) {
        double max = -1.0;
        List<String> names = new ArrayList<>();
        for (IntentRule rule : group.getRules()) {
            if (rule.matches(text)) {
                names.add(rule.getName());
                max = Math.max(max, rule.getConfidence());
            }
        }
        return names.isEmpty() ? null : new GroupMatch(group.getIntent(), max, names);
    }

    private record GroupMatch(Intent intent, double confidence, List<String> ruleNames) {}
}
