package com.portLogistics.aiAssistant.classification.pattern;

import lombok.Value;

import java.util.regex.Pattern;

/**
 * A single pattern rule: when {@code pattern} is found in the message the owning intent group
 * scores {@code confidence}, and {@code name} is reported in the reasoning trace.
 */
@Value
public class IntentRule {

    static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    Pattern pattern;
    String name;
    double confidence;

    public static IntentRule of(String regex, String name, double confidence) {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Rule confidence must be in [0,1]: " + name);
        }
        return new IntentRule(Pattern.compile(regex, FLAGS), name, confidence);
    }

    public boolean matches(String text) {
        return pattern.matcher(text).find();
    }
}
