package com.portLogistics.aiAssistant.llm.prompt;

import com.portLogistics.aiAssistant.classification.model.Intent;
import com.portLogistics.aiAssistant.history.model.ConversationTurn;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Prompt for LLM intent classification.
 *
 * The prompt lists the closed intent vocabulary and asks for a bare JSON object
 * {@code {"intent": ..., "entities": {...}, "confidence": ...}}.
 */
public class IntentClassificationPrompt {

    static final int HISTORY_TURNS_IN_PROMPT = 4;
    static final int MAX_TURN_LENGTH = 200;
    static final int MAX_MESSAGE_LENGTH = 4000;

    private static final Map<Intent, String> DESCRIPTIONS = new EnumMap<>(Intent.class);

    static {
        DESCRIPTIONS.put(Intent.HELP, "User needs help, asks what the assistant can do, or greets");
        DESCRIPTIONS.put(Intent.BOOKING_STATUS, "Check the status of an existing booking (often has a reference like REF123 or BK-456)");
        DESCRIPTIONS.put(Intent.BOOKING_CREATE, "Create a new booking / reservation / appointment");
        DESCRIPTIONS.put(Intent.SLOT_AVAILABILITY, "Check available time slots at a terminal or gate");
        DESCRIPTIONS.put(Intent.PASSAGE_HISTORY, "View truck passage / entry history");
        DESCRIPTIONS.put(Intent.BLOCKCHAIN_AUDIT, "Verify blockchain proofs or the audit trail of a booking");
        DESCRIPTIONS.put(Intent.CARRIER_SCORE, "Get carrier performance or reliability scores");
        DESCRIPTIONS.put(Intent.OPERATOR_ANALYTICS, "Operator analytics, capacity forecasts, throughput KPIs");
        DESCRIPTIONS.put(Intent.SMALLTALK, "Thanks, goodbye, small talk with no request");
        DESCRIPTIONS.put(Intent.UNKNOWN, "None of the above, or not enough information");
    }

    private IntentClassificationPrompt() {}

    /**
     * Builds the classification prompt.
     *
     * @param message Current user message
     * @param history Normalized history, most recent last
     * @return Prompt text
     */
    public static String build(String message, List<ConversationTurn> history) {
        StringBuilder intents = new StringBuilder();
        for (Intent intent : Intent.values()) {
            intents.append("- ").append(intent.getWireName()).append(": ").append(DESCRIPTIONS.get(intent)).append('\n');
        }

        return """
            You are an intent classifier for a port logistics platform (truck bookings, terminals, gates, time slots).
            Messages may be in French, English or transliterated Arabic, and may come from voice transcription.
            Classify the user's intent from the latest message, using the recent conversation only to resolve follow-ups.

            Recent conversation:
            %s
            Latest user message: "%s"

            Available intents:
            %s
            Entities you may extract when present: terminal, gate, slot_id, carrier_id, booking_ref, date.

            Respond with ONLY a JSON object (no markdown, no explanation):
            {"intent": "intent_name", "entities": {}, "confidence": 0.95}
            The intent MUST be one of the names listed above. Confidence is a number between 0 and 1.
            """.formatted(renderHistory(history), sanitize(message, MAX_MESSAGE_LENGTH), intents);
    }

    private static String renderHistory(List<ConversationTurn> history) {
        if (history == null || history.isEmpty()) {
            return "(none)\n";
        }
        StringBuilder rendered = new StringBuilder();
        int from = Math.max(0, history.size() - HISTORY_TURNS_IN_PROMPT);
        for (ConversationTurn turn : history.subList(from, history.size())) {
            rendered.append(turn.getRole()).append(": ").append(sanitize(turn.getContent(), MAX_TURN_LENGTH));
            if (turn.getIntent() != null) {
                rendered.append(" [intent=").append(turn.getIntent()).append(']');
            }
            rendered.append('\n');
        }
        return rendered.toString();
    }

    /**
     * Flattens text to one line, swaps double quotes for single ones and caps its length.
     */
    private static String sanitize(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        String singleLine = text.replace('\n', ' ').replace('"', '\'').trim();
        return singleLine.length() > maxLength ? singleLine.substring(0, maxLength) : singleLine;
    }
}
