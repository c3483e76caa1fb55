package com.portLogistics.aiAssistant.classification.followup;

import com.portLogistics.aiAssistant.classification.model.Intent;
import com.portLogistics.aiAssistant.config.ClassificationSettings;
import com.portLogistics.aiAssistant.history.model.ConversationTurn;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Keeps short clarifying replies ("and terminal A?", "aussi demain") on the agent of the previous turn.
 *
 * A message is a follow-up candidate when it has at most four tokens or contains a follow-up marker.
 * The resolver then walks the recent history from newest to oldest and reuses the first intent that
 * carries information (anything except unknown, help and smalltalk).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FollowUpResolver {

    static final int SHORT_MESSAGE_MAX_TOKENS = 4;

    private static final Set<String> FOLLOW_UP_MARKERS = Set.of(
            "and", "also", "then", "what about", "how about", "same",
            "et", "aussi", "puis", "ensuite", "et pour", "pareil", "w", "zeda");

    private static final Pattern TOKEN_SPLIT = Pattern.compile("[\\s,;:!?.]+");

    private final ClassificationSettings settings;

    /**
     * @param message Current message
     * @return true when the message is short or contains a follow-up marker
     */
    public boolean isFollowUpCandidate(String message) {
        if (message == null || message.isBlank()) {
            return false;
        }
        List<String> tokens = tokenize(message);
        if (tokens.size() <= SHORT_MESSAGE_MAX_TOKENS) {
            return true;
        }
        String joined = " " + String.join(" ", tokens) + " ";
        return FOLLOW_UP_MARKERS.stream().anyMatch(marker -> joined.contains(" " + marker + " "));
    }

    /**
     * Resolves the intent a follow-up message continues.
     *
     * @param message Current message
     * @param history Normalized history, most recent last
     * @return Intent to reuse, or empty when the message is not a follow-up or no turn qualifies
     */
    public Optional<Intent> resolve(String message, List<ConversationTurn> history) {
        if (history == null || history.isEmpty() || !isFollowUpCandidate(message)) {
            return Optional.empty();
        }

        int oldest = Math.max(0, history.size() - settings.followUpWindow());
        for (int i = history.size() - 1; i >= oldest; i--) {
            Optional<Intent> intent = Intent.fromWireName(history.get(i).getIntent());
            if (intent.isPresent() && !intent.get().isLowInformation()) {
                log.debug("Follow-up resolved to previous intent: {}", intent.get());
                return intent;
            }
        }
        return Optional.empty();
    }

    private static List<String> tokenize(String message) {
        return Arrays.stream(TOKEN_SPLIT.split(message.trim().toLowerCase(Locale.ROOT)))
                .filter(token -> !token.isBlank())
                .toList();
    }
}
