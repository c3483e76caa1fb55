package com.portLogistics.aiAssistant.history.service;

import com.portLogistics.aiAssistant.config.ClassificationSettings;
import com.portLogistics.aiAssistant.history.model.ConversationTurn;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Cleans history received from the provider before it reaches classification or agents.
 *
 * Roles are lower-cased, turns that are neither user nor assistant or that have no content are
 * dropped, and only the most recent turns (oldest first) are kept.
 */
@Component
@RequiredArgsConstructor
public class HistoryNormalizer {

    private final ClassificationSettings settings;

    public List<ConversationTurn> normalize(List<ConversationTurn> history) {
        if (history == null || history.isEmpty()) {
            return List.of();
        }

        List<ConversationTurn> kept = new ArrayList<>();
        for (ConversationTurn turn : history) {
            if (turn == null || turn.getRole() == null || turn.getContent() == null || turn.getContent().isBlank()) {
                continue;
            }
            String role = turn.getRole().trim().toLowerCase(Locale.ROOT);
            if (!ConversationTurn.ROLE_USER.equals(role) && !ConversationTurn.ROLE_ASSISTANT.equals(role)) {
                continue;
            }
            kept.add(ConversationTurn.builder()
                    .role(role)
                    .content(turn.getContent())
                    .intent(turn.getIntent())
                    .metadata(turn.getMetadata())
                    .build());
        }

        int limit = settings.historyLimit();
        if (kept.size() > limit) {
            kept = kept.subList(kept.size() - limit, kept.size());
        }
        return List.copyOf(kept);
    }
}
