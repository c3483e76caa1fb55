package com.portLogistics.aiAssistant.classification.pattern;

import com.portLogistics.aiAssistant.classification.model.Intent;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Priority-ordered rule table for the pattern classifier.
 *
 * Group order is significant: when two groups reach the same confidence the group declared first
 * wins. Blockchain audit is declared before booking status so that "verify proof for REF123" stays
 * an audit request, and booking creation is declared before availability so that
 * "book an available slot" creates a booking.
 *
 * Keyword sets mix English and French, plus a few common Darija greetings.
 * The table is built once and never mutated.
 */
@Component
public class IntentRuleTable {

    private static final List<IntentRuleGroup> GROUPS = List.of(
            IntentRuleGroup.of(Intent.BLOCKCHAIN_AUDIT,
                    IntentRule.of("\\bblockchain\\b", "audit.blockchain_keyword", 0.98),
                    IntentRule.of("\\baudit(\\s+trail)?\\b", "audit.audit_keyword", 0.95),
                    IntentRule.of("\\b(prove|proof|preuve|prouver)\\b", "audit.proof_keyword", 0.90),
                    IntentRule.of("\\b(verify|vérifier|verifier)\\b", "audit.verify_keyword", 0.85),
                    IntentRule.of("\\b(ledger|tamper|immutable|hash)\\b", "audit.ledger_keyword", 0.80)),

            IntentRuleGroup.of(Intent.BOOKING_CREATE,
                    IntentRule.of("\\bcreate\\s+(a\\s+|an\\s+|new\\s+)?(booking|reservation|appointment)", "create.create_booking", 0.95),
                    IntentRule.of("\\bbook\\b", "create.book_verb", 0.90),
                    IntentRule.of("\\b(reserve|réserver|reserver)\\b", "create.reserve_verb", 0.90),
                    IntentRule.of("\\bmake\\s+(a\\s+|an\\s+)?(booking|reservation|appointment)", "create.make_reservation", 0.90),
                    IntentRule.of("\\bnew\\s+(booking|reservation)\\b", "create.new_booking", 0.90),
                    IntentRule.of("\\b(créer|creer)\\s+(un\\s+|une\\s+)?(rendez-vous|rdv|réservation|reservation)", "create.creer_rendez_vous", 0.90),
                    IntentRule.of("\\bprendre\\s+(un\\s+)?(rendez-vous|rdv)", "create.prendre_rendez_vous", 0.90),
                    IntentRule.of("\\bschedule\\b", "create.schedule_verb", 0.85)),

            IntentRuleGroup.of(Intent.BOOKING_STATUS,
                    IntentRule.of("\\b(ref|bk)[-\\s]?\\d+", "status.booking_reference", 0.90),
                    IntentRule.of("\\bwhere\\s+is\\s+my\\s+(booking|reservation)", "status.where_is_my_booking", 0.90),
                    IntentRule.of("\\bo[uù]\\s+en\\s+est\\s+ma\\s+(réservation|reservation)", "status.ou_en_est", 0.90),
                    IntentRule.of("\\b(status|statut|état)\\b", "status.status_keyword", 0.85),
                    IntentRule.of("\\b(track|suivre|suivi)\\b", "status.track_keyword", 0.85),
                    IntentRule.of("\\bcheck\\s+(my\\s+)?(booking|reservation)", "status.check_booking", 0.85),
                    IntentRule.of("\\b(my|ma|mes)\\s+(bookings?|reservations?|réservations?)\\b", "status.my_booking", 0.80)),

            IntentRuleGroup.of(Intent.SLOT_AVAILABILITY,
                    IntentRule.of("\\bavailab(le|ility|ilities)\\b", "availability.available_keyword", 0.85),
                    IntentRule.of("\\bdisponib\\w*", "availability.disponible_keyword", 0.85),
                    IntentRule.of("\\bopen\\s+(slots?|appointments?|times?)\\b", "availability.open_slots", 0.85),
                    IntentRule.of("\\bfree\\s+(time|slots?|spots?)\\b", "availability.free_time", 0.80),
                    IntentRule.of("\\b(capacity|capacité|capacite)\\b", "availability.capacity_keyword", 0.70),
                    IntentRule.of("\\b(slots?|créneaux|creneaux|créneau|creneau)\\b", "availability.slot_keyword", 0.60)),

            IntentRuleGroup.of(Intent.PASSAGE_HISTORY,
                    IntentRule.of("\\bpassages?\\b", "passage.passage_keyword", 0.90),
                    IntentRule.of("\\b(truck|vehicle|camion|véhicule|vehicule)s?\\s+(history|historique|entries)\\b", "passage.vehicle_history", 0.90),
                    IntentRule.of("\\b(entries|entrées|entrees)\\b", "passage.entries_keyword", 0.85),
                    IntentRule.of("\\b(history|historique)\\b", "passage.history_keyword", 0.75)),

            IntentRuleGroup.of(Intent.CARRIER_SCORE,
                    IntentRule.of("\\bcarrier\\s+(score|scoring|performance|rating|reliability)\\b", "carrier.carrier_score", 0.90),
                    IntentRule.of("\\b(note|score)\\s+(du\\s+)?transporteur\\b", "carrier.note_transporteur", 0.90),
                    IntentRule.of("\\b(score|scoring|reliability|fiabilité|fiabilite)\\b", "carrier.score_keyword", 0.70)),

            IntentRuleGroup.of(Intent.OPERATOR_ANALYTICS,
                    IntentRule.of("\\boperator\\s+(performance|dashboard|report|analytics)\\b", "analytics.operator_report", 0.90),
                    IntentRule.of("\\b(analytics|analytique|analyse)\\b", "analytics.analytics_keyword", 0.85),
                    IntentRule.of("\\b(forecast|prévision|prevision|throughput|kpi|utilization|utilisation)\\b", "analytics.forecast_keyword", 0.80)),

            IntentRuleGroup.of(Intent.HELP,
                    IntentRule.of("\\b(help|aide|aidez)\\b", "help.help_keyword", 0.95),
                    IntentRule.of("\\bwhat\\s+can\\s+you\\s+do\\b", "help.capabilities", 0.95),
                    IntentRule.of("\\bque\\s+(peux|pouvez)[-\\s]+(tu|vous)\\s+faire\\b", "help.capacites", 0.95),
                    IntentRule.of("\\bhow\\s+(to|do\\s+i|can\\s+i)\\s+use\\b", "help.how_to_use", 0.90),
                    IntentRule.of("^\\s*(hi|hello|hey|bonjour|bonsoir|salut|salam|marhba)\\b", "help.greeting", 0.90),
                    IntentRule.of("\\b(assist|guide)\\b", "help.assist_keyword", 0.80)),

            IntentRuleGroup.of(Intent.SMALLTALK,
                    IntentRule.of("^\\s*(thanks|thank\\s+you|merci|saha|shukran|ok|okay|cool|great|parfait|bye|goodbye|au\\s+revoir)\\b", "smalltalk.courtesy", 0.85),
                    IntentRule.of("\\b(how\\s+are\\s+you|ça\\s+va|ca\\s+va|labas)\\b", "smalltalk.how_are_you", 0.85))
    );

    /**
     * @return Rule groups in priority order (first-declared wins ties)
     */
    public List<IntentRuleGroup> getGroups() {
        return GROUPS;
    }
}
