package com.portLogistics.aiAssistant.access.service;

import com.portLogistics.aiAssistant.access.model.AccessDecision;
import com.portLogistics.aiAssistant.classification.model.Intent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class AccessPolicyTest {

    private final AccessPolicy policy = new AccessPolicy();

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"ADMIN", "OPERATOR", "CARRIER", "GUEST", "root"})
    void helpAndUnknownAreAlwaysAuthorized(String role) {
        assertThat(policy.authorize(Intent.HELP, role)).isTrue();
        assertThat(policy.authorize(Intent.UNKNOWN, role)).isTrue();
    }

    @ParameterizedTest
    @EnumSource(Intent.class)
    void adminMayUseEveryIntent(Intent intent) {
        assertThat(policy.authorize(intent, "ADMIN")).isTrue();
    }

    @Test
    void carrierCannotAuditOrSeeAnalytics() {
        assertThat(policy.authorize(Intent.BLOCKCHAIN_AUDIT, "CARRIER")).isFalse();
        assertThat(policy.authorize(Intent.OPERATOR_ANALYTICS, "CARRIER")).isFalse();
        assertThat(policy.authorize(Intent.CARRIER_SCORE, "CARRIER")).isFalse();
        assertThat(policy.authorize(Intent.BOOKING_CREATE, "CARRIER")).isTrue();
        assertThat(policy.authorize(Intent.BOOKING_STATUS, "CARRIER")).isTrue();
    }

    @Test
    void operatorCannotCreateBookings() {
        assertThat(policy.authorize(Intent.BOOKING_CREATE, "OPERATOR")).isFalse();
        assertThat(policy.authorize(Intent.BLOCKCHAIN_AUDIT, "OPERATOR")).isTrue();
        assertThat(policy.authorize(Intent.OPERATOR_ANALYTICS, "OPERATOR")).isTrue();
    }

    @Test
    void roleIsNormalizedBeforeLookup() {
        assertThat(policy.authorize(Intent.BOOKING_CREATE, " carrier ")).isTrue();
        assertThat(policy.authorize(Intent.BLOCKCHAIN_AUDIT, "Operator")).isTrue();
    }

    @Test
    void unrecognizedRoleIsDeniedEverythingButBypassIntents() {
        for (Intent intent : Intent.values()) {
            assertThat(policy.authorize(intent, "VISITOR")).isEqualTo(intent.isBypass());
        }
    }

    @Test
    void decisionCarriesNormalizedRole() {
        AccessDecision denied = policy.decide(Intent.BLOCKCHAIN_AUDIT, "carrier");
        AccessDecision anonymous = policy.decide(Intent.BOOKING_STATUS, null);

        assertThat(denied.isAllowed()).isFalse();
        assertThat(denied.getRole()).isEqualTo("CARRIER");
        assertThat(denied.getIntent()).isEqualTo(Intent.BLOCKCHAIN_AUDIT);
        assertThat(anonymous.isAllowed()).isFalse();
        assertThat(anonymous.getRole()).isEqualTo("UNKNOWN");
    }

    @Test
    void allowedIntentsIncludeBypassIntents() {
        assertThat(policy.allowedIntents("CARRIER")).containsExactlyInAnyOrder(
                Intent.HELP, Intent.UNKNOWN, Intent.BOOKING_STATUS, Intent.BOOKING_CREATE,
                Intent.SLOT_AVAILABILITY, Intent.PASSAGE_HISTORY, Intent.SMALLTALK);
        assertThat(policy.allowedIntents(null)).containsExactlyInAnyOrder(Intent.HELP, Intent.UNKNOWN);
    }

    @Test
    void sameQueryAlwaysGivesSameAnswer() {
        for (Intent intent : Intent.values()) {
            assertThat(policy.authorize(intent, "OPERATOR")).isEqualTo(policy.authorize(intent, "OPERATOR"));
        }
    }
}
