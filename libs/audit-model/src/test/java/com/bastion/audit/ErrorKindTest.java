package com.bastion.audit;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

@DisplayName("ErrorKind taxonomy")
class ErrorKindTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "NOT_FOUND, AUTHENTICATION_FAILURE",
            "EXPIRED, AUTHENTICATION_FAILURE",
            "MALFORMED, AUTHENTICATION_FAILURE",
            "CROSS_TENANT_DENIED, AUTHORIZATION_FAILURE",
            "ACCESS_LEVEL_INSUFFICIENT, AUTHORIZATION_FAILURE",
            "TENANT_INACTIVE, AUTHORIZATION_FAILURE",
            "INTERNAL_FAULT, INTERNAL_FAULT",
            "VALIDATOR_TIMEOUT, INTERNAL_FAULT",
            "STORE_UNAVAILABLE, INTERNAL_FAULT"
    })
    @DisplayName("each kind belongs to its category")
    void categories(ErrorKind kind, ErrorCategory category) {
        assertThat(kind.category()).isEqualTo(category);
    }

    @ParameterizedTest
    @EnumSource(ErrorKind.class)
    @DisplayName("only internal faults are retriable")
    void retriable(ErrorKind kind) {
        assertThat(kind.category().retriable()).isEqualTo(kind.fault());
    }

    @Test
    @DisplayName("no request-time kind is a configuration defect")
    void noConfigurationDefect() {
        for (ErrorKind kind : ErrorKind.values()) {
            assertThat(kind.category()).isNotEqualTo(ErrorCategory.CONFIGURATION_DEFECT);
        }
    }

    @ParameterizedTest
    @EnumSource(ErrorCategory.class)
    @DisplayName("every category maps to a user-facing category")
    void userFacing(ErrorCategory category) {
        assertThat(UserFacingCategory.forCategory(category)).isNotNull();
    }
}
