package com.bastion.validation.translation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.bastion.audit.ErrorKind;
import com.bastion.audit.UserFacingCategory;
import com.bastion.audit.ValidatorName;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

@DisplayName("ErrorTranslationService")
class ErrorTranslationServiceTest {

    @Nested
    @DisplayName("default table")
    class Defaults {

        private final ErrorTranslationService service = ErrorTranslationService.withDefaults();

        @ParameterizedTest
        @EnumSource(ErrorKind.class)
        @DisplayName("translates every kind into its matching user-facing category")
        void total(ErrorKind kind) {
            UserFacingError error = service.translate(kind, ValidatorName.LEGACY);

            assertThat(error.category()).isEqualTo(UserFacingCategory.forCategory(kind.category()));
            assertThat(error.message()).isNotBlank();
            assertThat(error.errorCode()).isNotBlank();
        }

        @Test
        @DisplayName("presents cross-tenant denial as a missing resource")
        void crossTenantLooksLikeNotFound() {
            UserFacingError error = service.translate(ErrorKind.CROSS_TENANT_DENIED, ValidatorName.ENHANCED);

            assertThat(error.message()).isEqualTo("Resource not found");
            assertThat(error.errorCode()).isEqualTo("ACCESS_DENIED_001");
            assertThat(error.message() + error.helpfulAction()).doesNotContainIgnoringCase("tenant");
        }

        @Test
        @DisplayName("does not leak internal detail for faults")
        void faultsAreGeneric() {
            Set<String> messages = Stream.of(ErrorKind.INTERNAL_FAULT, ErrorKind.VALIDATOR_TIMEOUT,
                            ErrorKind.STORE_UNAVAILABLE)
                    .map(kind -> service.translate(kind, ValidatorName.LEGACY).message())
                    .collect(Collectors.toSet());

            assertThat(messages).containsExactly("Service temporarily unavailable");
        }

        @Test
        @DisplayName("error codes are unique")
        void uniqueCodes() {
            Set<String> codes = Stream.of(ErrorKind.values())
                    .map(kind -> service.translate(kind, ValidatorName.LEGACY).errorCode())
                    .collect(Collectors.toSet());

            assertThat(codes).hasSize(ErrorKind.values().length);
        }
    }

    @Nested
    @DisplayName("table verification")
    class Verification {

        @Test
        @DisplayName("rejects a table with a missing kind")
        void missingKind() {
            Map<ErrorKind, UserFacingError> table = ErrorTranslationService.defaultTranslations();
            table.remove(ErrorKind.VALIDATOR_TIMEOUT);

            assertThatThrownBy(() -> new ErrorTranslationService(table))
                    .isInstanceOf(TranslationConfigurationException.class)
                    .hasMessageContaining("VALIDATOR_TIMEOUT has no translation");
        }

        @Test
        @DisplayName("rejects a kind mapped to the wrong category")
        void wrongCategory() {
            Map<ErrorKind, UserFacingError> table = ErrorTranslationService.defaultTranslations();
            table.put(ErrorKind.EXPIRED, new UserFacingError(UserFacingCategory.TEMPORARILY_UNAVAILABLE,
                    "Try later", "", "X_001"));

            assertThatThrownBy(() -> new ErrorTranslationService(table))
                    .isInstanceOf(TranslationConfigurationException.class)
                    .hasMessageContaining("EXPIRED must translate to INVALID_CREDENTIALS");
        }

        @Test
        @DisplayName("rejects a null table")
        void nullTable() {
            assertThatThrownBy(() -> new ErrorTranslationService(null))
                    .isInstanceOf(TranslationConfigurationException.class);
        }
    }

    @Test
    @DisplayName("overrides replace only the fields they set")
    void overrides() {
        var service = ErrorTranslationService.withOverrides(Map.of(
                ErrorKind.EXPIRED, new TranslationOverride("Your session ended", null, null)));

        UserFacingError error = service.translate(ErrorKind.EXPIRED, ValidatorName.ENHANCED);

        assertThat(error.message()).isEqualTo("Your session ended");
        assertThat(error.errorCode()).isEqualTo("AUTH_EXPIRED_001");
        assertThat(error.helpfulAction()).isEqualTo("Refresh your session to continue");
        assertThat(error.category()).isEqualTo(UserFacingCategory.INVALID_CREDENTIALS);
    }

    @Test
    @DisplayName("coverage counts translations served per kind")
    void coverage() {
        var service = ErrorTranslationService.withDefaults();
        service.translate(ErrorKind.EXPIRED, ValidatorName.LEGACY);
        service.translate(ErrorKind.EXPIRED, ValidatorName.ENHANCED);
        service.translate(ErrorKind.STORE_UNAVAILABLE, ValidatorName.LEGACY);

        TranslationCoverage coverage = service.coverage();

        assertThat(coverage.mappedPercent()).isEqualTo(100.0);
        assertThat(coverage.exercisedKinds()).isEqualTo(2);
        assertThat(coverage.exerciseCounts()).containsEntry(ErrorKind.EXPIRED, 2L)
                .containsEntry(ErrorKind.MALFORMED, 0L);
    }
}
