package tech.yump.ledger.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.validation.BindValidationException;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import tech.yump.ledger.auth.LedgerAuthority;
import tech.yump.ledger.retention.DataClassification;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigurationValidationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(TestConfig.class));

    @EnableConfigurationProperties(LedgerProperties.class)
    static class TestConfig {}

    private ApplicationContextRunner runnerWithBaseProps() {
        return contextRunner.withPropertyValues("ledger.base-dir=./test-validation-data");
    }

    @Test
    @DisplayName("Config Validation: Should PASS with only a base directory and apply the defaults")
    void defaults_shouldPass() {
        runnerWithBaseProps().run(context -> {
            assertThat(context).hasNotFailed();
            LedgerProperties props = context.getBean(LedgerProperties.class);
            assertThat(props.enabled()).isTrue();
            assertThat(props.retentionYears()).isEqualTo(LedgerProperties.DEFAULT_RETENTION_YEARS);
            assertThat(props.redaction().maxValueLength()).isEqualTo(1000);
            assertThat(props.audit().backend()).isEqualTo("ledger");
            assertThat(props.compliance().prefix()).isEqualTo("events");
            assertThat(props.retention().scheduler().enabled()).isFalse();
            assertThat(props.retention().scheduler().cron()).isEqualTo("0 0 3 * * *");
            assertThat(props.auth().staticTokens().enabled()).isFalse();

            Path base = Path.of("./test-validation-data").toAbsolutePath().normalize();
            assertThat(props.complianceDirectory()).isEqualTo(base.resolve("compliance"));
            assertThat(props.auditDirectory()).isEqualTo(base.resolve("audit"));
            assertThat(props.retentionConfigDirectory()).isEqualTo(base.resolve("config"));
            assertThat(props.archiveDirectory()).isEqualTo(base.resolve("archive"));
        });
    }

    @Test
    @DisplayName("Config Validation: Should FAIL when the base directory is blank")
    void blankBaseDir_shouldFail() {
        contextRunner
                .withPropertyValues("ledger.base-dir=")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .hasRootCauseInstanceOf(BindValidationException.class)
                            .rootCause()
                            .hasMessageContaining("Ledger base directory (ledger.base-dir) must be provided.");
                });
    }

    @Test
    @DisplayName("Config Validation: Should FAIL when retention years is below 1")
    void retentionYearsZero_shouldFail() {
        runnerWithBaseProps()
                .withPropertyValues("ledger.retention-years=0")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .hasRootCauseInstanceOf(BindValidationException.class)
                            .rootCause()
                            .hasMessageContaining("Retention years (ledger.retention-years) must be at least 1.");
                });
    }

    @Test
    @DisplayName("Config Validation: Should FAIL for an unknown audit backend")
    void unknownAuditBackend_shouldFail() {
        runnerWithBaseProps()
                .withPropertyValues("ledger.audit.backend=kafka")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .hasRootCauseInstanceOf(BindValidationException.class)
                            .rootCause()
                            .hasMessageContaining("must be 'ledger' or 'slf4j'");
                });
    }

    @Test
    @DisplayName("Config Validation: Should FAIL when static auth enabled but mappings are missing")
    void staticTokens_enabledWithoutMappings_shouldFail() {
        runnerWithBaseProps()
                .withPropertyValues("ledger.auth.static-tokens.enabled=true")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .hasRootCauseInstanceOf(BindValidationException.class)
                            .rootCause()
                            .hasMessageContaining("Static token mappings (ledger.auth.static-tokens.mappings) cannot be empty when static token auth is enabled.");
                });
    }

    @Test
    @DisplayName("Config Validation: Should FAIL when a mapping grants no authority")
    void staticTokens_mappingWithoutAuthorities_shouldFail() {
        runnerWithBaseProps()
                .withPropertyValues(
                        "ledger.auth.static-tokens.enabled=true",
                        "ledger.auth.static-tokens.mappings[0].name=reader",
                        "ledger.auth.static-tokens.mappings[0].token=reader-token")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure()).hasRootCauseInstanceOf(BindValidationException.class);
                });
    }

    @Test
    @DisplayName("Config Validation: Should PASS with static tokens and retention locations configured")
    void fullConfiguration_shouldPass() {
        runnerWithBaseProps()
                .withPropertyValues(
                        "ledger.auth.static-tokens.enabled=true",
                        "ledger.auth.static-tokens.mappings[0].name=writer",
                        "ledger.auth.static-tokens.mappings[0].token=writer-token",
                        "ledger.auth.static-tokens.mappings[0].authorities[0]=LEDGER_WRITE",
                        "ledger.auth.static-tokens.mappings[0].authorities[1]=LEDGER_READ",
                        "ledger.retention.locations[audit_logs].path=/var/data/audit",
                        "ledger.retention.locations[audit_logs].classification=CONFIDENTIAL",
                        "ledger.retention.scheduler.enabled=true",
                        "ledger.retention.scheduler.cron=0 30 2 * * *")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    LedgerProperties props = context.getBean(LedgerProperties.class);
                    assertThat(props.auth().staticTokens().mappings()).singleElement()
                            .satisfies(m -> assertThat(m.authorities())
                                    .containsExactly(LedgerAuthority.LEDGER_WRITE, LedgerAuthority.LEDGER_READ));
                    assertThat(props.retention().locations()).containsKey("audit_logs");
                    assertThat(props.retention().locations().get("audit_logs").classification())
                            .isEqualTo(DataClassification.CONFIDENTIAL);
                    assertThat(props.retention().scheduler().cron()).isEqualTo("0 30 2 * * *");
                });
    }
}
