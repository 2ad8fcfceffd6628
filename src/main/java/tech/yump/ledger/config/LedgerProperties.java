package tech.yump.ledger.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import tech.yump.ledger.auth.LedgerAuthority;
import tech.yump.ledger.retention.DataClassification;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties under the 'ledger' prefix. Read once at startup.
 */
@ConfigurationProperties(prefix = "ledger")
@Validated
public record LedgerProperties(

        Boolean enabled,

        @NotBlank(message = "Ledger base directory (ledger.base-dir) must be provided.")
        String baseDir,

        @Min(value = 1, message = "Retention years (ledger.retention-years) must be at least 1.")
        Integer retentionYears,

        @Valid
        RedactionProperties redaction,

        @Valid
        ComplianceProperties compliance,

        @Valid
        AuditProperties audit,

        @Valid
        RetentionProperties retention,

        @Valid
        AuthProperties auth
) {

    public static final int DEFAULT_RETENTION_YEARS = 7;

    public LedgerProperties {
        if (enabled == null) {
            enabled = true;
        }
        if (retentionYears == null) {
            retentionYears = DEFAULT_RETENTION_YEARS;
        }
        if (redaction == null) {
            redaction = new RedactionProperties(null);
        }
        if (compliance == null) {
            compliance = new ComplianceProperties(null, null);
        }
        if (audit == null) {
            audit = new AuditProperties(null, null, null);
        }
        if (retention == null) {
            retention = new RetentionProperties(null, null, null, null);
        }
        if (auth == null) {
            auth = new AuthProperties(null);
        }
    }

    public Path basePath() {
        return Path.of(baseDir).toAbsolutePath().normalize();
    }

    public Path complianceDirectory() {
        return resolve(compliance.directory(), "compliance");
    }

    public Path auditDirectory() {
        return resolve(audit.directory(), "audit");
    }

    public Path retentionConfigDirectory() {
        return resolve(retention.configDir(), "config");
    }

    public Path archiveDirectory() {
        return resolve(retention.archiveDir(), "archive");
    }

    private Path resolve(String configured, String defaultChild) {
        return StringUtils.hasText(configured)
                ? Path.of(configured).toAbsolutePath().normalize()
                : basePath().resolve(defaultChild);
    }

    public record RedactionProperties(
            @Min(value = 1, message = "Redaction threshold (ledger.redaction.max-value-length) must be at least 1.")
            Integer maxValueLength
    ) {
        public static final int DEFAULT_MAX_VALUE_LENGTH = 1000;

        public RedactionProperties {
            if (maxValueLength == null) {
                maxValueLength = DEFAULT_MAX_VALUE_LENGTH;
            }
        }
    }

    public record ComplianceProperties(
            String directory,
            String prefix
    ) {
        public ComplianceProperties {
            if (!StringUtils.hasText(prefix)) {
                prefix = "events";
            }
        }
    }

    /**
     * Where operational audit events go: a second ledger ("ledger") or the application log ("slf4j").
     */
    public record AuditProperties(
            String backend,
            String directory,
            String prefix
    ) {
        public static final String BACKEND_PROPERTY = "ledger.audit.backend";

        public AuditProperties {
            if (!StringUtils.hasText(backend)) {
                backend = "ledger";
            }
            if (!StringUtils.hasText(prefix)) {
                prefix = "audit";
            }
        }

        @AssertTrue(message = "Audit backend (ledger.audit.backend) must be 'ledger' or 'slf4j'.")
        public boolean isBackendValid() {
            return "ledger".equals(backend) || "slf4j".equals(backend);
        }
    }

    public record RetentionProperties(
            String configDir,
            String archiveDir,
            @Valid
            Map<String, LocationProperties> locations,
            @Valid
            SchedulerProperties scheduler
    ) {
        public RetentionProperties {
            locations = locations == null ? Collections.emptyMap() : Map.copyOf(locations);
            if (scheduler == null) {
                scheduler = new SchedulerProperties(false, null);
            }
        }

        /**
         * Storage location of one data type. Map keys containing underscores must be bracketed in YAML,
         * e.g. {@code "[audit_logs]"}.
         */
        public record LocationProperties(
                @NotBlank(message = "Retention location path must be provided.")
                String path,
                DataClassification classification
        ) {}

        public record SchedulerProperties(
                boolean enabled,
                String cron
        ) {
            public static final String ENABLED_PROPERTY = "ledger.retention.scheduler.enabled";
            public static final String DEFAULT_CRON = "0 0 3 * * *";

            public SchedulerProperties {
                if (!StringUtils.hasText(cron)) {
                    cron = DEFAULT_CRON;
                }
            }
        }
    }

    public record AuthProperties(
            @Valid
            StaticTokenAuthProperties staticTokens
    ) {
        public AuthProperties {
            if (staticTokens == null) {
                staticTokens = new StaticTokenAuthProperties(false, null);
            }
        }

        public record StaticTokenMapping(
                @NotBlank(message = "Static token mapping name cannot be blank")
                String name,

                @NotBlank(message = "Static token value cannot be blank")
                String token,

                @NotEmpty(message = "Token must grant at least one authority")
                List<@NotNull LedgerAuthority> authorities
        ) {
            @Override
            public String toString() {
                return "StaticTokenMapping[name=" + name + ", token=******, authorities=" + authorities + "]";
            }
        }

        public record StaticTokenAuthProperties(
                boolean enabled,

                @Valid
                List<StaticTokenMapping> mappings
        ) {
            public StaticTokenAuthProperties {
                if (mappings == null) {
                    mappings = Collections.emptyList();
                }
            }

            @AssertTrue(message = "Static token mappings (ledger.auth.static-tokens.mappings) cannot be empty when static token auth is enabled.")
            public boolean isMappingsValid() {
                return !this.enabled() || !this.mappings().isEmpty();
            }
        }
    }
}
