package tech.yump.ledger.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.yump.ledger.auth.StaticTokenAuthFilter;

@Configuration
public class OpenApiConfig {

    private static final String SECURITY_SCHEME_NAME = "LedgerTokenAuth";

    @Bean
    public OpenAPI customOpenAPI() {
        SecurityScheme apiKeyScheme = new SecurityScheme()
                .name(StaticTokenAuthFilter.LEDGER_TOKEN_HEADER)
                .type(SecurityScheme.Type.APIKEY)
                .in(SecurityScheme.In.HEADER)
                .description("Static API token ('" + StaticTokenAuthFilter.LEDGER_TOKEN_HEADER
                        + "') granting LEDGER_READ, LEDGER_WRITE and/or RETENTION_ADMIN.");

        return new OpenAPI()
                .info(new Info()
                        .title("Lite Ledger API")
                        .description("Tamper-evident compliance event ledger and retention policy management.")
                        .version("v1"))
                .components(new Components()
                        .addSecuritySchemes(SECURITY_SCHEME_NAME, apiKeyScheme))
                .addSecurityItem(new SecurityRequirement().addList(SECURITY_SCHEME_NAME));
    }
}
