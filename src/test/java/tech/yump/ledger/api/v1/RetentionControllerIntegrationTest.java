package tech.yump.ledger.api.v1;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import tech.yump.ledger.auth.LedgerAuthority;
import tech.yump.ledger.auth.StaticTokenAuthFilter;
import tech.yump.ledger.retention.BuiltInPolicies;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.is;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.anonymous;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.authentication;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class RetentionControllerIntegrationTest {

    @TempDir
    static Path tempDataDir;

    @DynamicPropertySource
    static void overrideProperties(DynamicPropertyRegistry registry) {
        registry.add("ledger.base-dir", () -> tempDataDir.toAbsolutePath().toString());
        registry.add("ledger.retention.locations[exports].path", () -> exportsDir().toString());
    }

    private static Path exportsDir() {
        return tempDataDir.toAbsolutePath().resolve("exports");
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    // Tokens defined in application-test.yml
    private static final String READ_TOKEN = "test-reader-token";
    private static final String WRITE_TOKEN = "test-writer-token";
    private static final String ADMIN_TOKEN = "test-admin-token";

    private static final String POLICIES_URL = "/v1/retention/policies";

    private Map<String, Object> exportCleanup(String name) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", name);
        body.put("data_types", List.of("exports"));
        body.put("retention_days", 30);
        body.put("action", "delete");
        body.put("schedule", "weekly");
        return body;
    }

    private JsonNode createPolicy(Map<String, Object> body) throws Exception {
        MvcResult result = mockMvc.perform(post(POLICIES_URL)
                        .header(StaticTokenAuthFilter.LEDGER_TOKEN_HEADER, ADMIN_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(body)))
                .andExpect(status().isCreated())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private JsonNode policyChanges() throws Exception {
        MvcResult result = mockMvc.perform(get("/v1/ledger/events")
                        .header(StaticTokenAuthFilter.LEDGER_TOKEN_HEADER, ADMIN_TOKEN)
                        .param("category", "policy_change"))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    // --- Authorization ---

    @Test
    @DisplayName("GET /policies: Should return 401 without a token")
    void listPolicies_noToken_unauthorized() throws Exception {
        mockMvc.perform(get(POLICIES_URL))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("GET /policies: Should list the built-in policies first for a read token")
    void listPolicies_readToken_ok() throws Exception {
        mockMvc.perform(get(POLICIES_URL).header(StaticTokenAuthFilter.LEDGER_TOKEN_HEADER, READ_TOKEN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id", is(BuiltInPolicies.AUDIT_LOGS)))
                .andExpect(jsonPath("$[*].id", hasItem(BuiltInPolicies.SESSION)));
    }

    @Test
    @DisplayName("POST /policies: Should return 403 without RETENTION_ADMIN")
    void createPolicy_writeToken_forbidden() throws Exception {
        mockMvc.perform(post(POLICIES_URL)
                        .header(StaticTokenAuthFilter.LEDGER_TOKEN_HEADER, WRITE_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(exportCleanup("Forbidden"))))
                .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("GET /status: Should return 401 for an anonymous caller")
    void status_anonymous_unauthorized() throws Exception {
        mockMvc.perform(get("/v1/retention/status").with(anonymous()))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("POST /policies: Should accept any caller holding RETENTION_ADMIN and record it as an admin")
    void createPolicy_adminAuthority_recordsCaller() throws Exception {
        UsernamePasswordAuthenticationToken ops = new UsernamePasswordAuthenticationToken(
                "ops", null, List.of(LedgerAuthority.RETENTION_ADMIN));

        mockMvc.perform(post(POLICIES_URL)
                        .with(authentication(ops))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(exportCleanup("Created by ops"))))
                .andExpect(status().isCreated());

        JsonNode latest = policyChanges().get(0);
        assertThat(latest.at("/actor/type").asText()).isEqualTo("admin");
        assertThat(latest.at("/actor/id").asText()).isEqualTo("ops");
        assertThat(latest.at("/details/new_value/name").asText()).isEqualTo("Created by ops");
    }

    @Test
    @DisplayName("POST /run: Should return 403 for a read token")
    void runDue_readToken_forbidden() throws Exception {
        mockMvc.perform(post("/v1/retention/run").header(StaticTokenAuthFilter.LEDGER_TOKEN_HEADER, READ_TOKEN))
                .andExpect(status().isForbidden());
    }

    // --- Policy CRUD ---

    @Test
    @DisplayName("Policy lifecycle: create, read, update and delete, each change recorded in the ledger")
    void policyLifecycle() throws Exception {
        int changesBefore = policyChanges().size();

        JsonNode created = createPolicy(exportCleanup("Export cleanup"));
        String id = created.get("id").asText();
        assertThat(id).isNotBlank();
        assertThat(created.get("retention_days").asInt()).isEqualTo(30);

        mockMvc.perform(get(POLICIES_URL + "/" + id).header(StaticTokenAuthFilter.LEDGER_TOKEN_HEADER, READ_TOKEN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name", is("Export cleanup")));

        mockMvc.perform(patch(POLICIES_URL + "/" + id)
                        .header(StaticTokenAuthFilter.LEDGER_TOKEN_HEADER, ADMIN_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"retention_days\": 90}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.retention_days", is(90)))
                .andExpect(jsonPath("$.name", is("Export cleanup")));

        mockMvc.perform(delete(POLICIES_URL + "/" + id).header(StaticTokenAuthFilter.LEDGER_TOKEN_HEADER, ADMIN_TOKEN))
                .andExpect(status().isNoContent());

        mockMvc.perform(get(POLICIES_URL + "/" + id).header(StaticTokenAuthFilter.LEDGER_TOKEN_HEADER, READ_TOKEN))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.title", is("Policy Not Found")));

        JsonNode changes = policyChanges();
        assertThat(changes.size()).isEqualTo(changesBefore + 3);
        JsonNode latest = changes.get(0);
        assertThat(latest.at("/resource/id").asText()).isEqualTo("retention_policy:" + id);
        assertThat(latest.at("/actor/type").asText()).isEqualTo("admin");
        assertThat(latest.at("/actor/id").asText()).isEqualTo("admin");
        assertThat(latest.at("/details/old_value/retention_days").asInt()).isEqualTo(90);
    }

    @Test
    @DisplayName("POST /policies: Should return 400 for an invalid policy")
    void createPolicy_invalid_badRequest() throws Exception {
        Map<String, Object> body = exportCleanup("Invalid");
        body.put("retention_days", 0);
        body.put("data_types", List.of());

        mockMvc.perform(post(POLICIES_URL)
                        .header(StaticTokenAuthFilter.LEDGER_TOKEN_HEADER, ADMIN_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(body)))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("PATCH and DELETE: Should return 409 for built-in policies")
    void builtInPolicies_conflict() throws Exception {
        mockMvc.perform(patch(POLICIES_URL + "/" + BuiltInPolicies.CONSENT)
                        .header(StaticTokenAuthFilter.LEDGER_TOKEN_HEADER, ADMIN_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"retention_days\": 1}"))
                .andExpect(status().isConflict());

        mockMvc.perform(delete(POLICIES_URL + "/" + BuiltInPolicies.CONSENT)
                        .header(StaticTokenAuthFilter.LEDGER_TOKEN_HEADER, ADMIN_TOKEN))
                .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("PATCH and DELETE: Should return 404 for unknown policies")
    void unknownPolicy_notFound() throws Exception {
        mockMvc.perform(patch(POLICIES_URL + "/policy_missing")
                        .header(StaticTokenAuthFilter.LEDGER_TOKEN_HEADER, ADMIN_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"retention_days\": 5}"))
                .andExpect(status().isNotFound());

        mockMvc.perform(delete(POLICIES_URL + "/policy_missing")
                        .header(StaticTokenAuthFilter.LEDGER_TOKEN_HEADER, ADMIN_TOKEN))
                .andExpect(status().isNotFound());

        mockMvc.perform(post(POLICIES_URL + "/policy_missing/run")
                        .header(StaticTokenAuthFilter.LEDGER_TOKEN_HEADER, ADMIN_TOKEN))
                .andExpect(status().isNotFound());
    }

    // --- Runs and status ---

    @Test
    @DisplayName("POST /policies/{id}/run: Should delete expired items and keep recent ones")
    void runPolicy_deletesExpiredItems() throws Exception {
        Files.createDirectories(exportsDir());
        Path old = Files.writeString(exportsDir().resolve("report-old.csv"), "a,b\n1,2\n");
        Files.setLastModifiedTime(old, FileTime.from(Instant.now().minus(Duration.ofDays(60))));
        Path recent = Files.writeString(exportsDir().resolve("report-new.csv"), "a,b\n3,4\n");

        String id = createPolicy(exportCleanup("Run now")).get("id").asText();

        mockMvc.perform(post(POLICIES_URL + "/" + id + "/run").header(StaticTokenAuthFilter.LEDGER_TOKEN_HEADER, ADMIN_TOKEN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].data_type", is("exports")))
                .andExpect(jsonPath("$[0].action", is("delete")))
                .andExpect(jsonPath("$[0].items_processed", is(1)))
                .andExpect(jsonPath("$[0].success", is(true)));

        assertThat(old).doesNotExist();
        assertThat(recent).exists();
    }

    @Test
    @DisplayName("POST /run and GET /status: Due policies run and are reported as recently run")
    void runDue_thenStatus() throws Exception {
        mockMvc.perform(post("/v1/retention/run").header(StaticTokenAuthFilter.LEDGER_TOKEN_HEADER, ADMIN_TOKEN))
                .andExpect(status().isOk());

        mockMvc.perform(get("/v1/retention/status").header(StaticTokenAuthFilter.LEDGER_TOKEN_HEADER, READ_TOKEN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.last_runs." + BuiltInPolicies.SESSION).exists())
                .andExpect(jsonPath("$.next_due[*].policy_id", hasItem(BuiltInPolicies.SESSION)));
    }
}
