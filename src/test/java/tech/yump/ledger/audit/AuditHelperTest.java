package tech.yump.ledger.audit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.MockedStatic;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.http.HttpStatus;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;
import tech.yump.ledger.auth.LedgerAuthority;
import tech.yump.ledger.auth.StaticTokenAuthFilter;
import tech.yump.ledger.event.Outcome;
import tech.yump.ledger.support.MutableClock;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mockStatic;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class AuditHelperTest {

    private static final String NOW = "2024-05-01T12:00:00Z";

    @Mock
    private AuditBackend mockAuditBackend;
    @Mock
    private SecurityContext mockSecurityContext;

    private AuditHelper auditHelper;

    @Captor
    private ArgumentCaptor<AuditEvent> auditEventCaptor;

    private MockedStatic<RequestContextHolder> mockedRequestContextHolder;
    private MockedStatic<SecurityContextHolder> mockedSecurityContextHolder;

    private final String TEST_REQUEST_ID = UUID.randomUUID().toString();
    private final String TEST_PRINCIPAL = "writer";
    private final String TEST_IP = "192.168.0.100";

    @BeforeEach
    void setUp() {
        auditHelper = new AuditHelper(mockAuditBackend, MutableClock.at(NOW));

        MockHttpServletRequest mockRequest = new MockHttpServletRequest();
        mockRequest.setRemoteAddr(TEST_IP);
        mockRequest.setRequestURI("/v1/ledger/events");
        mockRequest.setMethod("POST");
        mockRequest.setAttribute(StaticTokenAuthFilter.REQUEST_ID_ATTR, TEST_REQUEST_ID);

        ServletRequestAttributes attrs = new ServletRequestAttributes(mockRequest);
        mockedRequestContextHolder = mockStatic(RequestContextHolder.class);
        mockedRequestContextHolder.when(RequestContextHolder::getRequestAttributes).thenReturn(attrs);

        mockedSecurityContextHolder = mockStatic(SecurityContextHolder.class);
        mockedSecurityContextHolder.when(SecurityContextHolder::getContext).thenReturn(mockSecurityContext);
    }

    @AfterEach
    void tearDown() {
        mockedRequestContextHolder.close();
        mockedSecurityContextHolder.close();
    }

    private Authentication authenticated() {
        return new UsernamePasswordAuthenticationToken(
                TEST_PRINCIPAL,
                null,
                List.of(LedgerAuthority.LEDGER_WRITE, LedgerAuthority.LEDGER_READ)
        );
    }

    // --- logHttpEvent ---

    @Test
    @DisplayName("logHttpEvent: Should log success event with full context")
    void logHttpEvent_Success_FullContext() {
        when(mockSecurityContext.getAuthentication()).thenReturn(authenticated());
        Map<String, Object> data = Map.of("event_id", "e-1");

        auditHelper.logHttpEvent("ledger", "append", Outcome.SUCCESS, HttpStatus.CREATED.value(), null, data);

        verify(mockAuditBackend).logEvent(auditEventCaptor.capture());
        AuditEvent event = auditEventCaptor.getValue();

        assertThat(event.type()).isEqualTo("ledger");
        assertThat(event.action()).isEqualTo("append");
        assertThat(event.outcome()).isEqualTo(Outcome.SUCCESS);
        assertThat(event.timestamp()).isEqualTo(Instant.parse(NOW));

        assertThat(event.authInfo().principal()).isEqualTo(TEST_PRINCIPAL);
        assertThat(event.authInfo().sourceAddress()).isEqualTo(TEST_IP);
        assertThat(event.authInfo().authorities()).containsExactly("LEDGER_READ", "LEDGER_WRITE");

        assertThat(event.requestInfo().requestId()).isEqualTo(TEST_REQUEST_ID);
        assertThat(event.requestInfo().httpMethod()).isEqualTo("POST");
        assertThat(event.requestInfo().path()).isEqualTo("/v1/ledger/events");

        assertThat(event.responseInfo().statusCode()).isEqualTo(201);
        assertThat(event.responseInfo().errorMessage()).isNull();
        assertThat(event.data()).isEqualTo(data);
    }

    @Test
    @DisplayName("logHttpEvent: Should log failure event with error message")
    void logHttpEvent_Failure_WithError() {
        when(mockSecurityContext.getAuthentication()).thenReturn(authenticated());

        auditHelper.logHttpEvent("policy", "delete_policy", Outcome.FAILURE, HttpStatus.CONFLICT.value(),
                "Policy is built in", Map.of("policy_id", "session_state_daily"));

        verify(mockAuditBackend).logEvent(auditEventCaptor.capture());
        AuditEvent event = auditEventCaptor.getValue();

        assertThat(event.outcome()).isEqualTo(Outcome.FAILURE);
        assertThat(event.responseInfo().statusCode()).isEqualTo(409);
        assertThat(event.responseInfo().errorMessage()).isEqualTo("Policy is built in");
        assertThat(event.data()).containsEntry("policy_id", "session_state_daily");
    }

    @Test
    @DisplayName("logHttpEvent: Should record anonymous callers without authorities")
    void logHttpEvent_AnonymousUser() {
        Authentication anonymous = new AnonymousAuthenticationToken("key", "anonymousUser",
                List.of(new SimpleGrantedAuthority("ROLE_ANONYMOUS")));
        when(mockSecurityContext.getAuthentication()).thenReturn(anonymous);

        auditHelper.logHttpEvent("ledger", "query", Outcome.FAILURE, 401, "Unauthorized", null);

        verify(mockAuditBackend).logEvent(auditEventCaptor.capture());
        AuditEvent event = auditEventCaptor.getValue();

        assertThat(event.authInfo().principal()).isEqualTo(AuditEvent.AuthInfo.ANONYMOUS);
        assertThat(event.authInfo().authorities()).isNull();
        assertThat(event.requestInfo()).isNotNull();
        assertThat(event.data()).isNull();
    }

    @Test
    @DisplayName("logHttpEvent: Should handle missing request context gracefully")
    void logHttpEvent_MissingRequestContext() {
        mockedRequestContextHolder.when(RequestContextHolder::getRequestAttributes).thenReturn(null);
        when(mockSecurityContext.getAuthentication()).thenReturn(authenticated());

        auditHelper.logHttpEvent("ledger", "verify", Outcome.SUCCESS, 200, null, null);

        verify(mockAuditBackend).logEvent(auditEventCaptor.capture());
        AuditEvent event = auditEventCaptor.getValue();

        assertThat(event.authInfo().principal()).isEqualTo(TEST_PRINCIPAL);
        assertThat(event.authInfo().sourceAddress()).isNull();
        assertThat(event.requestInfo()).isNull();
        assertThat(event.responseInfo()).isNotNull();
    }

    @Test
    @DisplayName("logHttpEvent: Should leave response info out while the status is undecided")
    void logHttpEvent_NoStatus() {
        when(mockSecurityContext.getAuthentication()).thenReturn(authenticated());

        auditHelper.logHttpEvent("auth", "token_validation", Outcome.SUCCESS, null, null, Map.of("mapping_name", "writer"));

        verify(mockAuditBackend).logEvent(auditEventCaptor.capture());
        assertThat(auditEventCaptor.getValue().responseInfo()).isNull();
    }

    // --- logInternalEvent ---

    @Test
    @DisplayName("logInternalEvent: Should use principal from SecurityContext if available")
    void logInternalEvent_PrincipalFromContext() {
        when(mockSecurityContext.getAuthentication()).thenReturn(authenticated());

        auditHelper.logInternalEvent("retention", "run_policy", Outcome.SUCCESS, Map.of("policy_id", "p1"));

        verify(mockAuditBackend).logEvent(auditEventCaptor.capture());
        AuditEvent event = auditEventCaptor.getValue();

        assertThat(event.authInfo().principal()).isEqualTo(TEST_PRINCIPAL);
        assertThat(event.authInfo().sourceAddress()).isNull();
        assertThat(event.requestInfo()).isNull();
        assertThat(event.responseInfo()).isNull();
        assertThat(event.data()).isEqualTo(Map.of("policy_id", "p1"));
    }

    @Test
    @DisplayName("logInternalEvent: Should default principal to 'system' without an authenticated caller")
    void logInternalEvent_DefaultSystemPrincipal() {
        when(mockSecurityContext.getAuthentication()).thenReturn(null);

        auditHelper.logInternalEvent("retention", "scheduled_run", Outcome.SUCCESS, Map.of());

        verify(mockAuditBackend).logEvent(auditEventCaptor.capture());
        AuditEvent event = auditEventCaptor.getValue();

        assertThat(event.authInfo().principal()).isEqualTo(AuditEvent.AuthInfo.SYSTEM);
        assertThat(event.authInfo().authorities()).isNull();
        assertThat(event.data()).isNull();
    }

    @Test
    @DisplayName("logInternalEvent: Should not fail if AuditBackend throws exception")
    void logInternalEvent_AuditBackendThrowsException() {
        doThrow(new RuntimeException("Logging failed!")).when(mockAuditBackend).logEvent(any(AuditEvent.class));

        assertThatCode(() -> auditHelper.logInternalEvent("retention", "scheduled_run", Outcome.FAILURE, null))
                .doesNotThrowAnyException();

        verify(mockAuditBackend).logEvent(any(AuditEvent.class));
    }
}
