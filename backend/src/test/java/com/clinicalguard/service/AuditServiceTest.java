package com.clinicalguard.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import com.clinicalguard.entity.AuditLog;
import com.clinicalguard.entity.AuditLog.AuditAction;
import com.clinicalguard.signal.DecisionSignal;
import com.clinicalguard.signal.OverridePolicy;
import com.clinicalguard.signal.SignalColor;

/**
 * Unit tests for AuditService
 *
 * Validates that issued signals and clinician decisions are audited with the
 * clinician identity and request origin.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("AuditService Tests")
class AuditServiceTest {

    @Mock
    private AuditWriter auditWriter;

    @Mock
    private SecurityContext securityContext;

    @Mock
    private Authentication authentication;

    @InjectMocks
    private AuditService auditService;

    private Jwt testJwt;

    @BeforeEach
    void setUp() {
        testJwt = Jwt.withTokenValue("test-token")
                .header("alg", "RS256")
                .claim("sub", "clinician-42")
                .claim("email", "doctor@hospital.com")
                .build();
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
        RequestContextHolder.resetRequestAttributes();
    }

    private AuditLog captureWritten() {
        ArgumentCaptor<AuditLog> captor = ArgumentCaptor.forClass(AuditLog.class);
        verify(auditWriter).write(captor.capture());
        return captor.getValue();
    }

    @Nested
    @DisplayName("log() Method Tests")
    class LogMethodTests {

        @Test
        @DisplayName("Should create audit log entry with all fields")
        void shouldCreateAuditLogEntryWithAllFields() {
            // Act
            auditService.log(AuditAction.SNAPSHOT_REFRESHED, "SafetySnapshot", "4", null, "Snapshot refresh requested");

            // Assert
            AuditLog savedLog = captureWritten();
            assertEquals(AuditAction.SNAPSHOT_REFRESHED, savedLog.getAction());
            assertEquals("SafetySnapshot", savedLog.getEntityType());
            assertEquals("4", savedLog.getEntityId());
            assertEquals("Snapshot refresh requested", savedLog.getDescription());
            assertNotNull(savedLog.getOccurredAt());
        }

        @Test
        @DisplayName("Should capture user from JWT")
        void shouldCaptureUserFromJwt() {
            // Arrange
            SecurityContextHolder.setContext(securityContext);
            when(securityContext.getAuthentication()).thenReturn(authentication);
            when(authentication.getPrincipal()).thenReturn(testJwt);

            // Act
            auditService.log(AuditAction.SNAPSHOT_REFRESHED, "SafetySnapshot", "1", null, "refresh");

            // Assert
            AuditLog savedLog = captureWritten();
            assertEquals("doctor@hospital.com", savedLog.getUserEmail());
            assertEquals("clinician-42", savedLog.getUserId());
        }

        @Test
        @DisplayName("Should capture the first forwarded client address")
        void shouldCaptureForwardedAddress() {
            // Arrange
            MockHttpServletRequest request = new MockHttpServletRequest();
            request.addHeader("X-Forwarded-For", "203.0.113.9, 10.0.0.1");
            request.addHeader("User-Agent", "ward-tablet");
            RequestContextHolder.setRequestAttributes(new ServletRequestAttributes(request));

            // Act
            auditService.log(AuditAction.SNAPSHOT_REFRESHED, "SafetySnapshot", "1", null, "refresh");

            // Assert
            AuditLog savedLog = captureWritten();
            assertEquals("203.0.113.9", savedLog.getIpAddress());
            assertEquals("ward-tablet", savedLog.getUserAgent());
        }

        @Test
        @DisplayName("Should handle missing authentication gracefully")
        void shouldHandleMissingAuthenticationGracefully() {
            SecurityContextHolder.clearContext();

            assertDoesNotThrow(() -> auditService.log(AuditAction.SNAPSHOT_REFRESHED, "SafetySnapshot", "1", null, "x"));

            AuditLog savedLog = captureWritten();
            assertNull(savedLog.getUserEmail());
            assertNull(savedLog.getIpAddress());
        }
    }

    @Nested
    @DisplayName("Signal and decision entries")
    class SignalAndDecisionTests {

        @Test
        @DisplayName("Should record signal color and policy")
        void shouldRecordSignal() {
            DecisionSignal signal = new DecisionSignal(SignalColor.RED, List.of(), OverridePolicy.BLOCKED);

            auditService.logSignal("signal-1", "enc-9", signal);

            AuditLog savedLog = captureWritten();
            assertEquals(AuditAction.SIGNAL_ISSUED, savedLog.getAction());
            assertEquals("signal-1", savedLog.getEntityId());
            assertEquals("enc-9", savedLog.getEncounterRef());
            assertEquals("RED", savedLog.getSignalColor());
            assertEquals("BLOCKED", savedLog.getOverridePolicy());
        }

        @Test
        @DisplayName("Should record justification and supervisor of a decision")
        void shouldRecordDecision() {
            auditService.logDecision(AuditAction.OVERRIDE_SUPERVISED, "signal-2", "enc-9", "RED",
                "REQUIRES_SUPERVISOR", "Palliative care, pain control", "attending-7", "override");

            AuditLog savedLog = captureWritten();
            assertEquals(AuditAction.OVERRIDE_SUPERVISED, savedLog.getAction());
            assertEquals("Palliative care, pain control", savedLog.getJustification());
            assertEquals("attending-7", savedLog.getSupervisorId());
        }
    }
}
