package me.golemcore.promptforge.domain.service;

import me.golemcore.promptforge.domain.model.EnhancementRequest;
import me.golemcore.promptforge.domain.model.EnhancementResult;
import me.golemcore.promptforge.domain.model.EnhancementSkipReason;
import me.golemcore.promptforge.domain.model.ToolProfile;
import me.golemcore.promptforge.infrastructure.config.PromptForgeProperties;
import me.golemcore.promptforge.port.outbound.EnhancementPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PromptEnhancementServiceTest {

    private static final String DRAFT = "Build Habit Tracker with React.";

    private EnhancementPort enhancementPort;
    private PromptForgeProperties properties;
    private PromptEnhancementService service;
    private ToolProfile profile;

    @BeforeEach
    void setUp() {
        enhancementPort = mock(EnhancementPort.class);
        properties = new PromptForgeProperties();
        properties.getEnhancement().setEnabled(true);
        properties.getEnhancement().setTimeoutMs(200);
        when(enhancementPort.isAvailable()).thenReturn(true);
        service = new PromptEnhancementService(enhancementPort, properties);
        profile = ToolProfile.builder()
                .id("lovable")
                .displayName("Lovable.dev")
                .tone("official yet casual")
                .guideline("Use React with TypeScript")
                .build();
    }

    @Test
    void shouldApplyEnhancedText() throws Exception {
        when(enhancementPort.enhance(any()))
                .thenReturn(CompletableFuture.completedFuture("  Build Habit Tracker with React and Supabase.  "));

        EnhancementResult result = service.enhance(DRAFT, profile, "Habit Tracker").get(1, TimeUnit.SECONDS);

        assertTrue(result.isApplied());
        assertEquals("Build Habit Tracker with React and Supabase.", result.getText());
    }

    @Test
    void shouldPassProfileDetailsToPort() throws Exception {
        when(enhancementPort.enhance(any())).thenReturn(CompletableFuture.completedFuture("Habit Tracker, better"));

        service.enhance(DRAFT, profile, "Habit Tracker").get(1, TimeUnit.SECONDS);

        ArgumentCaptor<EnhancementRequest> captor = ArgumentCaptor.forClass(EnhancementRequest.class);
        verify(enhancementPort).enhance(captor.capture());
        EnhancementRequest request = captor.getValue();
        assertEquals(DRAFT, request.getDraft());
        assertEquals("Lovable.dev", request.getToolDisplayName());
        assertEquals("Habit Tracker", request.getProjectName());
        assertEquals(List.of("Use React with TypeScript"), request.getGuidelines());
        assertEquals(2000, request.getMaxTokens());
    }

    @Test
    void shouldSkipWhenDisabled() throws Exception {
        properties.getEnhancement().setEnabled(false);

        EnhancementResult result = service.enhance(DRAFT, profile, "Habit Tracker").get(1, TimeUnit.SECONDS);

        assertSkipped(result, EnhancementSkipReason.DISABLED);
        verify(enhancementPort, never()).enhance(any());
    }

    @Test
    void shouldSkipWhenUnavailable() throws Exception {
        when(enhancementPort.isAvailable()).thenReturn(false);

        EnhancementResult result = service.enhance(DRAFT, profile, "Habit Tracker").get(1, TimeUnit.SECONDS);

        assertSkipped(result, EnhancementSkipReason.UNAVAILABLE);
    }

    @Test
    void shouldFallBackOnFailure() throws Exception {
        when(enhancementPort.enhance(any()))
                .thenReturn(CompletableFuture.failedFuture(new IOException("connection reset")));

        EnhancementResult result = service.enhance(DRAFT, profile, "Habit Tracker").get(1, TimeUnit.SECONDS);

        assertSkipped(result, EnhancementSkipReason.FAILED);
    }

    @Test
    void shouldFallBackWhenCallCannotStart() throws Exception {
        when(enhancementPort.enhance(any())).thenThrow(new IllegalStateException("no client"));

        EnhancementResult result = service.enhance(DRAFT, profile, "Habit Tracker").get(1, TimeUnit.SECONDS);

        assertSkipped(result, EnhancementSkipReason.FAILED);
    }

    @Test
    void shouldFallBackOnTimeout() throws Exception {
        properties.getEnhancement().setTimeoutMs(50);
        when(enhancementPort.enhance(any())).thenReturn(new CompletableFuture<>());

        EnhancementResult result = service.enhance(DRAFT, profile, "Habit Tracker").get(2, TimeUnit.SECONDS);

        assertSkipped(result, EnhancementSkipReason.TIMEOUT);
    }

    @Test
    void shouldRejectBlankResponse() throws Exception {
        when(enhancementPort.enhance(any())).thenReturn(CompletableFuture.completedFuture("   "));

        EnhancementResult result = service.enhance(DRAFT, profile, "Habit Tracker").get(1, TimeUnit.SECONDS);

        assertSkipped(result, EnhancementSkipReason.MALFORMED);
    }

    @Test
    void shouldRejectResponseThatDropsProjectName() throws Exception {
        when(enhancementPort.enhance(any()))
                .thenReturn(CompletableFuture.completedFuture("Build a generic tracker app."));

        EnhancementResult result = service.enhance(DRAFT, profile, "Habit Tracker").get(1, TimeUnit.SECONDS);

        assertSkipped(result, EnhancementSkipReason.MALFORMED);
    }

    @Test
    void shouldCancelRemoteCallWhenResultIsCancelled() {
        CompletableFuture<String> call = new CompletableFuture<>();
        properties.getEnhancement().setTimeoutMs(5000);
        when(enhancementPort.enhance(any())).thenReturn(call);

        CompletableFuture<EnhancementResult> result = service.enhance(DRAFT, profile, "Habit Tracker");
        result.cancel(true);

        assertTrue(call.isCancelled());
    }

    private static void assertSkipped(EnhancementResult result, EnhancementSkipReason reason) {
        assertFalse(result.isApplied());
        assertEquals(DRAFT, result.getText());
        assertEquals(reason, result.getSkipReason());
    }
}
