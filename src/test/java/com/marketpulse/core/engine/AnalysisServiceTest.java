package com.marketpulse.core.engine;

import com.marketpulse.core.events.EventBus;
import com.marketpulse.core.model.AnalysisRequest;
import com.marketpulse.core.model.FinalReport;
import com.marketpulse.core.model.SessionStatus;
import com.marketpulse.core.persistence.CheckpointStore;
import com.marketpulse.core.session.AnalysisSession;
import com.marketpulse.core.session.SessionProperties;
import com.marketpulse.core.session.SessionRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class AnalysisServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

    private StageSequencer sequencer;
    private StageCatalog catalog;
    private SessionRegistry registry;
    private AnalysisService service;

    @BeforeEach
    void setUp() {
        sequencer = mock(StageSequencer.class);
        catalog = mock(StageCatalog.class);
        registry = spy(new SessionRegistry(new SessionProperties(), new EventBus(), CLOCK));
        service = new AnalysisService(new AnalysisRequestValidator(), sequencer, catalog, registry,
                mock(CheckpointStore.class), CLOCK);
    }

    @Test
    @DisplayName("generated ids carry the date and eight hex characters")
    void generatedIdFormat() {
        String id = service.generateSessionId();
        assertTrue(id.matches("MP-20260301-[0-9a-f]{8}"), id);
    }

    @Test
    @DisplayName("open registers the session and stamps its id on the request")
    void openRegisters() {
        AnalysisSession session = service.open(AnalysisRequest.forSegment("lojas de vinho", "clube de assinatura"));

        assertSame(session, service.find(session.getId()).orElseThrow());
        assertEquals(session.getId(), session.getRequest().sessionId());
        assertEquals(CLOCK.instant(), session.getCreatedAt());
    }

    @Test
    @DisplayName("a caller-supplied session id is honoured and cannot be reused")
    void suppliedIdReuse() {
        var request = AnalysisRequest.forSegment("lojas de vinho", null).withSessionId("client-42");

        assertEquals("client-42", service.open(request).getId());
        var ex = assertThrows(InputValidationException.class, () -> service.open(request));
        assertTrue(ex.getErrors().get(0).contains("client-42"));
    }

    @Test
    @DisplayName("invalid requests never reach the sequencer")
    void invalidNotRun() {
        assertThrows(InputValidationException.class, () -> service.analyze(AnalysisRequest.forSegment("x", null)));
        verifyNoInteractions(sequencer);
        assertTrue(registry.all().isEmpty());
    }

    @Test
    void analyzeRunsConfiguredStages() {
        var report = mock(FinalReport.class);
        when(catalog.stages()).thenReturn(List.of());
        when(sequencer.execute(any(), eq(List.of()))).thenReturn(report);

        assertSame(report, service.analyze(AnalysisRequest.forSegment("lojas de vinho", null)));
    }

    @Test
    @DisplayName("cancel only succeeds once and only for known sessions")
    void cancel() {
        var session = service.open(AnalysisRequest.forSegment("lojas de vinho", null));

        assertFalse(service.cancel("unknown"));
        assertTrue(service.cancel(session.getId()));
        assertFalse(service.cancel(session.getId()));
        assertTrue(session.isCancelled());
    }

    @Test
    @DisplayName("an id registered concurrently between validation and registration is a validation error")
    void concurrentDuplicateId() {
        var request = AnalysisRequest.forSegment("lojas de vinho", null).withSessionId("client-7");
        doThrow(new IllegalStateException("Session already exists: client-7")).when(registry).register(any());

        var ex = assertThrows(InputValidationException.class, () -> service.open(request));

        assertEquals(List.of("session_id client-7 is already in use"), ex.getErrors());
        assertInstanceOf(IllegalStateException.class, ex.getCause());
    }

    @Test
    @DisplayName("a finished session is archived without its payloads")
    void runArchives() {
        when(catalog.stages()).thenReturn(List.of());
        when(sequencer.execute(any(), any())).thenAnswer(inv -> {
            inv.<AnalysisSession>getArgument(0).markCompleted(CLOCK.instant());
            return mock(FinalReport.class);
        });

        var session = service.open(AnalysisRequest.forSegment("lojas de vinho", null));
        service.run(session);

        assertTrue(session.isArchived());
        assertEquals(SessionStatus.COMPLETED, session.getStatus());
        assertSame(session, service.find(session.getId()).orElseThrow());
    }

    @Test
    @DisplayName("a session whose run throws is archived too")
    void failedRunArchives() {
        when(catalog.stages()).thenReturn(List.of());
        when(sequencer.execute(any(), any())).thenThrow(
                new SessionAbortedException("MP-x", "research", "no sources", null, List.of()));

        var session = service.open(AnalysisRequest.forSegment("lojas de vinho", null));

        assertThrows(SessionAbortedException.class, () -> service.run(session));
        verify(registry).archive(session);
        assertEquals(SessionStatus.FAILED, session.getStatus());
    }
}
