package com.questrail.scheduler.remote.internal;

import com.questrail.scheduler.api.SchedulerCommunicationException;
import com.questrail.scheduler.api.SchedulerException;
import com.questrail.scheduler.remote.observability.RecordingObservabilitySink;
import com.questrail.scheduler.remote.observability.RemoteCallFailureEvent;
import com.questrail.scheduler.remote.transport.CountingEndpointFactory;
import com.questrail.scheduler.remote.transport.FakeRemoteSchedulerEndpoint;
import com.questrail.scheduler.remote.transport.RemoteSchedulerEndpoint;
import org.junit.jupiter.api.Test;

import java.rmi.RemoteException;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Classification in {@link CallResult#invoke} and translation in
 * {@link RemoteFailureTranslator}.
 */
class RemoteFailureTranslatorTest
{
    private static final Instant T0 = Instant.parse("2024-03-01T09:00:00Z");

    private final FakeRemoteSchedulerEndpoint engine = new FakeRemoteSchedulerEndpoint("RemoteEngine");
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final RemoteEndpointHandle handle =
            new RemoteEndpointHandle("reporting", new CountingEndpointFactory(engine), sink, () -> T0);
    private final RemoteFailureTranslator translator =
            new RemoteFailureTranslator("reporting", handle, sink, () -> T0);

    // ---------- Classification ----------

    @Test
    void returnedValueIsOk() {
        CallResult<String> result = CallResult.invoke(engine, RemoteSchedulerEndpoint::getSchedulerName);

        assertTrue(result.isOk());
        assertEquals(new CallResult.Ok<>("RemoteEngine"), result);
    }

    @Test
    void nullValueIsOk() {
        CallResult<Instant> result = CallResult.invoke(engine, RemoteSchedulerEndpoint::getRunningSince);

        assertEquals(new CallResult.Ok<Instant>(null), result);
    }

    @Test
    void remoteExceptionIsCommunicationFailure() {
        RemoteException lost = new RemoteException("reset");

        CallResult<String> result = CallResult.invoke(engine, e -> { throw lost; });

        assertFalse(result.isOk());
        assertEquals(new CallResult.CommunicationFailure<String>(lost), result);
    }

    @Test
    void schedulerExceptionIsDomainFailure() {
        SchedulerException refused = new SchedulerException("refused");

        CallResult<String> result = CallResult.invoke(engine, e -> { throw refused; });

        assertEquals(new CallResult.DomainFailure<String>(refused), result);
    }

    @Test
    void otherRuntimeExceptionsAreNotClassified() {
        IllegalArgumentException bug = new IllegalArgumentException("bad argument");

        IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class,
                () -> CallResult.invoke(engine, e -> { throw bug; }));

        assertSame(bug, thrown);
    }

    // ---------- Translation ----------

    @Test
    void okTranslatesToItsValue() {
        assertEquals("value", translator.translate("getSchedulerName", new CallResult.Ok<>("value")));
        assertNull(translator.translate("getTrigger", new CallResult.Ok<>(null)));
        assertTrue(sink.getAllEvents().isEmpty());
    }

    @Test
    void communicationFailureInvalidatesAndNamesSchedulerAndOperation() {
        handle.get();
        RemoteException lost = new RemoteException("reset");

        SchedulerCommunicationException e = assertThrows(SchedulerCommunicationException.class,
                () -> translator.translate("pauseAll", new CallResult.CommunicationFailure<Void>(lost)));

        assertEquals("Error communicating with remote scheduler 'reporting' during pauseAll.", e.getMessage());
        assertSame(lost, e.getCause());
        assertFalse(handle.isConnected());

        RemoteCallFailureEvent event = sink.callFailures().get(0);
        assertEquals(RemoteCallFailureEvent.Category.COMMUNICATION, event.category());
        assertEquals("pauseAll", event.operation());
        assertSame(lost, event.cause());
    }

    @Test
    void domainFailureIsRethrownAndHandleKept() {
        handle.get();
        SchedulerException refused = new SchedulerException("refused");

        SchedulerException e = assertThrows(SchedulerException.class,
                () -> translator.translate("deleteCalendar", new CallResult.DomainFailure<Boolean>(refused)));

        assertSame(refused, e);
        assertTrue(handle.isConnected());
        assertEquals(RemoteCallFailureEvent.Category.DOMAIN, sink.callFailures().get(0).category());
    }
}
