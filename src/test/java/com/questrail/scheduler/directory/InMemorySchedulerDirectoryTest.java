package com.questrail.scheduler.directory;

import com.questrail.scheduler.api.ObjectAlreadyExistsException;
import com.questrail.scheduler.api.Scheduler;
import com.questrail.scheduler.remote.RemoteScheduler;
import com.questrail.scheduler.remote.transport.CountingEndpointFactory;
import com.questrail.scheduler.remote.transport.FakeRemoteSchedulerEndpoint;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class InMemorySchedulerDirectoryTest
{
    private final InMemorySchedulerDirectory directory = new InMemorySchedulerDirectory();

    private Scheduler proxy(String id) {
        return RemoteScheduler.builder()
                .withSchedulerId(id)
                .withEndpointFactory(new CountingEndpointFactory(new FakeRemoteSchedulerEndpoint()))
                .withDirectory(directory)
                .build();
    }

    @Test
    void registerThenLookup() {
        Scheduler reporting = proxy("reporting");

        directory.register("reporting", reporting);

        assertEquals(Optional.of(reporting), directory.lookup("reporting"));
        assertEquals(Optional.empty(), directory.lookup("billing"));
        assertEquals(Set.of("reporting"), directory.names());
    }

    @Test
    void duplicateNameIsRejectedAndFirstEntryKept() {
        Scheduler first = proxy("reporting");
        directory.register("reporting", first);

        ObjectAlreadyExistsException e = assertThrows(ObjectAlreadyExistsException.class,
                () -> directory.register("reporting", proxy("reporting")));

        assertTrue(e.getMessage().contains("reporting"));
        assertSame(first, directory.lookup("reporting").orElseThrow());
    }

    @Test
    void removeReportsWhetherAnEntryExisted() {
        directory.register("reporting", proxy("reporting"));

        assertTrue(directory.remove("reporting"));
        assertFalse(directory.remove("reporting"));
        assertTrue(directory.names().isEmpty());
    }

    @Test
    void conditionalRemoveOnlyRemovesTheNamedInstance() {
        Scheduler current = proxy("reporting");
        directory.register("reporting", current);

        assertFalse(directory.remove("reporting", proxy("reporting")));
        assertSame(current, directory.lookup("reporting").orElseThrow());

        assertTrue(directory.remove("reporting", current));
        assertTrue(directory.lookup("reporting").isEmpty());
    }

    @Test
    void namesIsASnapshot() {
        directory.register("reporting", proxy("reporting"));
        Set<String> names = directory.names();

        directory.register("billing", proxy("billing"));

        assertEquals(Set.of("reporting"), names);
        assertThrows(UnsupportedOperationException.class, () -> names.add("x"));
    }
}
