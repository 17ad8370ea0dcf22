package com.questrail.scheduler.remote.transport;

/**
 * RemoteEndpointFactory
 * -----------------------------------------------------------------------------
 * Creates a fresh handle to the remote scheduler engine.
 *
 * <p>The proxy calls {@link #create()} on first use and again after every
 * transport failure. Two threads observing an empty handle at the same time
 * may both call it, and the last result wins. Implementations must therefore
 * be idempotent and cheap enough that a duplicate call is harmless: a name
 * lookup is fine, opening a session that must be closed is not.</p>
 */
@FunctionalInterface
public interface RemoteEndpointFactory
{
    /**
     * @return a handle to the remote engine, never {@code null}
     * @throws Exception if no handle can be produced (name unresolvable, registry down, ...)
     */
    RemoteSchedulerEndpoint create() throws Exception;
}
