/**
 * Remote Scheduler Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>mechanism-agnostic boundary</em> between a
 * concrete remoting technology (RMI, an RPC stub, an in-process simulator or a
 * test double) and the guarded proxy in {@code com.questrail.scheduler.remote}.
 *
 * <h2>Why these ports exist</h2>
 * The proxy's value lies in how it acquires, caches and discards its handle and
 * how it classifies failures. None of that depends on how bytes move. These
 * ports keep every remoting library out of the proxy core: everything above
 * them sees only
 * <ul>
 *   <li>scheduler API value types</li>
 *   <li>{@link java.rmi.RemoteException} for a failure in transit</li>
 *   <li>{@link com.questrail.scheduler.api.SchedulerException} for a rejection by the engine</li>
 * </ul>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Report transport failures as {@code RemoteException}, never as {@code SchedulerException}</li>
 *   <li>Not retry, reconnect, or cache on their own</li>
 *   <li>Not translate engine rejections into transport failures</li>
 * </ul>
 */
package com.questrail.scheduler.remote.transport;
