package com.questrail.scheduler.remote.internal;

import com.questrail.scheduler.remote.transport.RemoteSchedulerEndpoint;

import java.rmi.RemoteException;

/**
 * One invocation of a {@link RemoteSchedulerEndpoint} operation that produces a value.
 */
@FunctionalInterface
public interface RemoteCall<T>
{
    T apply(RemoteSchedulerEndpoint endpoint) throws RemoteException;
}
