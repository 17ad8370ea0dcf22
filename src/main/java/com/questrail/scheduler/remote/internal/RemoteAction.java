package com.questrail.scheduler.remote.internal;

import com.questrail.scheduler.remote.transport.RemoteSchedulerEndpoint;

import java.rmi.RemoteException;

/**
 * One invocation of a {@link RemoteSchedulerEndpoint} operation with no result.
 */
@FunctionalInterface
public interface RemoteAction
{
    void run(RemoteSchedulerEndpoint endpoint) throws RemoteException;

    default RemoteCall<Void> asCall() {
        return endpoint -> {
            run(endpoint);
            return null;
        };
    }
}
