package com.questrail.scheduler.remote.transport.rmi;

import com.questrail.scheduler.remote.config.RemoteSchedulerConfig;
import com.questrail.scheduler.remote.transport.RemoteEndpointFactory;
import com.questrail.scheduler.remote.transport.RemoteSchedulerEndpoint;

import java.rmi.NotBoundException;
import java.rmi.Remote;
import java.rmi.RemoteException;
import java.rmi.registry.LocateRegistry;
import java.rmi.registry.Registry;
import java.util.Objects;

/**
 * RmiEndpointFactory
 * =============================================================================
 * {@link RemoteEndpointFactory} that resolves the engine's stub from a Java RMI
 * registry.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure lookup adapter</strong>. It MUST NOT:
 * <ul>
 *   <li>Cache the resolved stub (the proxy's handle does that)</li>
 *   <li>Retry a failed lookup</li>
 *   <li>Interpret scheduler semantics</li>
 * </ul>
 *
 * <p>Each call performs one registry lookup, which is idempotent and cheap, so
 * duplicate calls on concurrent first use are harmless.</p>
 */
public final class RmiEndpointFactory implements RemoteEndpointFactory
{
    private final String registryHost;
    private final int registryPort;
    private final String bindName;

    public RmiEndpointFactory(String registryHost, int registryPort, String bindName)
    {
        this.registryHost = Objects.requireNonNull(registryHost, "registryHost");
        this.bindName = Objects.requireNonNull(bindName, "bindName");
        if (registryPort <= 0 || registryPort > 65535) {
            throw new IllegalArgumentException("registryPort must be in range 1-65535 (was " + registryPort + ")");
        }
        this.registryPort = registryPort;
    }

    public static RmiEndpointFactory fromConfig(RemoteSchedulerConfig config)
    {
        Objects.requireNonNull(config, "config");
        return new RmiEndpointFactory(config.registryHost(), config.registryPort(), config.bindName());
    }

    @Override
    public RemoteSchedulerEndpoint create() throws RemoteException, NotBoundException
    {
        Registry registry = LocateRegistry.getRegistry(registryHost, registryPort);
        Remote stub = registry.lookup(bindName);

        if (!(stub instanceof RemoteSchedulerEndpoint endpoint)) {
            throw new RemoteException("Object bound as '" + bindName + "' at "
                    + registryHost + ":" + registryPort + " is not a scheduler endpoint: "
                    + stub.getClass().getName());
        }
        return endpoint;
    }

    public String registryHost()
    {
        return registryHost;
    }

    public int registryPort()
    {
        return registryPort;
    }

    public String bindName()
    {
        return bindName;
    }

    @Override
    public String toString()
    {
        return "RmiEndpointFactory[" + registryHost + ":" + registryPort + "/" + bindName + "]";
    }
}
