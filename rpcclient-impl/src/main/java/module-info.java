/**
 * RPC client implementation module.
 *
 * <p>Provides the default implementation of the RPC client API.</p>
 */
module rpcclient.impl
{
    requires rpcclient.api;
    requires org.slf4j;

    // Export factory implementations for external use
    exports org.abstractica.rpcclient.impl.client;
    exports org.abstractica.rpcclient.impl.session;
    exports org.abstractica.rpcclient.impl.loop;

    // Export message shapes and the loopback transport for transport implementers and tests
    exports org.abstractica.rpcclient.impl.protocol;
    exports org.abstractica.rpcclient.impl.transport;
    exports org.abstractica.rpcclient.impl.future;
}
