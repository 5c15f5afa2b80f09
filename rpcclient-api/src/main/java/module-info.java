/**
 * RPC client API module.
 *
 * <p>Provides interfaces for issuing request/response and notification calls
 * over a single persistent transport connection, correlated by message id.</p>
 */
module rpcclient.api
{
    requires org.slf4j;

    exports org.abstractica.rpcclient;
    exports org.abstractica.rpcclient.handlers;
}
