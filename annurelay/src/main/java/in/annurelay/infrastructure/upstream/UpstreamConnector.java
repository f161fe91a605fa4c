package in.annurelay.infrastructure.upstream;

import java.net.URI;

/**
 * Opens sockets to the venue.
 */
public interface UpstreamConnector {
    UpstreamSocket open(URI uri) throws TransportException;
}
