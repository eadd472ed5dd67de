package org.relay.net;

/**
 * Socket-level options for the listening socket.
 *
 * @param soBacklog   maximum queue length for incoming connection requests (SO_BACKLOG)
 * @param soKeepalive whether to enable TCP keepalive probes on accepted connections (SO_KEEPALIVE)
 */
public record SocketOptions(int soBacklog, boolean soKeepalive) {
    public static final int DEFAULT_BACKLOG = 128;

    public static SocketOptions socketOptions(int soBacklog, boolean soKeepalive) {
        return new SocketOptions(soBacklog, soKeepalive);
    }

    public static SocketOptions defaults() {
        return new SocketOptions(DEFAULT_BACKLOG, true);
    }

    public SocketOptions withBacklog(int soBacklog) {
        return new SocketOptions(soBacklog, soKeepalive);
    }

    public SocketOptions withKeepalive(boolean soKeepalive) {
        return new SocketOptions(soBacklog, soKeepalive);
    }
}
