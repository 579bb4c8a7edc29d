package fr.lapetina.aperture.infrastructure.net;

import com.google.common.net.HostAndPort;
import fr.lapetina.aperture.domain.model.ConnectionFactory;
import fr.lapetina.aperture.domain.model.NodeStatus;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link ConnectionFactory} for a plain TCP endpoint.
 *
 * {@link #connect()} opens and closes a socket on the given executor; it is
 * used both to pre-warm nodes entering the window and to probe health. Status
 * is set by the health checker, load by the dispatch loop through
 * {@link #acquire()} / {@link #release()}.
 *
 * Thread-safe via atomic operations.
 */
public final class SocketConnectionFactory implements ConnectionFactory {

    private final String address;
    private final HostAndPort hostAndPort;
    private final Duration connectTimeout;
    private final Executor executor;

    // Mutable state - thread-safe
    private final AtomicReference<NodeStatus> status = new AtomicReference<>(NodeStatus.OPEN);
    private final AtomicInteger outstanding = new AtomicInteger(0);
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);

    public SocketConnectionFactory(String address, Duration connectTimeout, Executor executor) {
        this.hostAndPort = HostAndPort.fromString(address);
        if (!hostAndPort.hasPort()) {
            throw new IllegalArgumentException("Address must be host:port, got " + address);
        }
        this.address = address;
        this.connectTimeout = connectTimeout;
        this.executor = executor;
    }

    @Override
    public String address() {
        return address;
    }

    @Override
    public NodeStatus status() {
        return status.get();
    }

    /**
     * Sets the status and returns the previous one.
     */
    public NodeStatus setStatus(NodeStatus newStatus) {
        return status.getAndSet(newStatus);
    }

    @Override
    public int load() {
        return outstanding.get();
    }

    /**
     * Marks a request as dispatched to this node.
     */
    public void acquire() {
        outstanding.incrementAndGet();
    }

    /**
     * Marks a request to this node as finished.
     */
    public void release() {
        outstanding.decrementAndGet();
    }

    public int recordFailure() {
        return consecutiveFailures.incrementAndGet();
    }

    public void recordSuccess() {
        consecutiveFailures.set(0);
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    @Override
    public CompletableFuture<Void> connect() {
        return CompletableFuture.runAsync(() -> {
            try (Socket socket = new Socket()) {
                socket.connect(
                        new InetSocketAddress(hostAndPort.getHost(), hostAndPort.getPort()),
                        (int) connectTimeout.toMillis());
            } catch (IOException e) {
                throw new UncheckedIOException("Connection to " + address + " failed", e);
            }
        }, executor);
    }

    @Override
    public String toString() {
        return "SocketConnectionFactory{" +
                "address='" + address + '\'' +
                ", status=" + status.get() +
                ", outstanding=" + outstanding.get() +
                '}';
    }
}
