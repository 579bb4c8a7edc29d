package fr.lapetina.aperture.domain.model;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadLocalRandom;

/**
 * A backend endpoint eligible for placement in an aperture.
 *
 * Wraps a {@link ConnectionFactory} and carries a token: a uniformly random
 * integer fixed for the lifetime of the node. The token is the sort key of
 * the random aperture, so a node keeps its position across rebuilds while
 * different processes order the same pool differently.
 *
 * Immutable. Equality is identity: the resolver reuses node instances across
 * rebuilds, and a new instance for the same address gets a new token.
 */
public final class ApertureNode {
    private final ConnectionFactory factory;
    private final int token;

    private ApertureNode(Builder builder) {
        this.factory = Objects.requireNonNull(builder.factory, "Connection factory is required");
        this.token = builder.token != null ? builder.token : ThreadLocalRandom.current().nextInt();
    }

    public ConnectionFactory factory() {
        return factory;
    }

    public int token() {
        return token;
    }

    public String address() {
        return factory.address();
    }

    public NodeStatus status() {
        return factory.status();
    }

    public int load() {
        return factory.load();
    }

    /**
     * Creates a synthetic node that is always CLOSED and whose connection
     * attempts always fail with {@code cause}.
     */
    public static ApertureNode failing(Throwable cause) {
        return builder()
                .factory(new FailingConnectionFactory(cause))
                .token(0)
                .build();
    }

    @Override
    public String toString() {
        return "ApertureNode{" +
                "address='" + factory.address() + '\'' +
                ", token=" + token +
                ", status=" + factory.status() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ConnectionFactory factory;
        private Integer token;

        public Builder factory(ConnectionFactory factory) {
            this.factory = factory;
            return this;
        }

        /**
         * Fixes the token instead of drawing a random one. Intended for tests
         * and for restoring a node's position.
         */
        public Builder token(int token) {
            this.token = token;
            return this;
        }

        public ApertureNode build() {
            return new ApertureNode(this);
        }
    }

    private static final class FailingConnectionFactory implements ConnectionFactory {
        private final Throwable cause;

        private FailingConnectionFactory(Throwable cause) {
            this.cause = Objects.requireNonNull(cause, "cause");
        }

        @Override
        public String address() {
            return "failing";
        }

        @Override
        public NodeStatus status() {
            return NodeStatus.CLOSED;
        }

        @Override
        public CompletableFuture<Void> connect() {
            return CompletableFuture.failedFuture(cause);
        }
    }
}
