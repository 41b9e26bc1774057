package org.studyhub.studyindex.model;

/**
 * Lifecycle of the vector store connection.
 *
 * <pre>
 * DISCONNECTED -> CONNECTING -> CONNECTED -> DEGRADED -> CONNECTING ...
 * </pre>
 */
public enum ConnectionState {

    /** No successful heartbeat yet, or the retry budget ran out. */
    DISCONNECTED,

    /** A heartbeat is in flight. */
    CONNECTING,

    /** Last heartbeat succeeded. */
    CONNECTED,

    /** A round trip failed at the transport level since the last heartbeat. */
    DEGRADED
}
