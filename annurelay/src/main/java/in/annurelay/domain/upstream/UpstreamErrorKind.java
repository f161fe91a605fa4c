package in.annurelay.domain.upstream;

/**
 * Why a correlated request produced no reply.
 */
public enum UpstreamErrorKind {
    /** The message could not be written to the upstream socket. */
    TRANSPORT,
    /** No reply with the request's tag arrived before the deadline. */
    TIMEOUT,
    /** Another request with the same tag is still awaiting its reply. */
    DUPLICATE_TAG,
    /** The waiting thread was interrupted. */
    INTERRUPTED
}
