package facet.java.api.types;

/**
 * Capability marker for dispatch types that may be called from several concurrent call sites.
 * Generated for asynchronous contracts whose interface carries default asynchronous methods, since
 * that shared logic runs behind the dispatch wrapper on whichever thread completes the future.
 */
public interface Shareable {}
