package com.shading.sgc.api;

/**
 * Decides whether an input pin accepts a producer of a given kind.
 *
 * Checked by the graph when the host connects two pins, and again by the
 * compiler against the producer's resolved kind (a polymorphic producer can
 * change kind after it was connected).
 */
@FunctionalInterface
public interface ConnectionFilter {

    /** Accepts only producers whose kind equals the input's own kind. */
    ConnectionFilter SAME_KIND = (producerKind, inputKind) -> producerKind == inputKind;

    /** Accepts every producer kind. Used by the polymorphic arithmetic node. */
    ConnectionFilter ANY = (producerKind, inputKind) -> true;

    /**
     * @param producerKind kind reported by the upstream output pin.
     * @param inputKind    declared kind of the input pin.
     * @return true if the connection is allowed.
     */
    boolean accepts(ValueKind producerKind, ValueKind inputKind);
}
