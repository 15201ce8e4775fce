package org.netkat.datamodel.policy;

/**
 * <p>A packet forwarding policy. A policy maps an input packet to the set of
 * packets it produces: filters keep or drop the packet, modifications
 * rewrite one header field, and policies are combined in parallel
 * ({@link Union}) or in sequence ({@link Sequence}).</p>
 *
 * <p>Programs checked for reachability have the shape
 * <code>(p;t)*</code>, where <code>p</code> is the switch policy and
 * <code>t</code> the topology, usually written with {@link Link}s.</p>
 */
public abstract class Policy {

    /**
     * Short description of the constructor, used in error messages.
     */
    public abstract String constructorName();

    @Override
    public abstract boolean equals(Object o);

    @Override
    public abstract int hashCode();

}
