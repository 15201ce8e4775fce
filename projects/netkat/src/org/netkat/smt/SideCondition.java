package org.netkat.smt;


import org.netkat.smt.logic.Formula;

/**
 * An extra constraint a reached packet must satisfy, in addition to the
 * exit predicate, for a reachability query to hold.
 */
public interface SideCondition {

    Formula encode(SymbolicPacket pkt, VerificationContext ctx);

}
