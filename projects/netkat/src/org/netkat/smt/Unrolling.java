package org.netkat.smt;


import org.netkat.smt.logic.Formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The result of unrolling <code>(p;t)*</code> up to a hop bound: the
 * formula relating the input packet to the packet reached at each depth,
 * and the frontier of reached packets ordered by depth.
 */
public class Unrolling {

    private final Formula _formula;

    private final List<SymbolicPacket> _frontier;

    public Unrolling(Formula formula, List<SymbolicPacket> frontier) {
        _formula = formula;
        _frontier = Collections.unmodifiableList(new ArrayList<>(frontier));
    }

    public Formula getFormula() {
        return _formula;
    }

    /**
     * The packet reached after exactly <code>d</code> hops is at index <code>d</code>.
     */
    public List<SymbolicPacket> getFrontier() {
        return _frontier;
    }

    public int getHopBound() {
        return _frontier.size() - 1;
    }
}
