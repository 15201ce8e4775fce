package org.netkat.smt;


import org.netkat.smt.logic.Formula;

/**
 * The relation computed by a policy: a formula relating the input packet to
 * the output packet variable.
 */
public class CompiledPolicy {

    private final Formula _formula;

    private final SymbolicPacket _output;

    public CompiledPolicy(Formula formula, SymbolicPacket output) {
        _formula = formula;
        _output = output;
    }

    public Formula getFormula() {
        return _formula;
    }

    public SymbolicPacket getOutput() {
        return _output;
    }
}
