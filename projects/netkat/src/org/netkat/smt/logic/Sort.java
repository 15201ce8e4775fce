package org.netkat.smt.logic;

/**
 * The solver sorts used by the encoding.
 */
public enum Sort {
    PACKET("Packet"),
    INT("Int"),
    BOOL("Bool");

    private final String _smtName;

    Sort(String smtName) {
        _smtName = smtName;
    }

    public String smtName() {
        return _smtName;
    }
}
