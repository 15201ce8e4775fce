package org.netkat.common;

/**
 * Thrown when a node, port or path cannot be found in a topology.
 */
public class TopologyLookupException extends NetKatException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        NODE_NOT_FOUND,
        NO_PATH
    }

    private final Kind _kind;

    public TopologyLookupException(Kind kind, String msg) {
        super(msg);
        _kind = kind;
    }

    public Kind getKind() {
        return _kind;
    }

}
