package org.netkat.common;

/**
 * Thrown when a policy program is not in the normal form accepted by the
 * compiler, e.g. an iteration that is not of the form <code>(p;t)*</code>,
 * a probabilistic choice, or a raw link primitive.
 */
public class PolicyShapeException extends NetKatException {

    private static final long serialVersionUID = 1L;

    private final String _constructor;

    public PolicyShapeException(String constructor, String msg) {
        super(msg + ": " + constructor);
        _constructor = constructor;
    }

    public String getConstructor() {
        return _constructor;
    }

}
