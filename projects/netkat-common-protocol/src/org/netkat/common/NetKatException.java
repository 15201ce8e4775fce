package org.netkat.common;

/**
 * Root of the unchecked exceptions thrown while compiling or solving a
 * verification query. Failures of the solver itself and of the environment
 * (settings, reproduction files) are reported with this class directly.
 */
public class NetKatException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public NetKatException(String msg) {
        super(msg);
    }

    public NetKatException(String msg, Throwable cause) {
        super(msg, cause);
    }

}
