package org.netkat.smt;

/**
 * Decides the satisfiability of a program.
 */
public interface SolverBackend {

    /**
     * @return true if the program's assertions are satisfiable
     * @throws org.netkat.common.NetKatException if the solver fails or cannot decide
     */
    boolean isSatisfiable(SmtProgram program);

}
