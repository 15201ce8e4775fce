package org.netkat.smt;


import com.microsoft.z3.Context;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import com.microsoft.z3.Tactic;
import com.microsoft.z3.Z3Exception;
import org.netkat.common.NetKatException;
import org.netkat.common.VerifierSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;

/**
 * Solves programs with Z3. Each call loads the program text into a solver
 * of a fresh Z3 context, which is closed before returning.
 */
public class Z3SolverBackend implements SolverBackend {

    private static final Logger LOGGER = LoggerFactory.getLogger(Z3SolverBackend.class);

    private final VerifierSettings _settings;

    public Z3SolverBackend(VerifierSettings settings) {
        _settings = settings;
    }

    @Override
    public boolean isSatisfiable(SmtProgram program) {
        HashMap<String, String> cfg = new HashMap<>();

        // allows for unsat core when debugging
        if (_settings.getDebugSolver()) {
            cfg.put("proof", "true");
            cfg.put("auto-config", "false");
        }

        try (Context ctx = new Context(cfg)) {
            Solver solver = mkSolver(ctx);
            solver.fromString(program.serialize(false));
            long start = System.currentTimeMillis();
            Status status = solver.check();
            long time = System.currentTimeMillis() - start;
            LOGGER.debug("Solved {} in {} ms: {}", program.getName(), time, status);
            if (status == Status.UNKNOWN) {
                throw new NetKatException("ERROR: satisfiability unknown for " + program.getName()
                        + ": " + solver.getReasonUnknown());
            }
            return status == Status.SATISFIABLE;
        } catch (Z3Exception e) {
            throw new NetKatException("Z3 failed on " + program.getName(), e);
        }
    }

    private Solver mkSolver(Context ctx) {
        List<String> tactics = _settings.getTactics();
        if (tactics.isEmpty()) {
            return ctx.mkSolver();
        }
        Tactic t = ctx.mkTactic(tactics.get(0));
        for (int i = 1; i < tactics.size(); i++) {
            t = ctx.then(t, ctx.mkTactic(tactics.get(i)));
        }
        return ctx.mkSolver(t);
    }
}
