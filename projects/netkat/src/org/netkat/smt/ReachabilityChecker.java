package org.netkat.smt;


import org.netkat.common.NetKatException;
import org.netkat.common.PolicyShapeException;
import org.netkat.common.TopologyLookupException;
import org.netkat.common.VerifierSettings;
import org.netkat.datamodel.policy.Policy;
import org.netkat.datamodel.pred.PacketPredicate;
import org.netkat.smt.logic.And;
import org.netkat.smt.logic.Formula;
import org.netkat.smt.logic.Or;
import org.netkat.smt.utils.LinkElimination;
import org.netkat.smt.utils.TopologyExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * <p>Checks bounded reachability of <code>(p;t)*</code> programs against an
 * expected verdict.</p>
 *
 * <p>A query asks whether a packet satisfying the entry predicate can be
 * transformed, in at most <code>k</code> hops, into a packet satisfying the
 * exit predicate. The query is satisfiable when it can. When the verdict
 * disagrees with the oracle, the full program is written to a
 * <code>debug-N.smt2</code> file for reproduction.</p>
 *
 * <p>Each check compiles into its own {@link VerificationContext}, so a
 * checker can be shared between threads.</p>
 */
public class ReachabilityChecker {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReachabilityChecker.class);

    private static final AtomicInteger DEBUG_FILE_COUNTER = new AtomicInteger();

    private final VerifierSettings _settings;

    private final SolverBackend _solver;

    public ReachabilityChecker() {
        this(VerifierSettings.fromClasspath());
    }

    public ReachabilityChecker(VerifierSettings settings) {
        this(settings, new Z3SolverBackend(settings));
    }

    public ReachabilityChecker(VerifierSettings settings, SolverBackend solver) {
        _settings = settings;
        _solver = solver;
    }

    /**
     * Check reachability within the hop bound of the program's own topology:
     * the longest shortest path between the switches its links connect.
     * Only {@link org.netkat.datamodel.policy.Link} primitives count: a
     * topology hop written with filters and modifications contributes no
     * links, and the bound is 0. Use {@link #checkReachabilityK} for such
     * programs.
     *
     * @return whether the verdict matches <code>expected</code>, or the
     * verdict itself when <code>expected</code> is null
     */
    public boolean checkReachability(String name, PacketPredicate entry, Policy program,
            PacketPredicate exit, Boolean expected) throws PolicyShapeException,
            TopologyLookupException {
        return computeReachability(name, entry, program, exit, expected).getPassed();
    }

    /**
     * Check reachability within <code>k</code> hops.
     *
     * @return whether the verdict matches <code>expected</code>, or the
     * verdict itself when <code>expected</code> is null
     */
    public boolean checkReachabilityK(int k, String name, PacketPredicate entry, Policy program,
            PacketPredicate exit, List<SideCondition> sideConditions, Boolean expected) throws
            PolicyShapeException {
        return computeReachabilityK(k, name, entry, program, exit, sideConditions, expected)
                .getPassed();
    }

    public VerificationResult computeReachability(String name, PacketPredicate entry, Policy
            program, PacketPredicate exit, Boolean expected) throws PolicyShapeException,
            TopologyLookupException {
        int k = TopologyExtractor.fromPolicy(program).longestShortestPath();
        LOGGER.debug("Hop bound of {} from its links: {}", name, k);
        return computeReachabilityK(k, name, entry, program, exit, Collections.emptyList(),
                expected);
    }

    public VerificationResult computeReachabilityK(int k, String name, PacketPredicate entry,
            Policy program, PacketPredicate exit, List<SideCondition> sideConditions, Boolean
            expected) throws PolicyShapeException {
        VerificationContext ctx = new VerificationContext(_settings.getAnnotate());
        SmtProgram prog = buildQuery(ctx, k, name, entry, program, exit, sideConditions);
        LOGGER.debug("Query {}: {} variables, {} macros, {} assertions", name, prog
                .getNumVariables(), prog.getNumMacros(), prog.getNumAssertions());

        long start = System.currentTimeMillis();
        boolean sat = _solver.isSatisfiable(prog);
        long time = System.currentTimeMillis() - start;
        VerificationStats stats = new VerificationStats(prog.getNumVariables(), prog
                .getNumMacros(), prog.getNumAssertions(), time);

        String file = null;
        if (expected == null) {
            LOGGER.info("[Verify.check {}: {}]", name, sat);
        } else if (expected == sat) {
            LOGGER.info("[Verify.check {}: {} as expected]", name, sat);
        } else {
            LOGGER.warn("[Verify.check {}: expected {} got {}]", name, expected, sat);
            Path debugFile = writeReproduction(prog);
            LOGGER.warn("Offending program is in {}", debugFile);
            file = debugFile.toString();
        }
        return new VerificationResult(name, sat, expected, k, file, stats);
    }

    /**
     * Assemble the query for a check without solving it.
     */
    public static SmtProgram buildQuery(VerificationContext ctx, int k, String name,
            PacketPredicate entry, Policy program, PacketPredicate exit, List<SideCondition>
            sideConditions) throws PolicyShapeException {
        PredicateCompiler predicates = new PredicateCompiler(ctx);
        SymbolicPacket x = ctx.freshPacket();
        Policy linkFree = LinkElimination.removeLinks(program);
        Formula entryFormula = predicates.compile(entry, x);
        Unrolling unrolling = new BoundedUnroller(ctx).unroll(linkFree, x, k);

        List<Formula> exits = new ArrayList<>();
        for (SymbolicPacket y : unrolling.getFrontier()) {
            List<Formula> conds = new ArrayList<>();
            conds.add(predicates.compile(exit, y));
            for (SideCondition c : sideConditions) {
                conds.add(c.encode(y, ctx));
            }
            exits.add(new And(conds));
        }

        StringBuilder choices = new StringBuilder("Reached packets by depth:");
        for (SymbolicPacket y : unrolling.getFrontier()) {
            choices.append(" ").append(y);
        }

        SmtProgram prog = new SmtProgram(name, ctx);
        prog.addAssertion(entryFormula);
        prog.addAssertion(unrolling.getFormula());
        prog.addComment(choices.toString());
        prog.addAssertion(new Or(exits));
        return prog;
    }

    /*
     * Files left by earlier runs in the same directory are never overwritten
     */
    private Path writeReproduction(SmtProgram prog) {
        Path dir = _settings.getDebugPath();
        byte[] text = prog.serialize(true).getBytes(StandardCharsets.UTF_8);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new NetKatException("Could not create debug directory " + dir, e);
        }
        while (true) {
            Path file = dir.resolve("debug-" + DEBUG_FILE_COUNTER.getAndIncrement() + ".smt2");
            try {
                Files.write(file, text, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                return file;
            } catch (FileAlreadyExistsException e) {
                LOGGER.debug("{} already exists, trying the next name", file);
            } catch (IOException e) {
                throw new NetKatException("Could not write offending program to " + file, e);
            }
        }
    }
}
