package org.netkat.smt;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.emptyArray;
import static org.hamcrest.Matchers.endsWith;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.matchesPattern;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.netkat.datamodel.policy.Policies.link;
import static org.netkat.datamodel.policy.Policies.loop;
import static org.netkat.datamodel.policy.Policies.union;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.netkat.common.PolicyShapeException;
import org.netkat.common.VerifierSettings;
import org.netkat.datamodel.Field;
import org.netkat.datamodel.policy.Policies;
import org.netkat.datamodel.policy.Policy;
import org.netkat.datamodel.pred.PacketPredicate;
import org.netkat.datamodel.pred.Predicates;

public class ReachabilityCheckerTest {

  private static final PacketPredicate AT_S1 = Predicates.test(Field.SWITCH, 1);

  private static final PacketPredicate AT_S2 = Predicates.test(Field.SWITCH, 2);

  private static final Policy ID_LOOP = loop(Policies.ID, Policies.ID);

  @Rule public TemporaryFolder _folder = new TemporaryFolder();

  private VerifierSettings _settings;

  @Before
  public void setup() {
    _settings = new VerifierSettings().withDebugDirectory(_folder.getRoot().getPath());
  }

  private String[] debugFiles() {
    return _folder.getRoot().list();
  }

  @Test
  public void testMatchingOracle() {
    RecordingSolverBackend solver = new RecordingSolverBackend(true);
    ReachabilityChecker checker = new ReachabilityChecker(_settings, solver);
    VerificationResult res =
        checker.computeReachabilityK(
            1, "match", AT_S1, ID_LOOP, AT_S1, Collections.emptyList(), true);
    assertTrue(res.getPassed());
    assertTrue(res.getSatisfiable());
    assertThat(res.getReproductionFile(), nullValue());
    assertThat(res.getHopBound(), equalTo(1));
    assertThat(solver.getPrograms(), hasSize(1));
    assertThat(debugFiles(), emptyArray());
  }

  @Test
  public void testMismatchWritesProgram() throws IOException {
    RecordingSolverBackend solver = new RecordingSolverBackend(true);
    ReachabilityChecker checker = new ReachabilityChecker(_settings, solver);
    VerificationResult res =
        checker.computeReachabilityK(
            1, "mismatch", AT_S1, ID_LOOP, AT_S2, Collections.emptyList(), false);
    assertFalse(res.getPassed());

    Path file = Paths.get(res.getReproductionFile());
    assertThat(file.getParent(), equalTo(_folder.getRoot().toPath()));
    assertThat(file.getFileName().toString(), matchesPattern("debug-[0-9]+\\.smt2"));
    String text = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    assertThat(text, equalTo(solver.getPrograms().get(0).serialize(true)));
    assertThat(text, endsWith("(check-sat)\n"));
  }

  @Test
  public void testMismatchFilesAreNumberedApart() {
    ReachabilityChecker checker =
        new ReachabilityChecker(_settings, new RecordingSolverBackend(false));
    assertFalse(checker.checkReachabilityK(0, "a", AT_S1, ID_LOOP, AT_S1, Collections.emptyList(), true));
    assertFalse(checker.checkReachabilityK(0, "b", AT_S1, ID_LOOP, AT_S1, Collections.emptyList(), true));
    assertThat(debugFiles().length, equalTo(2));
  }

  @Test
  public void testMismatchKeepsEarlierFiles() throws IOException {
    byte[] earlier = "; EARLIER RUN\n".getBytes(StandardCharsets.UTF_8);
    int numEarlier = 200;
    for (int i = 0; i < numEarlier; i++) {
      Files.write(_folder.getRoot().toPath().resolve("debug-" + i + ".smt2"), earlier);
    }
    ReachabilityChecker checker =
        new ReachabilityChecker(_settings, new RecordingSolverBackend(false));
    VerificationResult res =
        checker.computeReachabilityK(
            0, "again", AT_S1, ID_LOOP, AT_S1, Collections.emptyList(), true);

    assertThat(debugFiles().length, equalTo(numEarlier + 1));
    for (int i = 0; i < numEarlier; i++) {
      Path old = _folder.getRoot().toPath().resolve("debug-" + i + ".smt2");
      assertThat(Files.readAllBytes(old), equalTo(earlier));
    }
    String text =
        new String(Files.readAllBytes(Paths.get(res.getReproductionFile())), StandardCharsets.UTF_8);
    assertThat(text, startsWith("; again\n"));
  }

  @Test
  public void testNoOracleReturnsVerdict() {
    ReachabilityChecker sat = new ReachabilityChecker(_settings, new RecordingSolverBackend(true));
    ReachabilityChecker unsat =
        new ReachabilityChecker(_settings, new RecordingSolverBackend(false));
    assertTrue(sat.checkReachabilityK(1, "sat", AT_S1, ID_LOOP, AT_S2, Collections.emptyList(), null));
    assertFalse(unsat.checkReachabilityK(1, "unsat", AT_S1, ID_LOOP, AT_S2, Collections.emptyList(), null));
    assertThat(debugFiles(), emptyArray());
  }

  @Test
  public void testQueryShape() {
    RecordingSolverBackend solver = new RecordingSolverBackend(true);
    ReachabilityChecker checker = new ReachabilityChecker(_settings, solver);
    checker.checkReachabilityK(
        2,
        "shape",
        AT_S1,
        ID_LOOP,
        AT_S2,
        Collections.singletonList(SideConditions.notDropped()),
        null);
    SmtProgram prog = solver.getPrograms().get(0);
    assertThat(prog.getName(), equalTo("shape"));
    assertThat(prog.getNumAssertions(), equalTo(3));
    assertThat(prog.getNumVariables(), equalTo(1));
    String text = prog.serialize(false);
    assertThat(text, containsString("(assert (Switch-equals gensym0 1))\n"));
    assertThat(text, containsString("; Reached packets by depth: gensym0 gensym0 gensym0\n"));
    assertThat(
        text,
        containsString(
            "(assert (or (and (Switch-equals gensym0 2) (not (= gensym0 nopacket))) "
                + "(and (Switch-equals gensym0 2) (not (= gensym0 nopacket))) "
                + "(and (Switch-equals gensym0 2) (not (= gensym0 nopacket)))))"));
  }

  @Test
  public void testEachCheckHasItsOwnContext() {
    RecordingSolverBackend solver = new RecordingSolverBackend(true);
    ReachabilityChecker checker = new ReachabilityChecker(_settings, solver);
    Policy program = loop(Policies.modify(Field.VLAN, 1), Policies.ID);
    checker.checkReachabilityK(1, "first", AT_S1, program, AT_S1, Collections.emptyList(), null);
    checker.checkReachabilityK(1, "second", AT_S1, program, AT_S1, Collections.emptyList(), null);
    String first = solver.getPrograms().get(0).serialize(false);
    String second = solver.getPrograms().get(1).serialize(false);
    assertThat(second.replace("second", "first"), equalTo(first));
    assertThat(second, not(containsString("gensym2")));
  }

  @Test
  public void testLinksEliminated() {
    RecordingSolverBackend solver = new RecordingSolverBackend(true);
    ReachabilityChecker checker = new ReachabilityChecker(_settings, solver);
    Policy program = loop(Policies.ID, link(1, 1, 2, 1));
    checker.checkReachabilityK(1, "links", AT_S1, program, AT_S2, Collections.emptyList(), true);
    String text = solver.getPrograms().get(0).serialize(false);
    assertThat(text, containsString("(define-fun mod_Switch "));
    assertThat(text, containsString("(define-fun mod_InPort "));
  }

  @Test
  public void testHopBoundFromLinks() {
    ReachabilityChecker checker =
        new ReachabilityChecker(_settings, new RecordingSolverBackend(true));
    Policy topo = union(link(1, 2, 2, 1), link(2, 2, 3, 1));
    VerificationResult res =
        checker.computeReachability("derived", AT_S1, loop(Policies.ID, topo), AT_S2, true);
    assertThat(res.getHopBound(), equalTo(2));
    assertTrue(checker.checkReachability("derived", AT_S1, loop(Policies.ID, topo), AT_S2, true));
  }

  @Test
  public void testHopBoundWithoutLinks() {
    ReachabilityChecker checker =
        new ReachabilityChecker(_settings, new RecordingSolverBackend(false));
    Policy hop =
        Policies.seq(
            Policies.filter(AT_S1), Policies.modify(Field.SWITCH, 2), Policies.modify(Field.IN_PORT, 1));
    VerificationResult res =
        checker.computeReachability("no links", AT_S1, loop(Policies.ID, hop), AT_S2, false);
    assertThat(res.getHopBound(), equalTo(0));
  }

  private static void assertRejected(ReachabilityChecker checker, Policy bad, String constructor) {
    try {
      checker.checkReachabilityK(1, "bad", AT_S1, bad, AT_S2, Collections.emptyList(), true);
      fail("expected " + bad + " to be rejected");
    } catch (PolicyShapeException e) {
      assertThat(e.getConstructor(), equalTo(constructor));
    }
  }

  @Test
  public void testShapeErrorBeforeSolving() {
    RecordingSolverBackend solver = new RecordingSolverBackend(true);
    ReachabilityChecker checker = new ReachabilityChecker(_settings, solver);
    assertRejected(checker, Policies.seq(Policies.ID, Policies.ID), "sequence");
    assertRejected(checker, Policies.star(Policies.ID), "iteration");
    assertRejected(checker, loop(Policies.star(Policies.ID), Policies.ID), "iteration");
    assertThat(solver.getPrograms(), hasSize(0));
    assertThat(debugFiles(), emptyArray());
  }
}
