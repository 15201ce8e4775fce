package org.netkat.smt;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.Assert.fail;
import static org.netkat.datamodel.policy.Policies.filter;
import static org.netkat.datamodel.policy.Policies.modify;
import static org.netkat.datamodel.policy.Policies.seq;
import static org.netkat.datamodel.policy.Policies.union;

import org.junit.Before;
import org.junit.Test;
import org.netkat.common.PolicyShapeException;
import org.netkat.datamodel.Field;
import org.netkat.datamodel.policy.Choice;
import org.netkat.datamodel.policy.Policies;
import org.netkat.datamodel.policy.Policy;
import org.netkat.datamodel.pred.Predicates;

public class PolicyCompilerTest {

  private VerificationContext _ctx;

  private PolicyCompiler _compiler;

  private SymbolicPacket _x;

  @Before
  public void setup() {
    _ctx = new VerificationContext();
    _compiler = new PolicyCompiler(_ctx);
    _x = _ctx.freshPacket();
  }

  @Test
  public void testFilterKeepsPacket() {
    CompiledPolicy c = _compiler.compile(filter(Predicates.test(Field.VLAN, 1)), _x);
    assertThat(c.getOutput(), equalTo(_x));
    assertThat(c.getFormula().toString(), equalTo("(Vlan-equals gensym0 1)"));
  }

  @Test
  public void testModificationAllocatesPacket() {
    CompiledPolicy c = _compiler.compile(modify(Field.VLAN, 2), _x);
    assertThat(c.getOutput().getName(), equalTo("gensym1"));
    assertThat(c.getFormula().toString(), equalTo("(mod_Vlan gensym0 gensym1 2)"));
    assertThat(_ctx.getPackets().size(), equalTo(2));
  }

  @Test
  public void testUnionUnifiesOutputs() {
    CompiledPolicy c = _compiler.compile(union(modify(Field.VLAN, 1), modify(Field.VLAN, 2)), _x);
    assertThat(c.getOutput().getName(), equalTo("gensym1"));
    assertThat(
        c.getFormula().toString(),
        equalTo(
            "(and (or (mod_Vlan gensym0 gensym1 1) (mod_Vlan gensym0 gensym2 2)) "
                + "(= gensym1 gensym2))"));
  }

  @Test
  public void testSequenceThreadsOutput() {
    Policy p = seq(modify(Field.VLAN, 1), filter(Predicates.test(Field.SWITCH, 3)));
    CompiledPolicy c = _compiler.compile(p, _x);
    assertThat(c.getOutput().getName(), equalTo("gensym1"));
    assertThat(
        c.getFormula().toString(),
        equalTo("(and (mod_Vlan gensym0 gensym1 1) (Switch-equals gensym1 3))"));
  }

  private void assertRejected(Policy p, String constructor) {
    try {
      _compiler.compile(p, _x);
      fail("expected " + constructor + " to be rejected");
    } catch (PolicyShapeException e) {
      assertThat(e.getConstructor(), equalTo(constructor));
      assertThat(e.getMessage(), equalTo("Policy not in accepted normal form: " + constructor));
    }
  }

  @Test
  public void testShapeErrors() {
    assertRejected(Policies.star(Policies.ID), "iteration");
    assertRejected(new Choice(Policies.ID, 0.5, Policies.DROP), "probabilistic choice");
    assertRejected(Policies.link(1, 2, 3, 4), "link 1@2 => 3@4");
  }

  @Test
  public void testNestedShapeError() {
    assertRejected(seq(Policies.ID, union(Policies.DROP, Policies.star(Policies.ID))), "iteration");
  }
}
