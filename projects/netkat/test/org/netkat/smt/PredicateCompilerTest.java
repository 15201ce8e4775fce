package org.netkat.smt;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.netkat.datamodel.pred.Predicates.and;
import static org.netkat.datamodel.pred.Predicates.not;
import static org.netkat.datamodel.pred.Predicates.or;
import static org.netkat.datamodel.pred.Predicates.test;

import org.junit.Before;
import org.junit.Test;
import org.netkat.datamodel.Field;
import org.netkat.datamodel.pred.PacketPredicate;
import org.netkat.datamodel.pred.Predicates;
import org.netkat.smt.MacroKey.Family;

public class PredicateCompilerTest {

  private static final PacketPredicate VLAN_5 = test(Field.VLAN, 5);

  private static final PacketPredicate SWITCH_1 = test(Field.SWITCH, 1);

  private VerificationContext _ctx;

  private PredicateCompiler _compiler;

  private SymbolicPacket _x;

  @Before
  public void setup() {
    _ctx = new VerificationContext();
    _compiler = new PredicateCompiler(_ctx);
    _x = _ctx.freshPacket();
  }

  private String compile(PacketPredicate pred) {
    return _compiler.compile(pred, _x).toString();
  }

  @Test
  public void testConstants() {
    assertThat(compile(Predicates.TRUE), equalTo("true"));
    assertThat(compile(not(Predicates.TRUE)), equalTo("false"));
  }

  @Test
  public void testFieldTest() {
    assertThat(compile(VLAN_5), equalTo("(Vlan-equals gensym0 5)"));
    assertThat(compile(test(Field.VLAN, -3)), equalTo("(Vlan-equals gensym0 (- 3))"));
  }

  @Test
  public void testNegatedTestUsesNotEqualsMacro() {
    assertThat(compile(not(VLAN_5)), equalTo("(Vlan-not-equals gensym0 5)"));
    assertThat(_ctx.getMacroCache().count(Family.FIELD_EQUALS), equalTo(0));
    assertThat(_ctx.getMacroCache().count(Family.FIELD_NOT_EQUALS), equalTo(1));
  }

  @Test
  public void testNegatedConjunction() {
    assertThat(
        compile(not(and(VLAN_5, SWITCH_1))),
        equalTo("(or (Vlan-not-equals gensym0 5) (Switch-not-equals gensym0 1))"));
  }

  @Test
  public void testNegatedDisjunction() {
    assertThat(
        compile(not(or(VLAN_5, SWITCH_1))),
        equalTo("(and (Vlan-not-equals gensym0 5) (Switch-not-equals gensym0 1))"));
  }

  @Test
  public void testDoubleNegation() {
    assertThat(compile(not(not(VLAN_5))), equalTo("(Vlan-equals gensym0 5)"));
    assertThat(
        compile(not(and(not(VLAN_5), SWITCH_1))),
        equalTo("(or (Vlan-equals gensym0 5) (Switch-not-equals gensym0 1))"));
  }

  @Test
  public void testPositiveJunctions() {
    assertThat(
        compile(and(Predicates.TRUE, or(VLAN_5, SWITCH_1))),
        equalTo("(and true (or (Vlan-equals gensym0 5) (Switch-equals gensym0 1)))"));
  }

  @Test
  public void testOneEqualityMacroPerField() {
    compile(VLAN_5);
    compile(test(Field.VLAN, 6));
    compile(and(SWITCH_1, VLAN_5));
    assertThat(_ctx.getMacroCache().count(Family.FIELD_EQUALS), equalTo(2));
    assertThat(_ctx.getMacroCache().size(), equalTo(2));
  }
}
