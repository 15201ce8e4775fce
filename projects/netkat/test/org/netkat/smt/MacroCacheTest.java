package org.netkat.smt;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.sameInstance;

import java.util.Collections;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.Test;
import org.netkat.datamodel.Field;
import org.netkat.smt.MacroKey.Family;
import org.netkat.smt.logic.BoolConst;
import org.netkat.smt.logic.Macro;

public class MacroCacheTest {

  private static Macro constant(String name) {
    return new Macro(name, Collections.emptyList(), BoolConst.TRUE);
  }

  @Test
  public void testBuilderRunsOnce() {
    MacroCache cache = new MacroCache();
    MacroKey key = new MacroKey(Family.FIELD_EQUALS, Field.VLAN);
    AtomicInteger calls = new AtomicInteger();
    Macro first =
        cache.getOrCreate(
            key,
            () -> {
              calls.incrementAndGet();
              return constant("m");
            });
    Macro second =
        cache.getOrCreate(
            key,
            () -> {
              calls.incrementAndGet();
              return constant("other");
            });
    assertThat(second, sameInstance(first));
    assertThat(calls.get(), equalTo(1));
  }

  @Test
  public void testNestedBuildersRecordedInCompletionOrder() {
    MacroCache cache = new MacroCache();
    MacroKey outer = new MacroKey(Family.MODIFY, Field.SWITCH);
    MacroKey inner = new MacroKey(Family.FIELD_EQUALS, Field.SWITCH);
    cache.getOrCreate(
        outer,
        () -> {
          cache.getOrCreate(inner, () -> constant("inner"));
          return constant("outer");
        });
    assertThat(cache.getDefinitions().get(0).getName(), equalTo("inner"));
    assertThat(cache.getDefinitions().get(1).getName(), equalTo("outer"));
  }

  @Test(expected = IllegalStateException.class)
  public void testSelfReferenceRejected() {
    MacroCache cache = new MacroCache();
    MacroKey key = new MacroKey(Family.MODIFY, Field.SWITCH);
    cache.getOrCreate(
        key,
        () -> {
          cache.getOrCreate(key, () -> constant("inner"));
          return constant("outer");
        });
  }

  @Test
  public void testContextsDoNotShareMacros() {
    VerificationContext first = new VerificationContext();
    VerificationContext second = new VerificationContext();
    first.getMacros().fieldEquals(Field.VLAN);
    assertThat(first.getMacroCache().size(), equalTo(1));
    assertThat(second.getMacroCache().size(), equalTo(0));
  }
}
