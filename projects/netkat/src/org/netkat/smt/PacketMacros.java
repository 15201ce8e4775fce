package org.netkat.smt;

import org.netkat.datamodel.Field;
import org.netkat.smt.MacroKey.Family;
import org.netkat.smt.logic.And;
import org.netkat.smt.logic.BoolConst;
import org.netkat.smt.logic.Eq;
import org.netkat.smt.logic.FieldAccess;
import org.netkat.smt.logic.Formula;
import org.netkat.smt.logic.Gt;
import org.netkat.smt.logic.Ite;
import org.netkat.smt.logic.Lt;
import org.netkat.smt.logic.Macro;
import org.netkat.smt.logic.Not;
import org.netkat.smt.logic.Or;
import org.netkat.smt.logic.Sort;
import org.netkat.smt.logic.Var;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * <p>The four macro families the compilers apply, each specialized to one
 * header field and memoized in a {@link MacroCache}:</p>
 *
 * <ul>
 *     <li><code>F-equals(x, v)</code>: false for the drop sentinel, otherwise <code>F(x) = v</code></li>
 *     <li><code>F-not-equals(x, v)</code>: true for the drop sentinel, otherwise
 *     <code>F(x) &lt; v or F(x) &gt; v</code></li>
 *     <li><code>packet_equals_except_F(x, y)</code>: both are the drop sentinel, or neither
 *     is and they agree on every field but F</li>
 *     <li><code>mod_F(x, y, v)</code>: y is x with F set to v</li>
 * </ul>
 */
public class PacketMacros {

    private static final Var X = new Var("x", Sort.PACKET);

    private static final Var Y = new Var("y", Sort.PACKET);

    private static final Var V = new Var("v", Sort.INT);

    private final MacroCache _cache;

    public PacketMacros(MacroCache cache) {
        _cache = cache;
    }

    public Macro fieldEquals(Field f) {
        return _cache.getOrCreate(new MacroKey(Family.FIELD_EQUALS, f), () -> {
            Formula body = new Ite(isNoPacket(X), BoolConst.FALSE,
                    new Eq(new FieldAccess(f, X), V));
            return new Macro(f.headerName() + "-equals", Arrays.asList(X, V), body);
        });
    }

    public Macro fieldNotEquals(Field f) {
        return _cache.getOrCreate(new MacroKey(Family.FIELD_NOT_EQUALS, f), () -> {
            FieldAccess x = new FieldAccess(f, X);
            Formula body = new Ite(isNoPacket(X), BoolConst.TRUE, new Or(new Lt(x, V), new Gt(x,
                    V)));
            return new Macro(f.headerName() + "-not-equals", Arrays.asList(X, V), body);
        });
    }

    public Macro packetEqualsExcept(Field except) {
        return _cache.getOrCreate(new MacroKey(Family.PACKET_EQUALS_EXCEPT, except), () -> {
            List<Formula> same = new ArrayList<>();
            same.add(new Not(isNoPacket(Y)));
            for (Field f : Field.values()) {
                if (f != except) {
                    same.add(new Eq(new FieldAccess(f, X), new FieldAccess(f, Y)));
                }
            }
            Formula body = new Ite(isNoPacket(X), isNoPacket(Y), new And(same));
            return new Macro("packet_equals_except_" + except.headerName(), Arrays.asList(X, Y),
                    body);
        });
    }

    public Macro modify(Field f) {
        return _cache.getOrCreate(new MacroKey(Family.MODIFY, f), () -> {
            Macro rest = packetEqualsExcept(f);
            Macro set = fieldEquals(f);
            Formula body = new And(rest.apply(X, Y), set.apply(Y, V));
            return new Macro("mod_" + f.headerName(), Arrays.asList(X, Y, V), body);
        });
    }

    private static Formula isNoPacket(Var p) {
        return new Eq(p, SymbolicPacket.NO_PACKET.getTerm());
    }
}
