package org.netkat.smt;

import org.netkat.smt.logic.Macro;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * <p>The macros defined so far in one verification run.</p>
 *
 * <p>A builder may request other macros while it runs, so definitions are
 * recorded in the order they complete: a macro always comes after the
 * macros its body applies.</p>
 */
public class MacroCache {

    private Map<MacroKey, Macro> _macros;

    private List<Macro> _definitions;

    public MacroCache() {
        _macros = new HashMap<>();
        _definitions = new ArrayList<>();
    }

    /**
     * Look up the macro for <code>key</code>, calling <code>builder</code>
     * to create it on the first request.
     */
    public Macro getOrCreate(MacroKey key, Supplier<Macro> builder) {
        Macro m = _macros.get(key);
        if (m != null) {
            return m;
        }
        m = builder.get();
        if (_macros.containsKey(key)) {
            throw new IllegalStateException("Macro " + key + " defined while building itself");
        }
        _macros.put(key, m);
        _definitions.add(m);
        return m;
    }

    public boolean contains(MacroKey key) {
        return _macros.containsKey(key);
    }

    /**
     * Number of macros of one family.
     */
    public int count(MacroKey.Family family) {
        int n = 0;
        for (MacroKey key : _macros.keySet()) {
            if (key.getFamily() == family) {
                n++;
            }
        }
        return n;
    }

    public int size() {
        return _definitions.size();
    }

    public List<Macro> getDefinitions() {
        return Collections.unmodifiableList(_definitions);
    }
}
