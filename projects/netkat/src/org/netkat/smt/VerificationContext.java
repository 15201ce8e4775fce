package org.netkat.smt;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * <p>The mutable state of one verification run: the macro cache, the
 * counter used to name fresh packet variables, and the packet variables
 * allocated so far.</p>
 *
 * <p>Every check creates its own context and drops it when it is done, so
 * runs never share solver declarations and can proceed in parallel.</p>
 */
public class VerificationContext {

    private static final String PACKET_PREFIX = "gensym";

    private final MacroCache _macroCache;

    private final PacketMacros _macros;

    private final List<SymbolicPacket> _packets;

    private final boolean _annotate;

    private int _nextId;

    public VerificationContext() {
        this(true);
    }

    /**
     * @param annotate  Whether compiled formulas carry diagnostic comments
     */
    public VerificationContext(boolean annotate) {
        _macroCache = new MacroCache();
        _macros = new PacketMacros(_macroCache);
        _packets = new ArrayList<>();
        _annotate = annotate;
        _nextId = 0;
    }

    /**
     * Allocate a packet variable not used before in this run.
     */
    public SymbolicPacket freshPacket() {
        SymbolicPacket p = new SymbolicPacket(PACKET_PREFIX + _nextId);
        _nextId = _nextId + 1;
        _packets.add(p);
        return p;
    }

    public List<SymbolicPacket> getPackets() {
        return Collections.unmodifiableList(_packets);
    }

    public MacroCache getMacroCache() {
        return _macroCache;
    }

    public PacketMacros getMacros() {
        return _macros;
    }

    public boolean getAnnotate() {
        return _annotate;
    }
}
