package org.netkat.smt;


import org.netkat.datamodel.Field;
import org.netkat.smt.logic.Formula;
import org.netkat.smt.logic.Macro;
import org.netkat.smt.logic.Sort;

import java.util.ArrayList;
import java.util.List;

/**
 * <p>An SMT-LIB2 program for one verification run. The program declares the
 * packet sort, the drop sentinel, one function per header field, the packet
 * variables and the macros of the run's context, followed by the assertions
 * and top-level comments in the order they were added.</p>
 */
public class SmtProgram {

    private final String _name;

    private final VerificationContext _ctx;

    private final List<String> _commands;

    private int _numAssertions;

    public SmtProgram(String name, VerificationContext ctx) {
        _name = name;
        _ctx = ctx;
        _commands = new ArrayList<>();
        _numAssertions = 0;
    }

    public void addAssertion(Formula f) {
        StringBuilder sb = new StringBuilder("(assert ");
        f.print(sb);
        sb.append(")");
        _commands.add(sb.toString());
        _numAssertions = _numAssertions + 1;
    }

    public void addComment(String text) {
        _commands.add("; " + text.replace('\n', ' ').replace('\r', ' '));
    }

    public String getName() {
        return _name;
    }

    public int getNumAssertions() {
        return _numAssertions;
    }

    public int getNumMacros() {
        return _ctx.getMacroCache().size();
    }

    public int getNumVariables() {
        return _ctx.getPackets().size();
    }

    /**
     * Print the program.
     * @param checkSat  Whether to end the program with a <code>check-sat</code> command
     */
    public String serialize(boolean checkSat) {
        StringBuilder sb = new StringBuilder();
        sb.append("; ").append(_name.replace('\n', ' ')).append("\n");
        String packet = Sort.PACKET.smtName();
        sb.append("(declare-sort ").append(packet).append(" 0)\n");
        sb.append("(declare-const ").append(SymbolicPacket.NO_PACKET.getName()).append(" ")
          .append(packet).append(")\n");
        for (Field f : Field.values()) {
            sb.append("(declare-fun ").append(f.headerName()).append(" (").append(packet)
              .append(") ").append(Sort.INT.smtName()).append(")\n");
        }
        for (SymbolicPacket p : _ctx.getPackets()) {
            sb.append("(declare-const ").append(p.getName()).append(" ").append(packet).append
                    (")\n");
        }
        for (Macro m : _ctx.getMacroCache().getDefinitions()) {
            m.printDefinition(sb);
            sb.append("\n");
        }
        for (String command : _commands) {
            sb.append(command).append("\n");
        }
        if (checkSat) {
            sb.append("(check-sat)\n");
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return serialize(true);
    }
}
