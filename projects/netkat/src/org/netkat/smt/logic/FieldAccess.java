package org.netkat.smt.logic;

import org.netkat.datamodel.Field;

/**
 * The value of a header field of a packet term.
 */
public class FieldAccess extends Term {

    private final Field _field;

    private final Term _packet;

    public FieldAccess(Field field, Term packet) {
        if (packet.getSort() != Sort.PACKET) {
            throw new IllegalArgumentException("Field " + field + " read from a " + packet
                    .getSort() + " term");
        }
        _field = field;
        _packet = packet;
    }

    public Field getField() {
        return _field;
    }

    public Term getPacket() {
        return _packet;
    }

    @Override
    public Sort getSort() {
        return Sort.INT;
    }

    @Override
    public void print(StringBuilder sb) {
        sb.append("(").append(_field.headerName()).append(" ");
        _packet.print(sb);
        sb.append(")");
    }
}
