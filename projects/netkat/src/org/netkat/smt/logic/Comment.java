package org.netkat.smt.logic;

/**
 * Attaches a diagnostic comment to a formula. The comment is printed on its
 * own line and does not change the meaning of the formula.
 */
public class Comment extends Formula {

    private final String _text;

    private final Formula _formula;

    public Comment(String text, Formula formula) {
        _text = text.replace('\n', ' ').replace('\r', ' ');
        _formula = formula;
    }

    public String getText() {
        return _text;
    }

    public Formula getFormula() {
        return _formula;
    }

    @Override
    public void print(StringBuilder sb) {
        sb.append("\n; ").append(_text).append("\n");
        _formula.print(sb);
    }
}
