package im.arun.formulatree.model;

import lombok.Value;

@Value
public class UnstyledRange implements FormulaLatexRange {
    String text;

    @Override
    public int length() {
        return text.length();
    }

    @Override
    public String text() {
        return text;
    }
}
