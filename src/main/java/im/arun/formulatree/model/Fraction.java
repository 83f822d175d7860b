package im.arun.formulatree.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

@Getter
public class Fraction extends AugmentedFormulaNode {
    private final AugmentedFormulaNode numerator;
    private final AugmentedFormulaNode denominator;

    public Fraction(String id, AugmentedFormulaNode numerator, AugmentedFormulaNode denominator) {
        super(id);
        this.numerator = numerator;
        this.denominator = denominator;
        attachChildren();
    }

    @Override
    public NodeType getType() {
        return NodeType.FRACTION;
    }

    @Override
    public List<AugmentedFormulaNode> getChildren() {
        return List.of(numerator, denominator);
    }

    @Override
    public LatexRange toLatex(LatexMode mode, int offset) {
        return consolidate(latexWithId(mode, List.of(
                lit("\\frac{"), numerator.toLatex(mode, 0),
                lit("}{"), denominator.toLatex(mode, 0),
                lit("}"))), offset);
    }

    @Override
    public List<FormulaLatexRange> toStyledRanges() {
        List<FormulaLatexRange> ranges = new ArrayList<>();
        ranges.add(new UnstyledRange("\\frac{"));
        ranges.addAll(numerator.toStyledRanges());
        ranges.add(new UnstyledRange("}{"));
        ranges.addAll(denominator.toStyledRanges());
        ranges.add(new UnstyledRange("}"));
        return ranges;
    }

    @Override
    protected boolean matchesSameType(AugmentedFormulaNode other) {
        Fraction fraction = (Fraction) other;
        return numerator.matches(fraction.numerator) && denominator.matches(fraction.denominator);
    }

    @Override
    protected void attachChildren() {
        adopt(numerator);
        adopt(denominator);
    }

    @Override
    protected Fraction copySubtree() {
        return new Fraction(getId(), numerator.deepCopy(), denominator.deepCopy());
    }

    @Override
    public Fraction withId(String id) {
        return linkedLike(new Fraction(id, numerator, denominator));
    }

    public Fraction withParts(String id, AugmentedFormulaNode numerator, AugmentedFormulaNode denominator) {
        return linkedLike(new Fraction(id, numerator, denominator));
    }
}
