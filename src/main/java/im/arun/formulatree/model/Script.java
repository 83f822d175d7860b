package im.arun.formulatree.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * A base with an optional subscript and an optional superscript.
 */
@Getter
public class Script extends AugmentedFormulaNode {
    private final AugmentedFormulaNode base;
    private final AugmentedFormulaNode sub;
    private final AugmentedFormulaNode sup;

    public Script(String id, AugmentedFormulaNode base, AugmentedFormulaNode sub, AugmentedFormulaNode sup) {
        super(id);
        this.base = base;
        this.sub = sub;
        this.sup = sup;
        attachChildren();
    }

    @Override
    public NodeType getType() {
        return NodeType.SCRIPT;
    }

    @Override
    public List<AugmentedFormulaNode> getChildren() {
        List<AugmentedFormulaNode> children = new ArrayList<>(3);
        children.add(base);
        if (sub != null) {
            children.add(sub);
        }
        if (sup != null) {
            children.add(sup);
        }
        return children;
    }

    @Override
    public LatexRange toLatex(LatexMode mode, int offset) {
        List<LatexRange> elements = new ArrayList<>();
        addOperand(elements, base, mode, mode != LatexMode.RENDER && unwrap(base) instanceof Script);
        if (sub != null) {
            elements.add(lit("_"));
            addOperand(elements, sub, mode, scriptNeedsBraces(sub, mode));
        }
        if (sup != null) {
            elements.add(lit("^"));
            addOperand(elements, sup, mode, scriptNeedsBraces(sup, mode));
        }
        return consolidate(latexWithId(mode, elements), offset);
    }

    @Override
    public List<FormulaLatexRange> toStyledRanges() {
        List<FormulaLatexRange> ranges = new ArrayList<>();
        addStyledOperand(ranges, base, unwrap(base) instanceof Script);
        if (sub != null) {
            ranges.add(new UnstyledRange("_"));
            addStyledOperand(ranges, sub, scriptNeedsBraces(sub, LatexMode.NO_ID));
        }
        if (sup != null) {
            ranges.add(new UnstyledRange("^"));
            addStyledOperand(ranges, sup, scriptNeedsBraces(sup, LatexMode.NO_ID));
        }
        return ranges;
    }

    // The renderer rejects commands with arguments in script position, so every
    // operand is braced there. Plain output braces only what would not reparse.
    private static boolean scriptNeedsBraces(AugmentedFormulaNode operand, LatexMode mode) {
        if (mode == LatexMode.RENDER) {
            return !(operand instanceof Group);
        }
        AugmentedFormulaNode inner = unwrap(operand);
        return !(inner instanceof MathSymbol || inner instanceof Group);
    }

    private static AugmentedFormulaNode unwrap(AugmentedFormulaNode node) {
        AugmentedFormulaNode current = node;
        while (current instanceof Variable) {
            current = ((Variable) current).getBody();
        }
        return current;
    }

    private static void addOperand(List<LatexRange> elements, AugmentedFormulaNode operand, LatexMode mode,
                                   boolean braced) {
        if (braced) {
            elements.add(lit("{"));
        }
        elements.add(operand.toLatex(mode, 0));
        if (braced) {
            elements.add(lit("}"));
        }
    }

    private static void addStyledOperand(List<FormulaLatexRange> ranges, AugmentedFormulaNode operand,
                                         boolean braced) {
        if (braced) {
            ranges.add(new UnstyledRange("{"));
        }
        ranges.addAll(operand.toStyledRanges());
        if (braced) {
            ranges.add(new UnstyledRange("}"));
        }
    }

    @Override
    protected boolean matchesSameType(AugmentedFormulaNode other) {
        Script script = (Script) other;
        return base.matches(script.base) && optionalMatches(sub, script.sub) && optionalMatches(sup, script.sup);
    }

    @Override
    protected void attachChildren() {
        adopt(base);
        adopt(sub);
        adopt(sup);
    }

    @Override
    protected Script copySubtree() {
        return new Script(getId(), base.deepCopy(), copyOf(sub), copyOf(sup));
    }

    @Override
    public Script withId(String id) {
        return linkedLike(new Script(id, base, sub, sup));
    }

    public Script withBase(AugmentedFormulaNode base) {
        return linkedLike(new Script(getId(), base, sub, sup));
    }

    public Script withSub(AugmentedFormulaNode sub) {
        return linkedLike(new Script(getId(), base, sub, sup));
    }

    public Script withSup(AugmentedFormulaNode sup) {
        return linkedLike(new Script(getId(), base, sub, sup));
    }

    public Script withParts(String id, AugmentedFormulaNode base, AugmentedFormulaNode sub,
                            AugmentedFormulaNode sup) {
        return linkedLike(new Script(id, base, sub, sup));
    }
}
