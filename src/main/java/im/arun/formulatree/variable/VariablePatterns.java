package im.arun.formulatree.variable;

import im.arun.formulatree.FormulaException;
import im.arun.formulatree.model.AugmentedFormula;
import im.arun.formulatree.model.AugmentedFormulaNode;
import im.arun.formulatree.model.LatexMode;
import im.arun.formulatree.model.MathSymbol;
import im.arun.formulatree.model.Op;
import im.arun.formulatree.model.Space;
import im.arun.formulatree.tree.FormulaTreeBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns user-declared variable symbols into pattern trees for the grouper.
 */
public class VariablePatterns {
    private static final Logger logger = LoggerFactory.getLogger(VariablePatterns.class);

    static final String FALLBACK_ID = "fallback";

    private final FormulaTreeBuilder builder;

    public VariablePatterns(FormulaTreeBuilder builder) {
        this.builder = builder;
    }

    /**
     * Pattern tree of one symbol. A symbol that does not parse becomes a single
     * {@link MathSymbol} holding the raw text, so a bad declaration never blocks a build.
     */
    public AugmentedFormula parseVariableString(String symbol) {
        try {
            return builder.deriveTree(symbol);
        } catch (FormulaException e) {
            logger.warn("Failed to parse variable '{}', using it as a plain symbol: {}", symbol, e.getMessage());
            return new AugmentedFormula(List.of(new MathSymbol(FALLBACK_ID, symbol)));
        }
    }

    public List<AugmentedFormula> parseVariableStrings(List<String> symbols) {
        List<AugmentedFormula> trees = new ArrayList<>(symbols.size());
        for (String symbol : symbols) {
            trees.add(parseVariableString(symbol));
        }
        return trees;
    }

    /**
     * Leaf nodes of a formula in document order.
     */
    public static List<AugmentedFormulaNode> flattenFormulaToTokens(AugmentedFormula formula) {
        List<AugmentedFormulaNode> tokens = new ArrayList<>();
        for (AugmentedFormulaNode child : formula.getChildren()) {
            collectLeaves(child, tokens);
        }
        return tokens;
    }

    private static void collectLeaves(AugmentedFormulaNode node, List<AugmentedFormulaNode> tokens) {
        List<AugmentedFormulaNode> children = node.getChildren();
        if (children.isEmpty()) {
            tokens.add(node);
            return;
        }
        for (AugmentedFormulaNode child : children) {
            collectLeaves(child, tokens);
        }
    }

    /**
     * Token text of each leaf of the symbol's pattern tree, e.g. {@code [x, i]} for {@code x_i}.
     */
    public List<String> getVariableTokens(String symbol) {
        List<String> tokens = new ArrayList<>();
        for (AugmentedFormulaNode leaf : flattenFormulaToTokens(parseVariableString(symbol))) {
            tokens.add(tokenText(leaf));
        }
        return tokens;
    }

    private static String tokenText(AugmentedFormulaNode leaf) {
        switch (leaf.getType()) {
            case SYMBOL:
                return ((MathSymbol) leaf).getValue();
            case SPACE:
                return ((Space) leaf).getText();
            case OP:
                return ((Op) leaf).getOperator();
            default:
                return leaf.toLatex(LatexMode.NO_ID);
        }
    }
}
