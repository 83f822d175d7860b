package im.arun.formulatree.lookup;

import im.arun.formulatree.FormulaException;
import im.arun.formulatree.model.AugmentedFormula;
import im.arun.formulatree.model.AugmentedFormulaNode;
import im.arun.formulatree.tree.FormulaTreeBuilder;
import im.arun.formulatree.variable.SubsequenceMatch;
import im.arun.formulatree.variable.SubsequenceMatcher;
import im.arun.formulatree.variable.VariablePatterns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds an expression inside an annotated formula by structure rather than by text,
 * so that an {@code =} inside a subscript is never mistaken for a top-level one.
 */
public class ExpressionLocator {
    private static final Logger logger = LoggerFactory.getLogger(ExpressionLocator.class);

    private final FormulaTreeBuilder builder;
    private final VariablePatterns variablePatterns;

    public ExpressionLocator(FormulaTreeBuilder builder, VariablePatterns variablePatterns) {
        this.builder = builder;
        this.variablePatterns = variablePatterns;
    }

    public ExpressionLocator(FormulaTreeBuilder builder) {
        this(builder, new VariablePatterns(builder));
    }

    /**
     * Locate the first top-level occurrence of {@code expression} in {@code formula}.
     *
     * @param formula    annotated formula to search
     * @param expression LaTeX of the expression to find
     * @param symbols    variable symbols the formula was built with, or null; the
     *                   expression is grouped with the same symbols so variables line up
     * @return the match, or null when the expression is empty, does not occur, or the
     *         occurrence carries no display ids
     */
    public ExpressionMatch findExpression(AugmentedFormula formula, String expression, List<String> symbols) {
        AugmentedFormula pattern;
        try {
            pattern = symbols == null || symbols.isEmpty()
                    ? builder.deriveTree(expression)
                    : builder.deriveTreeWithVars(expression, variablePatterns.parseVariableStrings(symbols), symbols);
        } catch (FormulaException e) {
            logger.warn("Could not look up expression '{}': {}", expression, e.getMessage());
            return null;
        }
        if (pattern.isEmpty()) {
            return null;
        }

        List<SubsequenceMatch> matches =
                SubsequenceMatcher.findMatchingSubsequences(formula.getChildren(), pattern.getChildren());
        if (matches.isEmpty()) {
            logger.debug("Expression '{}' not found in {}", expression, formula);
            return null;
        }
        SubsequenceMatch first = matches.get(0);

        Set<String> ids = new LinkedHashSet<>();
        for (AugmentedFormulaNode node : first.getNodes()) {
            collectDisplayIds(node, ids);
        }
        if (ids.isEmpty()) {
            logger.debug("Expression '{}' matched nodes without display ids", expression);
            return null;
        }
        return new ExpressionMatch(first.getNodes(), new ArrayList<>(ids));
    }

    private static void collectDisplayIds(AugmentedFormulaNode node, Set<String> ids) {
        if (node.getCssId() != null) {
            ids.add(node.getCssId());
        }
        for (AugmentedFormulaNode child : node.getChildren()) {
            collectDisplayIds(child, ids);
        }
    }
}
