package im.arun.formulatree.service;

import im.arun.formulatree.FormulaException;
import im.arun.formulatree.config.ConfigLoader;
import im.arun.formulatree.config.FormulaConfig;
import im.arun.formulatree.lookup.ExpressionLocator;
import im.arun.formulatree.lookup.ExpressionMatch;
import im.arun.formulatree.model.AugmentedFormula;
import im.arun.formulatree.model.AugmentedFormulaNode;
import im.arun.formulatree.parse.LatexParser;
import im.arun.formulatree.render.AnnotationResult;
import im.arun.formulatree.render.DisplayIdAnnotator;
import im.arun.formulatree.tree.FormulaTransformer;
import im.arun.formulatree.tree.FormulaTreeBuilder;
import im.arun.formulatree.util.FormulaTreeExporter;
import im.arun.formulatree.variable.VariableGrouper;
import im.arun.formulatree.variable.VariablePatterns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Entry point wiring the parser, tree builder, variable grouping, lookup and
 * annotation around one configuration.
 */
public class FormulaService {
    private static final Logger logger = LoggerFactory.getLogger(FormulaService.class);

    private final FormulaConfig config;
    private final FormulaTreeBuilder treeBuilder;
    private final VariablePatterns variablePatterns;
    private final ExpressionLocator expressionLocator;
    private final DisplayIdAnnotator annotator;
    private final FormulaTreeExporter exporter;

    public FormulaService() {
        this(new ConfigLoader().load());
    }

    public FormulaService(FormulaConfig config) {
        this.config = config;
        this.treeBuilder = new FormulaTreeBuilder(new LatexParser(config.getMaxNestingDepth()),
                new VariableGrouper(config));
        this.variablePatterns = new VariablePatterns(treeBuilder);
        this.expressionLocator = new ExpressionLocator(treeBuilder, variablePatterns);
        this.annotator = new DisplayIdAnnotator(config.getVariableCssClass());
        this.exporter = new FormulaTreeExporter();
    }

    public FormulaConfig getConfig() {
        return config;
    }

    /**
     * @throws FormulaException if the LaTeX does not parse or has no tree representation
     */
    public AugmentedFormula deriveTree(String latex) {
        return treeBuilder.deriveTree(latex);
    }

    public AugmentedFormula deriveTreeWithVars(String latex, List<AugmentedFormula> variableTrees,
                                               List<String> originalSymbols) {
        return treeBuilder.deriveTreeWithVars(latex, variableTrees, originalSymbols);
    }

    /**
     * Build a formula with the given variable symbols grouped.
     */
    public AugmentedFormula deriveTreeWithVariables(String latex, List<String> symbols) {
        return treeBuilder.deriveTreeWithVars(latex, variablePatterns.parseVariableStrings(symbols), symbols);
    }

    /**
     * Whether the LaTeX builds into a formula tree.
     */
    public boolean checkFormulaCode(String latex) {
        try {
            treeBuilder.deriveTree(latex);
            return true;
        } catch (FormulaException e) {
            logger.debug("Invalid formula '{}': {}", latex, e.getMessage());
            return false;
        }
    }

    public AugmentedFormula parseVariableString(String symbol) {
        return variablePatterns.parseVariableString(symbol);
    }

    /**
     * @return the first occurrence of the expression with its display ids, or null
     * @see ExpressionLocator#findExpression
     */
    public ExpressionMatch findExpression(AugmentedFormula formula, String expression, List<String> symbols) {
        return expressionLocator.findExpression(formula, expression, symbols);
    }

    public AnnotationResult annotate(AugmentedFormula formula) {
        return annotator.annotate(formula);
    }

    /**
     * Build, group and annotate in one step, producing the LaTeX for the typesetter.
     * Input that does not build is returned unchanged.
     */
    public String processLatexContent(String latex, List<String> symbols) {
        try {
            return annotate(deriveTreeWithVariables(latex, symbols)).getLatex();
        } catch (FormulaException e) {
            logger.warn("Failed to process LaTeX content '{}': {}", latex, e.getMessage());
            return latex;
        }
    }

    /**
     * Original symbols of the variables that occur in the LaTeX, or an empty list if it
     * does not build.
     */
    public List<String> getVariablesFromLatex(String latex, List<String> symbols) {
        List<String> ids = new ArrayList<>();
        try {
            for (AugmentedFormulaNode child : deriveTreeWithVariables(latex, symbols).getChildren()) {
                ids.addAll(DisplayIdAnnotator.collectVariableIds(child));
            }
        } catch (FormulaException e) {
            logger.warn("Failed to parse LaTeX for variables '{}': {}", latex, e.getMessage());
        }
        return ids;
    }

    /**
     * Rewrite nodes bottom-up and renumber the result.
     *
     * @see FormulaTransformer#replaceNodes
     */
    public AugmentedFormula replaceNodes(AugmentedFormula formula, UnaryOperator<AugmentedFormulaNode> replacer) {
        return FormulaTransformer.replaceNodes(formula, replacer);
    }

    public String toJson(AugmentedFormula formula) {
        return exporter.toJson(formula);
    }
}
