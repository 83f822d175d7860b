package im.arun.formulatree.variable;

import im.arun.formulatree.config.FormulaConfig;
import im.arun.formulatree.model.Accent;
import im.arun.formulatree.model.Aligned;
import im.arun.formulatree.model.AugmentedFormula;
import im.arun.formulatree.model.AugmentedFormulaNode;
import im.arun.formulatree.model.Box;
import im.arun.formulatree.model.Brace;
import im.arun.formulatree.model.Color;
import im.arun.formulatree.model.Delimited;
import im.arun.formulatree.model.Fraction;
import im.arun.formulatree.model.Group;
import im.arun.formulatree.model.LatexMode;
import im.arun.formulatree.model.MathSymbol;
import im.arun.formulatree.model.Matrix;
import im.arun.formulatree.model.NodeType;
import im.arun.formulatree.model.Root;
import im.arun.formulatree.model.Script;
import im.arun.formulatree.model.Strikethrough;
import im.arun.formulatree.model.Text;
import im.arun.formulatree.model.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Wraps every occurrence of a set of variable patterns in {@link Variable} nodes.
 *
 * <p>Patterns are applied one at a time, most complex first, so that {@code x_i} is
 * grouped before {@code x} can claim the base of every {@code x_i}. Existing variables
 * are never entered, which also makes grouping idempotent.</p>
 *
 * <p>Inside scripts, fractions and other nested positions an {@code =} binds the node
 * to its left to an equation: in {@code \sum_{i=1}^{n}} the {@code i} is an index
 * binding and stays unwrapped, and with equality binding enabled the right side
 * {@code 1} becomes its own variable.</p>
 */
public class VariableGrouper {
    private static final Logger logger = LoggerFactory.getLogger(VariableGrouper.class);

    private static final Set<NodeType> NESTED_CONTEXT_TYPES = EnumSet.of(
            NodeType.SCRIPT, NodeType.FRACTION, NodeType.ROOT, NodeType.ACCENT, NodeType.ARRAY, NodeType.MATRIX);

    private final FormulaConfig config;

    public VariableGrouper(FormulaConfig config) {
        this.config = config;
    }

    public VariableGrouper() {
        this(new FormulaConfig());
    }

    /**
     * Group every occurrence of the given patterns.
     *
     * @param formula         formula to group; it is left untouched
     * @param variableTrees   one formula per variable pattern
     * @param originalSymbols declared symbol per pattern, used as the variable's display id;
     *                        missing or null entries fall back to the pattern's LaTeX
     * @return a new formula, or {@code formula} itself when there is nothing to group
     */
    public AugmentedFormula groupVariablesByTrees(AugmentedFormula formula, List<AugmentedFormula> variableTrees,
                                                  List<String> originalSymbols) {
        if (formula.isEmpty() || variableTrees == null || variableTrees.isEmpty()) {
            return formula;
        }
        List<VariablePattern> patterns = new ArrayList<>(variableTrees.size());
        for (int i = 0; i < variableTrees.size(); i++) {
            AugmentedFormula tree = variableTrees.get(i);
            if (tree == null || tree.isEmpty()) {
                logger.debug("Skipping empty variable pattern at position {}", i);
                continue;
            }
            String variableLatex = tree.toLatex(LatexMode.NO_ID).trim();
            String symbol = originalSymbols != null && i < originalSymbols.size() && originalSymbols.get(i) != null
                    ? originalSymbols.get(i)
                    : variableLatex;
            patterns.add(new VariablePattern(tree.getChildren(), variableLatex, symbol));
        }
        // List.sort is stable, so equally complex patterns keep their declared order.
        patterns.sort(Comparator.comparingInt(VariablePattern::complexity).reversed());

        SyntheticIdGenerator ids = SyntheticIdGenerator.seededFrom(formula, List.of(
                config.getSyntheticVariablePrefix(), config.getSyntheticGroupPrefix(),
                config.getEqualityVariablePrefix()));

        AugmentedFormula current = formula;
        for (VariablePattern pattern : patterns) {
            Pass pass = new Pass(pattern, ids);
            current = pass.apply(current);
            logger.debug("Grouped {} occurrence(s) of variable '{}'", pass.wrapped, pattern.originalSymbol);
        }
        return current;
    }

    /**
     * Structural weight of a pattern; heavier patterns are grouped first.
     */
    public static int complexity(AugmentedFormula tree) {
        int total = 0;
        for (AugmentedFormulaNode child : tree.getChildren()) {
            total += complexity(child);
        }
        return total;
    }

    static int complexity(AugmentedFormulaNode node) {
        int score = 1;
        switch (node.getType()) {
            case SCRIPT:
                score += 2;
                break;
            case FRACTION:
                score += 3;
                break;
            case GROUP:
                score += 1;
                break;
            case MATRIX:
                score += 4;
                break;
            case DELIMITED:
                score += 2;
                break;
            default:
                break;
        }
        for (AugmentedFormulaNode child : node.getChildren()) {
            score += complexity(child);
        }
        return score;
    }

    private static final class VariablePattern {
        private final List<AugmentedFormulaNode> children;
        private final String variableLatex;
        private final String originalSymbol;
        private final int complexity;

        private VariablePattern(List<AugmentedFormulaNode> children, String variableLatex, String originalSymbol) {
            this.children = children;
            this.variableLatex = variableLatex;
            this.originalSymbol = originalSymbol;
            int total = 0;
            for (AugmentedFormulaNode child : children) {
                total += VariableGrouper.complexity(child);
            }
            this.complexity = total;
        }

        int complexity() {
            return complexity;
        }
    }

    /**
     * One bottom-up rewrite of a formula for a single pattern.
     *
     * <p>Context checks always look at the nodes of the incoming tree. Those nodes are
     * never handed to a new parent: wherever one survives into the result a deep copy
     * takes its place, so the incoming links stay intact.</p>
     */
    private final class Pass {
        private final VariablePattern pattern;
        private final AugmentedFormulaNode single;
        private final SyntheticIdGenerator ids;
        private final Set<AugmentedFormulaNode> incoming = Collections.newSetFromMap(new IdentityHashMap<>());
        private int wrapped;

        private Pass(VariablePattern pattern, SyntheticIdGenerator ids) {
            this.pattern = pattern;
            this.single = pattern.children.size() == 1 ? pattern.children.get(0) : null;
            this.ids = ids;
        }

        AugmentedFormula apply(AugmentedFormula formula) {
            incoming.addAll(formula.allNodes());
            List<AugmentedFormulaNode> original = formula.getChildren();
            List<AugmentedFormulaNode> processed = processAll(original);
            List<AugmentedFormulaNode> grouped = groupMatches(original, processed);
            if (sameNodes(original, grouped)) {
                return formula;
            }
            return new AugmentedFormula(ownAll(grouped));
        }

        /**
         * The node itself if this pass built it, otherwise a copy that is free to be
         * attached to a new parent.
         */
        private AugmentedFormulaNode own(AugmentedFormulaNode node) {
            return node != null && incoming.contains(node) ? node.deepCopy() : node;
        }

        private List<AugmentedFormulaNode> ownAll(List<AugmentedFormulaNode> nodes) {
            List<AugmentedFormulaNode> owned = new ArrayList<>(nodes.size());
            for (AugmentedFormulaNode node : nodes) {
                owned.add(own(node));
            }
            return owned;
        }

        private List<List<AugmentedFormulaNode>> ownGrid(List<List<AugmentedFormulaNode>> rows) {
            List<List<AugmentedFormulaNode>> owned = new ArrayList<>(rows.size());
            for (List<AugmentedFormulaNode> row : rows) {
                owned.add(ownAll(row));
            }
            return owned;
        }

        private AugmentedFormulaNode process(AugmentedFormulaNode node) {
            if (single != null && node.matches(single) && !isInEqualityContext(node)) {
                return wrap(node, config.getSyntheticVariablePrefix());
            }
            switch (node.getType()) {
                case SCRIPT: {
                    Script script = (Script) node;
                    AugmentedFormulaNode base = process(script.getBase());
                    AugmentedFormulaNode sub = script.getSub() == null ? null : process(script.getSub());
                    AugmentedFormulaNode sup = script.getSup() == null ? null : process(script.getSup());
                    if (base == script.getBase() && sub == script.getSub() && sup == script.getSup()) {
                        return node;
                    }
                    return script.withParts(script.getId(), own(base), own(sub), own(sup));
                }
                case FRACTION: {
                    Fraction fraction = (Fraction) node;
                    AugmentedFormulaNode numerator = process(fraction.getNumerator());
                    AugmentedFormulaNode denominator = process(fraction.getDenominator());
                    if (numerator == fraction.getNumerator() && denominator == fraction.getDenominator()) {
                        return node;
                    }
                    return fraction.withParts(fraction.getId(), own(numerator), own(denominator));
                }
                case ROOT: {
                    Root root = (Root) node;
                    AugmentedFormulaNode body = process(root.getBody());
                    AugmentedFormulaNode index = root.getIndex() == null ? null : process(root.getIndex());
                    if (body == root.getBody() && index == root.getIndex()) {
                        return node;
                    }
                    return root.withParts(root.getId(), own(body), own(index));
                }
                case ACCENT: {
                    Accent accent = (Accent) node;
                    AugmentedFormulaNode base = process(accent.getBase());
                    return base == accent.getBase() ? node : accent.withBase(own(base));
                }
                case BOX: {
                    Box box = (Box) node;
                    AugmentedFormulaNode body = process(box.getBody());
                    return body == box.getBody() ? node : box.withBody(own(body));
                }
                case BRACE: {
                    Brace brace = (Brace) node;
                    AugmentedFormulaNode base = process(brace.getBase());
                    return base == brace.getBase() ? node : brace.withBase(own(base));
                }
                case STRIKETHROUGH: {
                    Strikethrough strikethrough = (Strikethrough) node;
                    AugmentedFormulaNode body = process(strikethrough.getBody());
                    return body == strikethrough.getBody() ? node : strikethrough.withBody(own(body));
                }
                case ARRAY: {
                    Aligned aligned = (Aligned) node;
                    List<List<AugmentedFormulaNode>> body = processGrid(aligned.getBody());
                    return body == aligned.getBody() ? node : aligned.withBody(ownGrid(body));
                }
                case MATRIX: {
                    Matrix matrix = (Matrix) node;
                    List<List<AugmentedFormulaNode>> body = processGrid(matrix.getBody());
                    return body == matrix.getBody() ? node : matrix.withBody(ownGrid(body));
                }
                case GROUP: {
                    Group group = (Group) node;
                    List<AugmentedFormulaNode> body = processList(group, group.getBody());
                    return body == group.getBody() ? node : group.withBody(ownAll(body));
                }
                case COLOR: {
                    Color color = (Color) node;
                    List<AugmentedFormulaNode> body = processList(color, color.getBody());
                    return body == color.getBody() ? node : color.withBody(ownAll(body));
                }
                case TEXT: {
                    Text text = (Text) node;
                    List<AugmentedFormulaNode> body = processList(text, text.getBody());
                    return body == text.getBody() ? node : text.withBody(ownAll(body));
                }
                case DELIMITED: {
                    Delimited delimited = (Delimited) node;
                    List<AugmentedFormulaNode> body = processList(delimited, delimited.getBody());
                    return body == delimited.getBody() ? node : delimited.withBody(ownAll(body));
                }
                default:
                    // Variables are already grouped; the remaining variants are leaves.
                    return node;
            }
        }

        /**
         * Process a node list; returns {@code original} itself when nothing changed.
         */
        private List<AugmentedFormulaNode> processList(AugmentedFormulaNode owner,
                                                      List<AugmentedFormulaNode> original) {
            List<AugmentedFormulaNode> processed = processAll(original);
            if (owner.getType() == NodeType.GROUP && config.isEqualityBinding() && isInNestedContext(owner)) {
                processed = wrapEqualityRightSides(processed);
            }
            processed = groupMatches(original, processed);
            return sameNodes(original, processed) ? original : processed;
        }

        private List<AugmentedFormulaNode> processAll(List<AugmentedFormulaNode> nodes) {
            List<AugmentedFormulaNode> processed = new ArrayList<>(nodes.size());
            for (AugmentedFormulaNode node : nodes) {
                processed.add(process(node));
            }
            return processed;
        }

        private List<List<AugmentedFormulaNode>> processGrid(List<List<AugmentedFormulaNode>> rows) {
            List<List<AugmentedFormulaNode>> processed = new ArrayList<>(rows.size());
            boolean changed = false;
            for (List<AugmentedFormulaNode> row : rows) {
                List<AugmentedFormulaNode> cells = processAll(row);
                changed |= !sameNodes(row, cells);
                processed.add(cells);
            }
            return changed ? processed : rows;
        }

        /**
         * Replace pattern runs in {@code processed}. {@code original} is index-aligned with
         * it and supplies the context of each position.
         */
        private List<AugmentedFormulaNode> groupMatches(List<AugmentedFormulaNode> original,
                                                        List<AugmentedFormulaNode> processed) {
            List<SubsequenceMatch> matches = SubsequenceMatcher.findMatchingSubsequences(processed, pattern.children);
            if (matches.isEmpty()) {
                return processed;
            }
            List<AugmentedFormulaNode> result = new ArrayList<>(processed);
            // Back to front so earlier indices stay valid.
            for (int m = matches.size() - 1; m >= 0; m--) {
                SubsequenceMatch match = matches.get(m);
                if (anyInEqualityContext(original, match)) {
                    continue;
                }
                AugmentedFormulaNode body = match.getNodes().size() == 1
                        ? match.getNodes().get(0)
                        : new Group(ids.next(config.getSyntheticGroupPrefix()), ownAll(match.getNodes()));
                AugmentedFormulaNode variable = wrap(body, config.getSyntheticVariablePrefix());
                for (int i = match.getEndIndex(); i >= match.getStartIndex(); i--) {
                    result.remove(i);
                }
                result.add(match.getStartIndex(), variable);
            }
            return result;
        }

        private boolean anyInEqualityContext(List<AugmentedFormulaNode> original, SubsequenceMatch match) {
            for (int i = match.getStartIndex(); i <= match.getEndIndex(); i++) {
                if (isInEqualityContext(original.get(i))) {
                    return true;
                }
            }
            return false;
        }

        /**
         * In {@code i = 1} where {@code i} matches the pattern, wrap the right side
         * {@code 1} as a variable of its own.
         */
        private List<AugmentedFormulaNode> wrapEqualityRightSides(List<AugmentedFormulaNode> nodes) {
            List<AugmentedFormulaNode> result = new ArrayList<>(nodes);
            if (single == null) {
                return result;
            }
            for (int i = 0; i < result.size(); i++) {
                if (!isEquals(result.get(i))) {
                    continue;
                }
                int left = nonSpace(result, i - 1, -1);
                int right = nonSpace(result, i + 1, 1);
                if (left < 0 || right < 0 || !result.get(left).matches(single)) {
                    continue;
                }
                if (result.get(right).getType() != NodeType.VARIABLE) {
                    result.set(right, wrap(result.get(right), config.getEqualityVariablePrefix()));
                }
            }
            return result;
        }

        private int nonSpace(List<AugmentedFormulaNode> nodes, int from, int step) {
            for (int j = from; j >= 0 && j < nodes.size(); j += step) {
                if (nodes.get(j).getType() != NodeType.SPACE) {
                    return j;
                }
            }
            return -1;
        }

        private Variable wrap(AugmentedFormulaNode body, String prefix) {
            wrapped++;
            return new Variable(ids.next(prefix), own(body), pattern.variableLatex, pattern.originalSymbol);
        }
    }

    private boolean isInEqualityContext(AugmentedFormulaNode node) {
        if (!config.isEqualityBinding() || !isInNestedContext(node)) {
            return false;
        }
        AugmentedFormulaNode next = node.getRightSibling();
        while (next != null && next.getType() == NodeType.SPACE) {
            next = next.getRightSibling();
        }
        return next != null && isEquals(next);
    }

    private static boolean isInNestedContext(AugmentedFormulaNode node) {
        for (AugmentedFormulaNode ancestor : node.getAncestors()) {
            if (NESTED_CONTEXT_TYPES.contains(ancestor.getType())) {
                return true;
            }
        }
        return false;
    }

    private static boolean isEquals(AugmentedFormulaNode node) {
        return node instanceof MathSymbol && "=".equals(((MathSymbol) node).getValue());
    }

    private static boolean sameNodes(List<AugmentedFormulaNode> a, List<AugmentedFormulaNode> b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (int i = 0; i < a.size(); i++) {
            if (a.get(i) != b.get(i)) {
                return false;
            }
        }
        return true;
    }
}
