package im.arun.formulatree.model;

import im.arun.formulatree.util.RangeUtils;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * A node of the augmented formula tree.
 *
 * <p>Each node owns its children. The parent and sibling links are non-owning back
 * references: a composite attaches itself to its children when it is constructed and
 * {@link AugmentedFormula} rewires the whole tree once it is assembled. Nodes are
 * otherwise immutable; the {@code withX} methods return modified copies.</p>
 */
@Getter
public abstract class AugmentedFormulaNode {

    private final String id;

    /** Identifier of the rendered element, set by the display annotation pass. */
    @Setter
    private String cssId;

    private AugmentedFormulaNode parent;
    private AugmentedFormulaNode leftSibling;
    private AugmentedFormulaNode rightSibling;

    protected AugmentedFormulaNode(String id) {
        this.id = id;
    }

    public abstract NodeType getType();

    /**
     * Owned children in traversal order. Grid variants return their cells row by row.
     */
    public abstract List<AugmentedFormulaNode> getChildren();

    /**
     * Serialize this node.
     *
     * @param mode   serialization mode
     * @param offset position of this node's first character in the caller's output
     * @return the LaTeX fragment and the spans of every id inside it
     */
    public abstract LatexRange toLatex(LatexMode mode, int offset);

    public String toLatex(LatexMode mode) {
        return toLatex(mode, 0).getLatex();
    }

    /**
     * Decompose this node into editor ranges mirroring its {@code NO_ID} LaTeX.
     */
    public abstract List<FormulaLatexRange> toStyledRanges();

    /**
     * Copy of this node under a different structural id.
     */
    public abstract AugmentedFormulaNode withId(String id);

    /**
     * Copy of this subtree that shares no node with it, so attaching the copy elsewhere
     * leaves the back references of this tree untouched. Display ids are kept.
     */
    public AugmentedFormulaNode deepCopy() {
        AugmentedFormulaNode copy = copySubtree();
        copy.cssId = cssId;
        return copy;
    }

    /**
     * New node with the same id and scalar fields over deep copies of the children.
     */
    protected abstract AugmentedFormulaNode copySubtree();

    /**
     * Compare scalar fields and children of two nodes already known to share a type.
     */
    protected abstract boolean matchesSameType(AugmentedFormulaNode other);

    /**
     * Attach this node as parent of its direct children.
     */
    protected abstract void attachChildren();

    /**
     * Structural match: same variant, equal scalar fields, pairwise matching children.
     * Ids and display ids are ignored.
     */
    public boolean matches(AugmentedFormulaNode other) {
        return other != null && other.getType() == getType() && matchesSameType(other);
    }

    public List<AugmentedFormulaNode> getAncestors() {
        List<AugmentedFormulaNode> ancestors = new ArrayList<>();
        for (AugmentedFormulaNode node = parent; node != null; node = node.parent) {
            ancestors.add(node);
        }
        return ancestors;
    }

    public boolean contains(String nodeId) {
        if (id.equals(nodeId)) {
            return true;
        }
        for (AugmentedFormulaNode child : getChildren()) {
            if (child.contains(nodeId)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return getType().label() + "[" + id + "](" + toLatex(LatexMode.NO_ID) + ")";
    }

    void rewireSubtree() {
        attachChildren();
        for (AugmentedFormulaNode child : getChildren()) {
            child.rewireSubtree();
        }
    }

    void detach() {
        parent = null;
        leftSibling = null;
        rightSibling = null;
    }

    protected void adopt(AugmentedFormulaNode child) {
        if (child != null) {
            child.parent = this;
            child.leftSibling = null;
            child.rightSibling = null;
        }
    }

    protected void adoptAll(List<AugmentedFormulaNode> children) {
        linkSiblings(children, this);
    }

    protected void adoptGrid(List<List<AugmentedFormulaNode>> rows) {
        rows.forEach(row -> row.forEach(this::adopt));
    }

    /**
     * Give a list of nodes a common parent and chain their sibling links.
     */
    static void linkSiblings(List<AugmentedFormulaNode> nodes, AugmentedFormulaNode parent) {
        for (int i = 0; i < nodes.size(); i++) {
            AugmentedFormulaNode node = nodes.get(i);
            node.parent = parent;
            node.leftSibling = i > 0 ? nodes.get(i - 1) : null;
            node.rightSibling = i < nodes.size() - 1 ? nodes.get(i + 1) : null;
        }
    }

    /**
     * Copies keep the back references of the node they were derived from until the
     * new owner attaches them.
     */
    protected <T extends AugmentedFormulaNode> T linkedLike(T copy) {
        AugmentedFormulaNode node = copy;
        node.parent = parent;
        node.leftSibling = leftSibling;
        node.rightSibling = rightSibling;
        return copy;
    }

    protected List<LatexRange> latexWithId(LatexMode mode, List<LatexRange> elements) {
        if (mode != LatexMode.RENDER) {
            return elements;
        }
        List<LatexRange> wrapped = new ArrayList<>(elements.size() + 2);
        wrapped.add(LatexRange.literal("\\cssId{" + id + "}{"));
        wrapped.addAll(elements);
        wrapped.add(LatexRange.literal("}"));
        return wrapped;
    }

    protected LatexRange consolidate(List<LatexRange> elements, int offset) {
        return RangeUtils.consolidateRanges(elements, offset, id);
    }

    protected static LatexRange lit(String latex) {
        return LatexRange.literal(latex);
    }

    /**
     * Serialize children at offset 0, separated by the given literal.
     */
    protected static List<LatexRange> joined(List<AugmentedFormulaNode> nodes, LatexMode mode,
                                             String separator) {
        List<LatexRange> elements = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            if (i > 0 && !separator.isEmpty()) {
                elements.add(lit(separator));
            }
            elements.add(nodes.get(i).toLatex(mode, 0));
        }
        return elements;
    }

    protected static List<FormulaLatexRange> joinedStyled(List<AugmentedFormulaNode> nodes, String separator) {
        List<FormulaLatexRange> ranges = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            if (i > 0 && !separator.isEmpty()) {
                ranges.add(new UnstyledRange(separator));
            }
            ranges.addAll(nodes.get(i).toStyledRanges());
        }
        return ranges;
    }

    protected static List<LatexRange> gridLatex(List<List<AugmentedFormulaNode>> rows, LatexMode mode) {
        List<LatexRange> elements = new ArrayList<>();
        for (int r = 0; r < rows.size(); r++) {
            if (r > 0) {
                elements.add(lit(" \\\\ "));
            }
            elements.addAll(joined(rows.get(r), mode, " & "));
        }
        return elements;
    }

    protected static List<FormulaLatexRange> gridStyled(List<List<AugmentedFormulaNode>> rows) {
        List<FormulaLatexRange> ranges = new ArrayList<>();
        for (int r = 0; r < rows.size(); r++) {
            if (r > 0) {
                ranges.add(new UnstyledRange(" \\\\ "));
            }
            ranges.addAll(joinedStyled(rows.get(r), " & "));
        }
        return ranges;
    }

    protected static List<AugmentedFormulaNode> flatten(List<List<AugmentedFormulaNode>> rows) {
        List<AugmentedFormulaNode> cells = new ArrayList<>();
        rows.forEach(cells::addAll);
        return cells;
    }

    protected static AugmentedFormulaNode copyOf(AugmentedFormulaNode node) {
        return node == null ? null : node.deepCopy();
    }

    protected static List<AugmentedFormulaNode> copyAll(List<AugmentedFormulaNode> nodes) {
        List<AugmentedFormulaNode> copies = new ArrayList<>(nodes.size());
        nodes.forEach(node -> copies.add(node.deepCopy()));
        return copies;
    }

    protected static List<List<AugmentedFormulaNode>> copyCells(List<List<AugmentedFormulaNode>> rows) {
        List<List<AugmentedFormulaNode>> copies = new ArrayList<>(rows.size());
        rows.forEach(row -> copies.add(copyAll(row)));
        return copies;
    }

    protected static List<List<AugmentedFormulaNode>> copyGrid(List<List<AugmentedFormulaNode>> rows) {
        List<List<AugmentedFormulaNode>> copy = new ArrayList<>(rows.size());
        rows.forEach(row -> copy.add(List.copyOf(row)));
        return List.copyOf(copy);
    }

    protected static boolean allMatch(List<AugmentedFormulaNode> nodes, List<AugmentedFormulaNode> patterns) {
        if (nodes.size() != patterns.size()) {
            return false;
        }
        for (int i = 0; i < nodes.size(); i++) {
            if (!nodes.get(i).matches(patterns.get(i))) {
                return false;
            }
        }
        return true;
    }

    protected static boolean gridsMatch(List<List<AugmentedFormulaNode>> rows,
                                        List<List<AugmentedFormulaNode>> patterns) {
        if (rows.size() != patterns.size()) {
            return false;
        }
        for (int r = 0; r < rows.size(); r++) {
            if (!allMatch(rows.get(r), patterns.get(r))) {
                return false;
            }
        }
        return true;
    }

    protected static boolean optionalMatches(AugmentedFormulaNode node, AugmentedFormulaNode pattern) {
        if (node == null || pattern == null) {
            return node == null && pattern == null;
        }
        return node.matches(pattern);
    }
}
