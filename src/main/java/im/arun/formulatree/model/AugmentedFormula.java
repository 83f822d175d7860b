package im.arun.formulatree.model;

import im.arun.formulatree.util.RangeUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Root container of an augmented formula tree.
 *
 * <p>Owns the top-level nodes and indexes every node by id. Construction performs the
 * one back-reference wiring pass over the whole tree, so the nodes passed in must not
 * belong to another formula. After that the formula is treated as immutable:
 * transformations build a new formula from copies instead of editing this one.</p>
 */
public class AugmentedFormula {
    private final List<AugmentedFormulaNode> children;
    private final Map<String, AugmentedFormulaNode> idToNode = new LinkedHashMap<>();

    public AugmentedFormula(List<AugmentedFormulaNode> children) {
        this.children = List.copyOf(children);
        AugmentedFormulaNode.linkSiblings(this.children, null);
        for (AugmentedFormulaNode child : this.children) {
            child.rewireSubtree();
            index(child);
        }
    }

    private void index(AugmentedFormulaNode node) {
        idToNode.putIfAbsent(node.getId(), node);
        node.getChildren().forEach(this::index);
    }

    public List<AugmentedFormulaNode> getChildren() {
        return children;
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    /**
     * Node with the given structural id, or null.
     */
    public AugmentedFormulaNode findNode(String id) {
        return idToNode.get(id);
    }

    /** Read-only id index in traversal order. */
    public Map<String, AugmentedFormulaNode> getIdIndex() {
        return Collections.unmodifiableMap(idToNode);
    }

    /**
     * All nodes in preorder.
     */
    public List<AugmentedFormulaNode> allNodes() {
        List<AugmentedFormulaNode> nodes = new ArrayList<>();
        children.forEach(child -> collect(child, nodes));
        return nodes;
    }

    private static void collect(AugmentedFormulaNode node, List<AugmentedFormulaNode> nodes) {
        nodes.add(node);
        node.getChildren().forEach(child -> collect(child, nodes));
    }

    public String toLatex(LatexMode mode) {
        return toLatexRanges(mode).getLatex();
    }

    /**
     * Serialize every top-level node followed by a single space.
     */
    public LatexRange toLatexRanges(LatexMode mode) {
        List<LatexRange> elements = new ArrayList<>(children.size() * 2);
        for (AugmentedFormulaNode child : children) {
            elements.add(child.toLatex(mode, 0));
            elements.add(LatexRange.literal(" "));
        }
        return RangeUtils.consolidateRanges(elements, 0);
    }

    public FormulaLatexRanges toStyledRanges() {
        List<FormulaLatexRange> ranges = new ArrayList<>();
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) {
                ranges.add(new UnstyledRange(" "));
            }
            ranges.addAll(children.get(i).toStyledRanges());
        }
        return new FormulaLatexRanges(ranges);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AugmentedFormula)) {
            return false;
        }
        return toLatex(LatexMode.NO_ID).equals(((AugmentedFormula) o).toLatex(LatexMode.NO_ID));
    }

    @Override
    public int hashCode() {
        return Objects.hash(toLatex(LatexMode.NO_ID));
    }

    @Override
    public String toString() {
        return "AugmentedFormula(" + toLatex(LatexMode.NO_ID).trim() + ")";
    }
}
