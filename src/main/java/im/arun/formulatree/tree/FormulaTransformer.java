package im.arun.formulatree.tree;

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
import im.arun.formulatree.model.Matrix;
import im.arun.formulatree.model.Root;
import im.arun.formulatree.model.Script;
import im.arun.formulatree.model.Strikethrough;
import im.arun.formulatree.model.Text;
import im.arun.formulatree.model.Variable;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Whole-tree rewrites used by editing tools.
 *
 * <p>Every method returns a new formula built from copies of the input's nodes, so
 * the input keeps its own links and stays usable.</p>
 */
public final class FormulaTransformer {

    private FormulaTransformer() {
    }

    /**
     * Apply {@code replacer} to every node bottom-up, then drop empty groups and
     * renumber ids.
     *
     * @param replacer receives a copy of each node after its children have been replaced; returns
     *                 the node itself or a replacement
     * @throws TreeBuildException if the rewrite leaves an empty group where exactly one
     *                            node is required
     */
    public static AugmentedFormula replaceNodes(AugmentedFormula formula,
                                                UnaryOperator<AugmentedFormulaNode> replacer) {
        List<AugmentedFormulaNode> replaced = new ArrayList<>();
        for (AugmentedFormulaNode child : formula.getChildren()) {
            replaced.add(replaceNode(child.deepCopy(), replacer));
        }
        return normalizeIds(removeEmptyGroups(new AugmentedFormula(replaced)));
    }

    private static AugmentedFormulaNode replaceNode(AugmentedFormulaNode node,
                                                    UnaryOperator<AugmentedFormulaNode> replacer) {
        switch (node.getType()) {
            case SCRIPT: {
                Script script = (Script) node;
                return replacer.apply(script.withParts(script.getId(),
                        replaceNode(script.getBase(), replacer),
                        script.getSub() == null ? null : replaceNode(script.getSub(), replacer),
                        script.getSup() == null ? null : replaceNode(script.getSup(), replacer)));
            }
            case FRACTION: {
                Fraction fraction = (Fraction) node;
                return replacer.apply(fraction.withParts(fraction.getId(),
                        replaceNode(fraction.getNumerator(), replacer),
                        replaceNode(fraction.getDenominator(), replacer)));
            }
            case ROOT: {
                Root root = (Root) node;
                return replacer.apply(root.withParts(root.getId(),
                        replaceNode(root.getBody(), replacer),
                        root.getIndex() == null ? null : replaceNode(root.getIndex(), replacer)));
            }
            case SYMBOL:
            case SPACE:
            case OP:
                return replacer.apply(node);
            case GROUP:
                return replacer.apply(((Group) node).withBody(replaceAll(((Group) node).getBody(), replacer)));
            case COLOR:
                return replacer.apply(((Color) node).withBody(replaceAll(((Color) node).getBody(), replacer)));
            case TEXT:
                return replacer.apply(((Text) node).withBody(replaceAll(((Text) node).getBody(), replacer)));
            case DELIMITED:
                return replacer.apply(((Delimited) node).withBody(
                        replaceAll(((Delimited) node).getBody(), replacer)));
            case BOX:
                return replacer.apply(((Box) node).withBody(replaceNode(((Box) node).getBody(), replacer)));
            case BRACE:
                return replacer.apply(((Brace) node).withBase(replaceNode(((Brace) node).getBase(), replacer)));
            case ACCENT:
                return replacer.apply(((Accent) node).withBase(replaceNode(((Accent) node).getBase(), replacer)));
            case STRIKETHROUGH:
                return replacer.apply(((Strikethrough) node).withBody(
                        replaceNode(((Strikethrough) node).getBody(), replacer)));
            case VARIABLE:
                return replacer.apply(((Variable) node).withBody(
                        replaceNode(((Variable) node).getBody(), replacer)));
            case ARRAY:
                return replacer.apply(((Aligned) node).withBody(replaceGrid(((Aligned) node).getBody(), replacer)));
            case MATRIX:
                return replacer.apply(((Matrix) node).withBody(replaceGrid(((Matrix) node).getBody(), replacer)));
            default:
                throw new IllegalStateException("Unhandled node type: " + node.getType());
        }
    }

    private static List<AugmentedFormulaNode> replaceAll(List<AugmentedFormulaNode> nodes,
                                                         UnaryOperator<AugmentedFormulaNode> replacer) {
        List<AugmentedFormulaNode> replaced = new ArrayList<>(nodes.size());
        for (AugmentedFormulaNode node : nodes) {
            replaced.add(replaceNode(node, replacer));
        }
        return replaced;
    }

    private static List<List<AugmentedFormulaNode>> replaceGrid(List<List<AugmentedFormulaNode>> rows,
                                                                UnaryOperator<AugmentedFormulaNode> replacer) {
        List<List<AugmentedFormulaNode>> replaced = new ArrayList<>(rows.size());
        for (List<AugmentedFormulaNode> row : rows) {
            replaced.add(replaceAll(row, replacer));
        }
        return replaced;
    }

    /**
     * Reassign structural ids the way {@link FormulaTreeBuilder} numbers a fresh tree.
     */
    public static AugmentedFormula normalizeIds(AugmentedFormula formula) {
        List<AugmentedFormulaNode> children = new ArrayList<>();
        for (int i = 0; i < formula.getChildren().size(); i++) {
            children.add(reassignIds(formula.getChildren().get(i).deepCopy(), String.valueOf(i)));
        }
        return new AugmentedFormula(children);
    }

    private static AugmentedFormulaNode reassignIds(AugmentedFormulaNode node, String id) {
        switch (node.getType()) {
            case SCRIPT: {
                Script script = (Script) node;
                return script.withParts(id,
                        reassignIds(script.getBase(), id + ".base"),
                        script.getSub() == null ? null : reassignIds(script.getSub(), id + ".sub"),
                        script.getSup() == null ? null : reassignIds(script.getSup(), id + ".sup"));
            }
            case FRACTION: {
                Fraction fraction = (Fraction) node;
                return fraction.withParts(id,
                        reassignIds(fraction.getNumerator(), id + ".numer"),
                        reassignIds(fraction.getDenominator(), id + ".denom"));
            }
            case ROOT: {
                Root root = (Root) node;
                return root.withParts(id,
                        reassignIds(root.getBody(), id + ".body"),
                        root.getIndex() == null ? null : reassignIds(root.getIndex(), id + ".index"));
            }
            case SYMBOL:
            case SPACE:
            case OP:
                return node.withId(id);
            case GROUP:
                return ((Group) node).withId(id).withBody(reassignAll(((Group) node).getBody(), id));
            case COLOR:
                return ((Color) node).withId(id).withBody(reassignAll(((Color) node).getBody(), id));
            case TEXT:
                return ((Text) node).withId(id).withBody(reassignAll(((Text) node).getBody(), id));
            case DELIMITED:
                return ((Delimited) node).withId(id).withBody(reassignAll(((Delimited) node).getBody(), id));
            case BOX:
                return ((Box) node).withId(id).withBody(reassignIds(((Box) node).getBody(), id + ".body"));
            case BRACE:
                return ((Brace) node).withId(id).withBase(reassignIds(((Brace) node).getBase(), id + ".base"));
            case ACCENT:
                return ((Accent) node).withId(id).withBase(reassignIds(((Accent) node).getBase(), id + ".base"));
            case STRIKETHROUGH:
                return ((Strikethrough) node).withId(id)
                        .withBody(reassignIds(((Strikethrough) node).getBody(), id + ".body"));
            case VARIABLE:
                return ((Variable) node).withId(id).withBody(reassignIds(((Variable) node).getBody(), id + ".body"));
            case ARRAY:
                return ((Aligned) node).withId(id).withBody(reassignGrid(((Aligned) node).getBody(), id));
            case MATRIX:
                return ((Matrix) node).withId(id).withBody(reassignGrid(((Matrix) node).getBody(), id));
            default:
                throw new IllegalStateException("Unhandled node type: " + node.getType());
        }
    }

    private static List<AugmentedFormulaNode> reassignAll(List<AugmentedFormulaNode> nodes, String id) {
        List<AugmentedFormulaNode> reassigned = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            reassigned.add(reassignIds(nodes.get(i), id + "." + i));
        }
        return reassigned;
    }

    private static List<List<AugmentedFormulaNode>> reassignGrid(List<List<AugmentedFormulaNode>> rows, String id) {
        List<List<AugmentedFormulaNode>> reassigned = new ArrayList<>(rows.size());
        for (int r = 0; r < rows.size(); r++) {
            List<AugmentedFormulaNode> row = rows.get(r);
            List<AugmentedFormulaNode> cells = new ArrayList<>(row.size());
            for (int c = 0; c < row.size(); c++) {
                cells.add(reassignIds(row.get(c), id + "." + r + "." + c));
            }
            reassigned.add(cells);
        }
        return reassigned;
    }

    /**
     * Drop empty groups from list bodies. Inside array and matrix cells an empty group
     * marks an empty column and is kept.
     *
     * @throws TreeBuildException if an empty group fills a slot that needs exactly one
     *                            node, or a list body would become empty
     */
    public static AugmentedFormula removeEmptyGroups(AugmentedFormula formula) {
        List<AugmentedFormulaNode> children = new ArrayList<>();
        for (AugmentedFormulaNode child : formula.getChildren()) {
            children.addAll(removeEmptyGroup(child.deepCopy()));
        }
        return new AugmentedFormula(children);
    }

    private static List<AugmentedFormulaNode> removeEmptyGroup(AugmentedFormulaNode node) {
        switch (node.getType()) {
            case GROUP: {
                Group group = (Group) node;
                if (group.getBody().isEmpty()) {
                    return List.of();
                }
                return List.of(group.withBody(atLeastOne(removeFromAll(group.getBody()))));
            }
            case SCRIPT: {
                Script script = (Script) node;
                return List.of(script.withParts(script.getId(),
                        exactlyOne(removeEmptyGroup(script.getBase())),
                        script.getSub() == null ? null : exactlyOne(removeEmptyGroup(script.getSub())),
                        script.getSup() == null ? null : exactlyOne(removeEmptyGroup(script.getSup()))));
            }
            case FRACTION: {
                Fraction fraction = (Fraction) node;
                return List.of(fraction.withParts(fraction.getId(),
                        exactlyOne(removeEmptyGroup(fraction.getNumerator())),
                        exactlyOne(removeEmptyGroup(fraction.getDenominator()))));
            }
            case ROOT: {
                Root root = (Root) node;
                return List.of(root.withParts(root.getId(),
                        exactlyOne(removeEmptyGroup(root.getBody())),
                        root.getIndex() == null ? null : exactlyOne(removeEmptyGroup(root.getIndex()))));
            }
            case SYMBOL:
            case SPACE:
            case OP:
                return List.of(node);
            case COLOR:
                return List.of(((Color) node).withBody(atLeastOne(removeFromAll(((Color) node).getBody()))));
            case TEXT:
                return List.of(((Text) node).withBody(atLeastOne(removeFromAll(((Text) node).getBody()))));
            case DELIMITED:
                // \left( \right) is legitimately empty.
                return List.of(((Delimited) node).withBody(removeFromAll(((Delimited) node).getBody())));
            case BOX:
                return List.of(((Box) node).withBody(exactlyOne(removeEmptyGroup(((Box) node).getBody()))));
            case BRACE:
                return List.of(((Brace) node).withBase(exactlyOne(removeEmptyGroup(((Brace) node).getBase()))));
            case ACCENT:
                return List.of(((Accent) node).withBase(exactlyOne(removeEmptyGroup(((Accent) node).getBase()))));
            case STRIKETHROUGH:
                return List.of(((Strikethrough) node).withBody(
                        exactlyOne(removeEmptyGroup(((Strikethrough) node).getBody()))));
            case VARIABLE:
                return List.of(((Variable) node).withBody(
                        exactlyOne(removeEmptyGroup(((Variable) node).getBody()))));
            case ARRAY:
                return List.of(((Aligned) node).withBody(removeFromGrid(((Aligned) node).getBody())));
            case MATRIX:
                return List.of(((Matrix) node).withBody(removeFromGrid(((Matrix) node).getBody())));
            default:
                throw new IllegalStateException("Unhandled node type: " + node.getType());
        }
    }

    private static List<AugmentedFormulaNode> removeFromAll(List<AugmentedFormulaNode> nodes) {
        List<AugmentedFormulaNode> kept = new ArrayList<>(nodes.size());
        for (AugmentedFormulaNode node : nodes) {
            kept.addAll(removeEmptyGroup(node));
        }
        return kept;
    }

    private static List<List<AugmentedFormulaNode>> removeFromGrid(List<List<AugmentedFormulaNode>> rows) {
        List<List<AugmentedFormulaNode>> kept = new ArrayList<>(rows.size());
        for (List<AugmentedFormulaNode> row : rows) {
            List<AugmentedFormulaNode> cells = new ArrayList<>(row.size());
            for (AugmentedFormulaNode cell : row) {
                if (cell instanceof Group && ((Group) cell).getBody().isEmpty()) {
                    cells.add(cell);
                } else {
                    cells.addAll(removeEmptyGroup(cell));
                }
            }
            kept.add(atLeastOne(cells));
        }
        return kept;
    }

    private static AugmentedFormulaNode exactlyOne(List<AugmentedFormulaNode> nodes) {
        if (nodes.size() != 1) {
            throw new TreeBuildException("Expected exactly one element, got " + nodes.size());
        }
        return nodes.get(0);
    }

    private static List<AugmentedFormulaNode> atLeastOne(List<AugmentedFormulaNode> nodes) {
        if (nodes.isEmpty()) {
            throw new TreeBuildException("Expected at least one element, got 0");
        }
        return nodes;
    }
}
