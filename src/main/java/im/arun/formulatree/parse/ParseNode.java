package im.arun.formulatree.parse;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Raw, loosely typed parse node. Which fields are set depends on {@link #type}:
 * <ul>
 *   <li>ords, atoms, spacing: {@code text}</li>
 *   <li>op: {@code text} (the operator name) and {@code limits}</li>
 *   <li>supsub: {@code base}, {@code sub}, {@code sup}</li>
 *   <li>genfrac: {@code numer}, {@code denom}</li>
 *   <li>ordgroup, styling, color, text, mclass, html, font, leftright: {@code body}</li>
 *   <li>enclose, lap, sqrt, horizBrace, accent, overline: {@code base}, plus
 *   {@code label}, colors, {@code index} or {@code over} as needed</li>
 *   <li>array: {@code rows}</li>
 *   <li>htmlmathml: {@code html}</li>
 * </ul>
 */
@Value
@Builder(toBuilder = true)
public class ParseNode {
    ParseNodeType type;
    String text;
    List<ParseNode> body;
    ParseNode base;
    ParseNode sub;
    ParseNode sup;
    ParseNode numer;
    ParseNode denom;
    ParseNode index;
    String color;
    String label;
    String borderColor;
    String backgroundColor;
    boolean over;
    boolean limits;
    String left;
    String right;
    List<List<ParseNode>> rows;
    List<ParseNode> html;
    String htmlId;
    /** Character position in the source where this node starts. */
    int position;

    public static ParseNode symbol(ParseNodeType type, String text, int position) {
        return ParseNode.builder().type(type).text(text).position(position).build();
    }

    public static ParseNode group(ParseNodeType type, List<ParseNode> body, int position) {
        return ParseNode.builder().type(type).body(body).position(position).build();
    }
}
