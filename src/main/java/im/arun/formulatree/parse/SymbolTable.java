package im.arun.formulatree.parse;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Command and character tables for the LaTeX parser.
 */
public final class SymbolTable {

    private static final Map<String, ParseNodeType> SYMBOLS = new HashMap<>();
    private static final Map<String, Boolean> OPERATOR_LIMITS = new HashMap<>();

    static {
        for (String greek : new String[]{
                "alpha", "beta", "gamma", "delta", "epsilon", "varepsilon", "zeta", "eta", "theta",
                "vartheta", "iota", "kappa", "lambda", "mu", "nu", "xi", "pi", "varpi", "rho", "varrho",
                "sigma", "varsigma", "tau", "upsilon", "phi", "varphi", "chi", "psi", "omega",
                "Gamma", "Delta", "Theta", "Lambda", "Xi", "Pi", "Sigma", "Upsilon", "Phi", "Psi", "Omega",
                "ell", "hbar", "imath", "jmath", "wp", "Re", "Im", "aleph"}) {
            SYMBOLS.put("\\" + greek, ParseNodeType.MATHORD);
        }
        for (String ord : new String[]{
                "infty", "partial", "nabla", "prime", "emptyset", "varnothing", "forall", "exists",
                "neg", "lnot", "ldots", "cdots", "vdots", "ddots", "dots", "angle", "triangle", "top",
                "bot", "checkmark", "dagger", "S", "P", "%", "$", "#", "&", "_", "surd", "flat", "sharp"}) {
            SYMBOLS.put("\\" + ord, ParseNodeType.TEXTORD);
        }
        for (String atom : new String[]{
                // binary operators
                "pm", "mp", "times", "div", "cdot", "ast", "star", "circ", "bullet", "oplus", "ominus",
                "otimes", "oslash", "odot", "cup", "cap", "setminus", "wedge", "vee", "land", "lor",
                // relations
                "leq", "le", "geq", "ge", "ll", "gg", "approx", "sim", "simeq", "cong", "equiv",
                "propto", "in", "ni", "notin", "subset", "supset", "subseteq", "supseteq", "mid", "parallel",
                "perp", "to", "rightarrow", "leftarrow", "leftrightarrow", "Rightarrow", "Leftarrow",
                "Leftrightarrow", "implies", "iff", "mapsto", "gets", "models", "vdash", "coloneqq",
                // delimiters and punctuation
                "{", "}", "langle", "rangle", "lvert", "rvert", "lVert", "rVert", "|", "vert", "Vert",
                "lfloor", "rfloor", "lceil", "rceil", "colon", "backslash"}) {
            SYMBOLS.put("\\" + atom, ParseNodeType.ATOM);
        }

        for (String op : new String[]{
                "sum", "prod", "coprod", "bigcup", "bigcap", "bigvee", "bigwedge", "bigoplus", "bigotimes",
                "bigodot", "bigsqcup", "lim", "limsup", "liminf", "max", "min", "sup", "inf", "det", "gcd",
                "Pr", "argmax", "argmin"}) {
            OPERATOR_LIMITS.put("\\" + op, true);
        }
        for (String op : new String[]{
                "int", "iint", "iiint", "oint", "sin", "cos", "tan", "cot", "sec", "csc", "arcsin", "arccos",
                "arctan", "sinh", "cosh", "tanh", "coth", "log", "ln", "lg", "exp", "dim", "ker", "deg",
                "arg", "hom"}) {
            OPERATOR_LIMITS.put("\\" + op, false);
        }
    }

    public static final Set<String> FRACTIONS = Set.of("\\frac", "\\dfrac", "\\tfrac", "\\cfrac");

    public static final Set<String> ACCENTS = Set.of(
            "\\hat", "\\widehat", "\\bar", "\\vec", "\\tilde", "\\widetilde", "\\dot", "\\ddot", "\\check",
            "\\breve", "\\acute", "\\grave", "\\mathring", "\\overrightarrow", "\\overleftarrow");

    public static final Set<String> ENCLOSES = Set.of(
            "\\cancel", "\\bcancel", "\\xcancel", "\\sout", "\\boxed");

    public static final Set<String> SPACING = Set.of(
            "\\,", "\\:", "\\;", "\\!", "\\>", "\\ ", "\\quad", "\\qquad", "\\thinspace", "\\medspace",
            "\\thickspace", "\\enspace");

    public static final Set<String> TEXT = Set.of("\\text", "\\textrm", "\\textnormal", "\\mbox");

    public static final Set<String> FONTS = Set.of(
            "\\mathrm", "\\mathbf", "\\mathit", "\\mathsf", "\\mathtt", "\\mathcal", "\\mathbb",
            "\\mathfrak", "\\mathscr", "\\boldsymbol", "\\bm");

    public static final Set<String> MATH_CLASSES = Set.of(
            "\\mathrel", "\\mathbin", "\\mathop", "\\mathord", "\\mathopen", "\\mathclose",
            "\\mathpunct", "\\mathinner");

    public static final Set<String> LAPS = Set.of(
            "\\rlap", "\\llap", "\\clap", "\\mathrlap", "\\mathllap", "\\mathclap");

    public static final Set<String> STYLES = Set.of(
            "\\displaystyle", "\\textstyle", "\\scriptstyle", "\\scriptscriptstyle");

    public static final Set<String> HTML_IDS = Set.of("\\htmlId", "\\cssId");

    /** Commands that render as a negated relation through an html alternative. */
    public static final Map<String, String> NEGATIONS = Map.of("\\neq", "=", "\\ne", "=");

    private static final String ATOM_CHARS = "+-*=<>()[],;:!?";

    private SymbolTable() {
    }

    /**
     * Parse node type of a plain symbol command, or null when the command is not one.
     */
    public static ParseNodeType symbolType(String command) {
        return SYMBOLS.get(command);
    }

    public static boolean isOperator(String command) {
        return OPERATOR_LIMITS.containsKey(command);
    }

    /** Whether the operator places its scripts above and below by default. */
    public static boolean defaultLimits(String command) {
        return OPERATOR_LIMITS.getOrDefault(command, false);
    }

    /**
     * Parse node type of a single math-mode character.
     */
    public static ParseNodeType charType(char c) {
        if (Character.isLetter(c)) {
            return ParseNodeType.MATHORD;
        }
        if (ATOM_CHARS.indexOf(c) >= 0) {
            return ParseNodeType.ATOM;
        }
        return ParseNodeType.TEXTORD;
    }
}
