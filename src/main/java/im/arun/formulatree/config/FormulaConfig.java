package im.arun.formulatree.config;

import lombok.Data;

@Data
public class FormulaConfig {
    private int maxNestingDepth = 128;
    private String syntheticVariablePrefix = "var";
    private String syntheticGroupPrefix = "group";
    private String equalityVariablePrefix = "var-eq";
    private boolean equalityBinding = true;
    private String variableCssClass = "formula-var-base";
}
