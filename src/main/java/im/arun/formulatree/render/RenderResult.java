package im.arun.formulatree.render;

import lombok.Value;

@Value
public class RenderResult {
    String latex;
    String output;
}
