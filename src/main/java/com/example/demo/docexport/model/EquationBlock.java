package com.example.demo.docexport.model;

import lombok.Value;

/**
 * A standalone formula. The text is LaTeX, optionally wrapped in display
 * ({@code $$..$$}, {@code \[..\]}) or inline ({@code \(..\)}) delimiters and
 * optionally carrying a {@code \tag{..}}.
 */
@Value
public class EquationBlock implements ContentBlock {
    String text;

    public static EquationBlock of(String text) {
        return new EquationBlock(text == null ? "" : text);
    }

    @Override
    public BlockType getType() {
        return BlockType.EQUATION;
    }
}
