package com.ai.group.Charactle.ml.dto;

/** A rendered tree drawing, ready to embed as a data URI. */
public record TreeDiagram(String image, String format, String encoding) {

    public static TreeDiagram svgBase64(String image) {
        return new TreeDiagram(image, "svg", "base64");
    }
}
