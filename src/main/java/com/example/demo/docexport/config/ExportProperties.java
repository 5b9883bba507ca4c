package com.example.demo.docexport.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Renderer settings bound from application.yml.
 *
 * Example application.yml:
 *
 * docexport:
 *   html:
 *     title: "MinerU Export"
 *     lang: zh-CN
 *   docx:
 *     image-width-inches: 6
 *     code-font: "Courier New"
 *   latex:
 *     image-width: "0.8\\linewidth"
 *   math:
 *     structural-sanitizer-enabled: true
 */
@Data
@Component
@ConfigurationProperties(prefix = "docexport")
public class ExportProperties {

    private Html html = new Html();

    private Docx docx = new Docx();

    private Latex latex = new Latex();

    private Math math = new Math();

    @Data
    public static class Html {
        private String title = "MinerU Export";

        private String lang = "zh-CN";

        private String mathjaxUrl = "https://cdn.jsdelivr.net/npm/mathjax@3/es5/tex-mml-chtml.js";
    }

    @Data
    public static class Docx {
        /**
         * Width of embedded pictures; height follows the aspect ratio
         */
        private double imageWidthInches = 6.0;

        private String codeFont = "Courier New";

        /**
         * Table style id; applied only when the document defines it
         */
        private String tableStyle = "LightListAccent1";
    }

    @Data
    public static class Latex {
        private String imageWidth = "0.8\\linewidth";

        /**
         * Name of the .tex entry inside the package zip
         */
        private String mainFileName = "main.tex";
    }

    @Data
    public static class Math {
        /**
         * Run the tree-based sanitizer after regex normalization
         */
        private boolean structuralSanitizerEnabled = true;
    }
}
