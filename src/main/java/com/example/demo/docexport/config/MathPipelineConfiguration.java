package com.example.demo.docexport.config;

import com.example.demo.docexport.latex.MathExpressionPipeline;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class MathPipelineConfiguration {

    @Bean
    public MathExpressionPipeline mathExpressionPipeline(ExportProperties properties) {
        boolean structural = properties.getMath().isStructuralSanitizerEnabled();
        log.info("Math pipeline: token normalizer{}", structural ? " + structural sanitizer" : " only");
        return structural
                ? MathExpressionPipeline.withStructuralSanitizer()
                : MathExpressionPipeline.normalizerOnly();
    }
}
