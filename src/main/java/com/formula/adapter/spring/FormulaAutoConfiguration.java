package com.formula.adapter.spring;

import com.formula.calculator.Calculator;
import com.formula.config.CalculatorConfig;
import com.formula.config.ConfigLoader;
import com.formula.evaluator.FunctionLibrary;
import com.formula.evaluator.MathFunctions;
import com.formula.lr.ParsingTableCache;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for the formula engine.
 */
@Configuration
@ConditionalOnProperty(prefix = "formula", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(FormulaProperties.class)
public class FormulaAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(FormulaAutoConfiguration.class);

    private ParsingTableCache parsingTableCache;
    private Calculator calculator;

    @Bean
    @ConditionalOnMissingBean
    public CalculatorConfig calculatorConfig(FormulaProperties properties) {
        log.info("Loading formula configuration from: {}", properties.getConfigPath());
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public ParsingTableCache parsingTableCache(CalculatorConfig config) {
        this.parsingTableCache = new ParsingTableCache(config.table());
        return this.parsingTableCache;
    }

    @Bean
    @ConditionalOnMissingBean
    public FunctionLibrary functionLibrary() {
        return MathFunctions.standard();
    }

    @Bean
    @ConditionalOnMissingBean
    public Calculator calculator(CalculatorConfig config, ParsingTableCache tableCache, FunctionLibrary functions) {
        log.info("Creating Calculator (max formula length {}, optimization {})",
                config.maxFormulaLength(), config.optimization() ? "on" : "off");
        this.calculator = new Calculator(config, tableCache, functions);
        return this.calculator;
    }

    @PreDestroy
    public void shutdown() {
        if (calculator != null) {
            log.info("Clearing calculator result cache");
            calculator.clearCache();
        }
        if (parsingTableCache != null) {
            log.info("Clearing parsing table cache ({} tables)", parsingTableCache.size());
            parsingTableCache.clear();
        }
    }
}
