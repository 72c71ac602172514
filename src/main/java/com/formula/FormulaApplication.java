package com.formula;

import com.formula.calculator.CalculationRequest;
import com.formula.calculator.CalculationResult;
import com.formula.calculator.Calculator;
import com.formula.calculator.VariableBindings;
import com.formula.spring.EnableFormula;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.util.List;
import java.util.Map;

/**
 * Example Spring Boot application demonstrating formula calculation.
 */
@SpringBootApplication
@EnableFormula
public class FormulaApplication {

    private static final Logger log = LoggerFactory.getLogger(FormulaApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(FormulaApplication.class, args);
    }

    @Bean
    public CommandLineRunner demo(Calculator calculator) {
        return args -> {
            log.info("=== Formula Demo Started ===");

            // Bindings as a JSON payload; nested objects become names such as grade_math
            String json = """
                {
                    "grade": {
                        "korean": 4, "math": 5, "english": 3
                    },
                    "absent_days": 2,
                    "volunteer_hours": 18
                }
                """;
            Map<String, Object> variables = VariableBindings.fromJson(json);

            List<String> formulas = List.of(
                    "2 + 3 * 4",
                    "(grade_korean + grade_math + grade_english) / 3",
                    "IF(absent_days >= 5, 10, IF(absent_days >= 1, 14, 15))",
                    "MIN(volunteer_hours, 15) + ROUND(SQRT(2), 3)",
                    "3 + + 4");
            for (String formula : formulas) {
                CalculationResult result = calculator.calculate(new CalculationRequest(formula, variables));
                if (result.isSuccess()) {
                    log.info("{} = {} (as {})", formula, result.result(), result.formatted());
                } else {
                    log.info("{} failed: {}", formula, result.errors());
                }
            }

            List<CalculationResult> steps = calculator.calculateMultiStep(List.of(
                    "(grade_korean + grade_math + grade_english) / 3",
                    "step1 * 8",
                    "step2 + IF(volunteer_hours > 15, 15, volunteer_hours)"), variables);
            log.info("Multi-step total: {}", steps.get(steps.size() - 1).toJson());

            log.info("Statistics: {}", calculator.getStatistics());
            log.info("=== Formula Demo Completed ===");
        };
    }
}
