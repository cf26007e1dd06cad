package com.comparechain;

import com.comparechain.core.EvaluationContext;
import com.comparechain.core.EvaluationContextFactory;
import com.comparechain.core.ExpressionFunction;
import com.comparechain.engine.CompareChainEngine;
import com.comparechain.engine.CompiledExpression;
import com.comparechain.spring.EnableCompareChain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.time.LocalDate;
import java.util.Map;

/**
 * Example Spring Boot application demonstrating Compare Chain usage.
 */
@SpringBootApplication
@EnableCompareChain
public class CompareChainApplication {

    private static final Logger log = LoggerFactory.getLogger(CompareChainApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(CompareChainApplication.class, args);
    }

    @Bean
    public CommandLineRunner demo(CompareChainEngine engine) {
        return args -> {
            log.info("=== Compare Chain Demo Started ===");

            String json = """
                {
                    "order": { "placed": "2024-03-01", "shipped": "2024-03-04" },
                    "window": { "start": "2024-03-01", "end": "2024-03-31" },
                    "amount": 120.50,
                    "limit": 500
                }
                """;
            Map<String, ExpressionFunction> functions = Map.of(
                    "date", arguments -> LocalDate.parse(arguments.get(0).toString()));
            EvaluationContext context = EvaluationContextFactory.fromJson(json, functions);

            // Plain chains use natural ordering
            CompiledExpression range = engine.compile("0 < amount <= limit");
            log.info("{} -> {}", range, engine.evaluate(range, context));

            // Predefined in compare-chain.yaml
            for (String name : engine.expressionNames()) {
                log.info("Named expression '{}' -> {}", name, engine.evaluateNamed(name, context));
            }

            log.info("=== Compare Chain Demo Finished ===");
        };
    }
}
