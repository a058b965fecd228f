package dev.sqljudge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the sqljudge evaluator.
 *
 * <p>Set {@code sqljudge.eval.enabled=true} to run a benchmark on startup; see {@code
 * application.yml} for dataset locations and database settings.
 */
@SpringBootApplication
public class SqlJudgeApplication {
    public static void main(String[] args) {
        SpringApplication.run(SqlJudgeApplication.class, args);
    }
}
