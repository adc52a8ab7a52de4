package com.vidnyan.codequest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * CodeQuest - turns a source tree into a call graph and a sequence of learning levels.
 */
@SpringBootApplication
public class CodeQuestApplication {

    public static void main(String[] args) {
        SpringApplication.run(CodeQuestApplication.class, args);
    }
}
