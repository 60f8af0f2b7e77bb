package com.knowledgechain;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KnowledgeChainApplication {

    public static void main(String[] args) {
        SpringApplication.run(KnowledgeChainApplication.class, args);
    }
}
