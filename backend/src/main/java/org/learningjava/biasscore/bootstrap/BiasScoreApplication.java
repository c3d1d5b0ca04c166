package org.learningjava.biasscore.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "org.learningjava.biasscore")
public class BiasScoreApplication {
    public static void main(String[] args) {
        SpringApplication.run(BiasScoreApplication.class, args);
    }
}
