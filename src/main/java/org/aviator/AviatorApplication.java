package org.aviator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling  // pour la surveillance des rounds bloqués
public class AviatorApplication {
    public static void main(String[] args) {
        SpringApplication.run(AviatorApplication.class, args);
    }
}
