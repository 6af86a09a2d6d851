package dev.kappalib;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class KappalibApplication {

    public static void main(String[] args) {
        SpringApplication.run(KappalibApplication.class, args);
    }
}
