package net.cronengine.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CronEngineApplication {
    public static void main(String[] args) {
        SpringApplication.run(CronEngineApplication.class, args);
    }
}
