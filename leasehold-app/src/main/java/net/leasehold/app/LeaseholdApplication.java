package net.leasehold.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class LeaseholdApplication {
    public static void main(String[] args) {
        SpringApplication.run(LeaseholdApplication.class, args);
    }
}
