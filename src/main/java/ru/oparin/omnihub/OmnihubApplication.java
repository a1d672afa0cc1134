package ru.oparin.omnihub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class OmnihubApplication {

    public static void main(String[] args) {
        SpringApplication.run(OmnihubApplication.class, args);
    }
}
