package tech.noetzold.screening_api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ScreeningApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScreeningApiApplication.class, args);
    }
}
