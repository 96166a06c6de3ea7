package io.malicki.retrycommander;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RetryCommanderApplication {

    public static void main(String[] args) {
        SpringApplication.run(RetryCommanderApplication.class, args);
    }
}
