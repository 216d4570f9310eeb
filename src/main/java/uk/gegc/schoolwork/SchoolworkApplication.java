package uk.gegc.schoolwork;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SchoolworkApplication {

    public static void main(String[] args) {
        SpringApplication.run(SchoolworkApplication.class, args);
    }
}
