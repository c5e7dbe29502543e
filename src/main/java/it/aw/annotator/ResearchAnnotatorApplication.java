package it.aw.annotator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ResearchAnnotatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ResearchAnnotatorApplication.class, args);
    }
}
