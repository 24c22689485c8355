package eu.virtualparadox.retrieval;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RetrievalApplication {

    public static void main(final String[] args) {
        SpringApplication.run(RetrievalApplication.class, args);
    }
}
