package eu.virtualparadox.retrieval.application.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Configuration
@ConfigurationProperties(prefix = "retrieval")
@Getter @Setter
public class ApplicationConfig {

    private Path root;
    private Path index;
    private Path models;

    @PostConstruct
    public void ensureFolders() throws IOException {
        if (root != null) Files.createDirectories(root);
        if (index != null) Files.createDirectories(index);
        if (models != null) Files.createDirectories(models);
    }
}
