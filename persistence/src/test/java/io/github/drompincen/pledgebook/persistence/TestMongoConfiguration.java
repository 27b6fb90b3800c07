package io.github.drompincen.pledgebook.persistence;

import org.springframework.boot.autoconfigure.EnableAutoConfiguration;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

@Configuration
@EnableAutoConfiguration
@EnableMongoRepositories(basePackages = "io.github.drompincen.pledgebook.persistence.repository")
public class TestMongoConfiguration {

    static {
        // Flapdoodle only ships x86_64 binaries for some MongoDB versions; ARM hosts run them emulated.
        String arch = System.getProperty("os.arch", "");
        if (arch.equals("aarch64") || arch.equals("arm64")) {
            System.setProperty("os.arch", "amd64");
        }
    }
}
