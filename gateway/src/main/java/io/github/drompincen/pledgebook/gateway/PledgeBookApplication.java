package io.github.drompincen.pledgebook.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.pledgebook")
@EnableMongoRepositories(basePackages = "io.github.drompincen.pledgebook.persistence.repository")
@EnableScheduling
public class PledgeBookApplication {

    public static void main(String[] args) {
        SpringApplication.run(PledgeBookApplication.class, args);
    }
}
