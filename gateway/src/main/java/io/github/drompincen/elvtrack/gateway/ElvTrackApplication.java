package io.github.drompincen.elvtrack.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.elvtrack")
@EnableMongoRepositories(basePackages = "io.github.drompincen.elvtrack.persistence.repository")
public class ElvTrackApplication {

    public static void main(String[] args) {
        SpringApplication.run(ElvTrackApplication.class, args);
    }
}
