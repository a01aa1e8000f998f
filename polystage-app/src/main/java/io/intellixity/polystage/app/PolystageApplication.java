package io.intellixity.polystage.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;
import org.springframework.boot.autoconfigure.neo4j.Neo4jAutoConfiguration;

/** Backend clients are built by {@code PolystageConfig}; Boot's own client auto-configuration stays off. */
@SpringBootApplication(exclude = {
    DataSourceAutoConfiguration.class,
    MongoAutoConfiguration.class,
    Neo4jAutoConfiguration.class
})
public class PolystageApplication {
  public static void main(String[] args) {
    SpringApplication.run(PolystageApplication.class, args);
  }
}
