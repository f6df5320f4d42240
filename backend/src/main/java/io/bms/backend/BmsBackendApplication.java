package io.bms.backend;

import io.bms.backend.billing.BillingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(BillingProperties.class)
public class BmsBackendApplication {

  public static void main(String[] args) {
    SpringApplication.run(BmsBackendApplication.class, args);
  }
}
