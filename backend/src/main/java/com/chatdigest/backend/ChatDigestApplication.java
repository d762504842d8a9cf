package com.chatdigest.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ChatDigestApplication {

  public static void main(String[] args) {
    ConfigurableApplicationContext context = SpringApplication.run(ChatDigestApplication.class, args);
    if (context.getEnvironment().getProperty("app.digest.cli.enabled", Boolean.class, false)) {
      System.exit(SpringApplication.exit(context));
    }
  }
}
