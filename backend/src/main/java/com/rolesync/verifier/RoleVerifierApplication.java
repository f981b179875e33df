package com.rolesync.verifier;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class RoleVerifierApplication {

  public static void main(String[] args) {
    SpringApplication.run(RoleVerifierApplication.class, args);
  }
}
