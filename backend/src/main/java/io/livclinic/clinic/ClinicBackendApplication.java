package io.livclinic.clinic;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ClinicBackendApplication {

  public static void main(String[] args) {
    SpringApplication.run(ClinicBackendApplication.class, args);
  }
}
