package com.flightmail.backend;

import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.SpringApplication;

@SpringBootApplication
public class FlightMailApplication {

  public static void main(String[] args) {
    SpringApplication.run(FlightMailApplication.class, args);
  }

}
