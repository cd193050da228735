package com.changefeed.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class RealtimeGatewayApplication {
  public static void main(String[] args) {
    SpringApplication.run(RealtimeGatewayApplication.class, args);
  }
}
