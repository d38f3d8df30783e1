package io.relayhive.examples.orders;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OrderProcessorApplication {

  public static void main(String[] args) {
    SpringApplication.run(OrderProcessorApplication.class, args);
  }
}
