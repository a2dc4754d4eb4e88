package io.b2mash.precioustime;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PreciousTimeApplication {

  public static void main(String[] args) {
    SpringApplication.run(PreciousTimeApplication.class, args);
  }
}
