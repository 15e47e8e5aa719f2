package com.campussso.academic;

import com.campussso.bridge.config.SessionBridgeConfig;
import com.campussso.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@SpringBootApplication
@Import({TimeConfig.class, SessionBridgeConfig.class})
@RestController
public class AcademicApplication {

  public static void main(String[] args) {
    SpringApplication.run(AcademicApplication.class, args);
  }

  @GetMapping("/")
  public String home() {
    return "academic-api: ok";
  }
}
