package com.campussso.cloud;

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
public class CloudApplication {

  public static void main(String[] args) {
    SpringApplication.run(CloudApplication.class, args);
  }

  @GetMapping("/")
  public String home() {
    return "cloud-api: ok";
  }
}
