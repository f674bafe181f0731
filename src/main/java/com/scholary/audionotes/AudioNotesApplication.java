package com.scholary.audionotes;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class AudioNotesApplication {

  public static void main(String[] args) {
    SpringApplication.run(AudioNotesApplication.class, args);
  }
}
