package com.atasa.audio.processor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableAsync
@EnableScheduling
public class AudioProcessorApplication {

  public static void main(String[] args) {
    SpringApplication.run(AudioProcessorApplication.class, args);
  }
}
