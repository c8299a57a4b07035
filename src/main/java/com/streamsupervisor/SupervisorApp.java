package com.streamsupervisor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SupervisorApp {
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(SupervisorApp.class);
        app.addListeners(new SignalExitHandler());
        app.run(args);
    }
}
