package com.overseer.monitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MachineMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(MachineMonitorApplication.class, args);
    }

}
