package com.nicedentist.manager;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NiceDentistManagerApplication {

    public static void main(String[] args) {
        SpringApplication.run(NiceDentistManagerApplication.class, args);
    }
}
