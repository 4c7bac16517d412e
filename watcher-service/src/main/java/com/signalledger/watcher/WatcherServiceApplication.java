package com.signalledger.watcher;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WatcherServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(WatcherServiceApplication.class, args);
    }
}
