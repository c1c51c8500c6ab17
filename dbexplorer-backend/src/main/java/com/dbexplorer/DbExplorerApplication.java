package com.dbexplorer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DbExplorerApplication {

    public static void main(String[] args) {
        SpringApplication.run(DbExplorerApplication.class, args);
    }
}
