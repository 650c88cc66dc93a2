package com.smarttodo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SmartTodoApplication {

    public static void main(String[] args) {
        SpringApplication.run(SmartTodoApplication.class, args);
    }

}
