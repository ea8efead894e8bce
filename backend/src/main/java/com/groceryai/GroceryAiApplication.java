package com.groceryai;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Grocery AI - grocery list extraction service.
 */
@SpringBootApplication
public class GroceryAiApplication {

    public static void main(String[] args) {
        SpringApplication.run(GroceryAiApplication.class, args);
    }
}
