package com.food.manufacture;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FoodManufactureApplication {

    public static void main(String[] args) {
        SpringApplication.run(FoodManufactureApplication.class, args);
    }
}
