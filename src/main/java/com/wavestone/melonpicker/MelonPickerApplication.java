package com.wavestone.melonpicker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MelonPickerApplication {

    public static void main(String[] args) {
        SpringApplication.run(MelonPickerApplication.class, args);
    }
}
