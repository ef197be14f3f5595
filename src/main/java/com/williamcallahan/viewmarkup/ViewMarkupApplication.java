package com.williamcallahan.viewmarkup;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ViewMarkupApplication {

    public static void main(String[] args) {
        SpringApplication.run(ViewMarkupApplication.class, args);
    }

}
