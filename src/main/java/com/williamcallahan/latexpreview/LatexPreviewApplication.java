package com.williamcallahan.latexpreview;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LatexPreviewApplication {

    public static void main(String[] args) {
        SpringApplication.run(LatexPreviewApplication.class, args);
    }

}
