package com.example.pdfmerge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Application entry point of the PDF merge service.
 * Only wires the application context; the HTTP endpoints live under the interfaces layer.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class PdfMergeApplication {

    /**
     * Boots the Spring container.
     *
     * @param args optional command line arguments passed by the JVM
     */
    public static void main(String[] args) {
        SpringApplication.run(PdfMergeApplication.class, args);
    }

}
