package com.example.pdfstamp;

import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

import java.util.Arrays;

@SpringBootApplication
public class PdfStampApplication {

    public static void main(String[] args) {
        boolean batch = Arrays.stream(args).anyMatch(a -> a.equals("--input") || a.startsWith("--input="));
        new SpringApplicationBuilder(PdfStampApplication.class)
                .web(batch ? WebApplicationType.NONE : WebApplicationType.SERVLET)
                .run(args);
    }
}
