package com.awesomeposter;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;

import java.util.Arrays;

@SpringBootApplication
public class AwesomePosterApplication {

    public static void main(String[] args) {
        boolean serveMode = Arrays.asList(args).contains("serve");

        SpringApplicationBuilder builder = new SpringApplicationBuilder(AwesomePosterApplication.class);

        if (serveMode) {
            builder.properties(
                    "spring.main.web-application-type=servlet",
                    "spring.main.banner-mode=off"
            );
        } else {
            // CLI-only: no web server
            builder.properties(
                    "spring.main.web-application-type=none",
                    "spring.main.banner-mode=off"
            );
        }

        ApplicationContext ctx = builder.run(args);

        if (!serveMode) {
            ExitCodeGenerator exitCodeGen = ctx.getBean(ExitCodeGenerator.class);
            int exitCode = SpringApplication.exit(ctx, exitCodeGen);
            System.exit(exitCode);
        }
    }
}
