package com.switchyard;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;

import java.time.Clock;
import java.util.Arrays;

@SpringBootApplication
public class SwitchyardApplication {

    public static void main(String[] args) {
        boolean serveMode = isServeMode(args);

        SpringApplicationBuilder builder = new SpringApplicationBuilder(SwitchyardApplication.class);

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

    /** The first positional argument selects the command; only {@code serve} starts the web server. */
    public static boolean isServeMode(String... args) {
        return Arrays.stream(args)
                .filter(a -> !a.startsWith("-"))
                .findFirst()
                .map("serve"::equals)
                .orElse(false);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
