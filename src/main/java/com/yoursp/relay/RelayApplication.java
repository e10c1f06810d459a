package com.yoursp.relay;

import com.yoursp.relay.modules.integrity.IntegrityCheckRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.Arrays;

/**
 * Entry point. Serves the HTTP surface by default; started with
 * {@code --integrity-check} it runs one integrity audit batch and exits.
 */
@SpringBootApplication
public class RelayApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(RelayApplication.class);
        boolean batch = Arrays.asList(args).contains("--" + IntegrityCheckRunner.OPTION);
        if (batch) {
            application.setWebApplicationType(WebApplicationType.NONE);
        }

        ConfigurableApplicationContext context = application.run(args);
        if (batch) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
