package com.opsrunner.app;

import org.springframework.boot.Banner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.ArrayList;
import java.util.List;

/**
 * Main application entry point for the runner.
 *
 * <pre>
 * java -jar opsrunner-app.jar [--config=config.yaml] [--workflow=deploy.json] [--upload=report.txt] [--verbose]
 * </pre>
 */
@SpringBootApplication
public class RunnerApplication {

    static final String DEFAULT_CONFIG = "config.yaml";

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(RunnerApplication.class);
        application.setWebApplicationType(WebApplicationType.NONE);
        application.setBannerMode(Banner.Mode.OFF);
        System.exit(SpringApplication.exit(application.run(translateArguments(args))));
    }

    /**
     * Map the runner's own flags onto Spring Boot properties: {@code --config}
     * becomes an optional extra config location, {@code --verbose} turns on
     * DEBUG logging for the runner's packages.
     */
    static String[] translateArguments(String[] args) {
        List<String> translated = new ArrayList<>();
        String config = DEFAULT_CONFIG;
        for (String arg : args) {
            if (arg.startsWith("--config=")) {
                config = arg.substring("--config=".length());
            } else if (arg.equals("--verbose") || arg.equals("-v")) {
                translated.add("--logging.level.com.opsrunner=DEBUG");
            } else {
                translated.add(arg);
            }
        }
        translated.add("--spring.config.additional-location=optional:file:" + config);
        return translated.toArray(String[]::new);
    }
}
