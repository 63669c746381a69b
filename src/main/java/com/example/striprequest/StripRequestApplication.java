package com.example.striprequest;

import com.example.striprequest.config.ProbeProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Runs the REST surface. The command line tool is {@link com.example.striprequest.cli.StripRequestCommand}.
 */
@SpringBootApplication
@EnableConfigurationProperties(ProbeProperties.class)
public class StripRequestApplication {

    public static void main(String[] args) {
        SpringApplication.run(StripRequestApplication.class, args);
    }
}
