package com.al.hl7siu;

import org.springframework.boot.Banner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Starts the HTTP service, or, when a single file argument is given, runs the
 * command-line converter on that file and exits.
 */
@SpringBootApplication
public class Hl7SiuApplication {

	static final String USAGE = "Usage: java -jar hl7-siu-parser.jar input.hl7";

	public static void main(String[] args) {
		List<String> files = new ArrayList<>();
		for (String arg : args) {
			if (!arg.startsWith("--")) {
				files.add(arg);
			}
		}

		if (files.isEmpty()) {
			SpringApplication.run(Hl7SiuApplication.class, args);
			return;
		}
		if (files.size() > 1) {
			System.err.println(USAGE);
			System.exit(2);
		}

		SpringApplication app = new SpringApplication(Hl7SiuApplication.class);
		app.setWebApplicationType(WebApplicationType.NONE);
		app.setBannerMode(Banner.Mode.OFF);
		app.setLogStartupInfo(false);
		app.setAdditionalProfiles("cli");
		Map<String, Object> cliProperties = new HashMap<>();
		cliProperties.put("app.cli.input", files.get(0));
		app.setDefaultProperties(cliProperties);

		ConfigurableApplicationContext context = app.run(args);
		System.exit(SpringApplication.exit(context));
	}

}
