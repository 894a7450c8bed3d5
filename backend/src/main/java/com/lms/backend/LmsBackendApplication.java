package com.lms.backend;

import java.util.Arrays;
import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
public class LmsBackendApplication {

	static final String SCHEDULER_OFF = "--lms.inactivity.scheduler.enabled=false";

	public static void main(String[] args) {
		// Fix default JVM timezone to UTC for consistent logs/schedules
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));

		boolean commandMode = isCommandMode(args);
		ConfigurableApplicationContext context = SpringApplication.run(
				LmsBackendApplication.class, launchArgs(args));
		if (commandMode) {
			System.exit(SpringApplication.exit(context));
		}
	}

	static boolean isCommandMode(String[] args) {
		return Arrays.stream(args).anyMatch(arg -> !arg.startsWith("--"));
	}

	/**
	 * One-shot commands must not race the daily trigger, so command mode switches the scheduler off
	 * through a command-line property, which outranks every configuration file.
	 */
	static String[] launchArgs(String[] args) {
		if (!isCommandMode(args)) {
			return args;
		}
		String[] launch = Arrays.copyOf(args, args.length + 1);
		launch[args.length] = SCHEDULER_OFF;
		return launch;
	}

}
