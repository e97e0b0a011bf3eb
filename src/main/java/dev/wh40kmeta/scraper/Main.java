package dev.wh40kmeta.scraper;

import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/** Main application class with CLI support */
@Command(
		name = "wahapedia-scraper",
		version = "0.1.0",
		description = "Scrapes Warhammer 40,000 rules from Wahapedia and publishes them to Redis channels",
		mixinStandardHelpOptions = true,
		subcommands = {RunCommand.class, CheckCommand.class, RecentCommand.class, ListenCommand.class})
public class Main implements Callable<Integer> {

	@Spec
	private CommandSpec spec;

	@Override
	public Integer call() {
		spec.commandLine().usage(System.out);
		return 0;
	}

	public static void main(String[] args) {
		int exitCode = new CommandLine(new Main()).execute(args);
		System.exit(exitCode);
	}
}
