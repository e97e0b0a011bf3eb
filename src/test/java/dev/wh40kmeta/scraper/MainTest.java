package dev.wh40kmeta.scraper;

import static org.assertj.core.api.Assertions.*;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class MainTest {

	private CommandLine commandLine(StringWriter out, StringWriter err) {
		CommandLine cmd = new CommandLine(new Main());
		cmd.setOut(new PrintWriter(out));
		cmd.setErr(new PrintWriter(err));
		return cmd;
	}

	@Test
	void testSubcommands() {
		// When
		CommandLine cmd = new CommandLine(new Main());

		// Then
		assertThat(cmd.getSubcommands()).containsOnlyKeys("run", "check", "recent", "listen");
	}

	@Test
	void testVersion() {
		// Given
		StringWriter out = new StringWriter();

		// When
		int exitCode = commandLine(out, new StringWriter()).execute("--version");

		// Then
		assertThat(exitCode).isZero();
		assertThat(out.toString()).contains("0.1.0");
	}

	@Test
	void testRunDefaults() {
		// Given
		CommandLine cmd = new CommandLine(new Main());

		// When
		CommandLine.ParseResult result = cmd.parseArgs("run", "--factions", "orks,necrons", "--skip-wargear");

		// Then
		CommandLine.ParseResult run = result.subcommand();
		assertThat(run.matchedOptionValue("--factions", List.of())).containsExactly("orks", "necrons");
		assertThat(run.matchedOptionValue("--skip-wargear", false)).isTrue();
	}

	@Test
	void testUnknownOption() {
		// Given
		StringWriter err = new StringWriter();

		// When
		int exitCode = commandLine(new StringWriter(), err).execute("run", "--bogus");

		// Then
		assertThat(exitCode).isEqualTo(2);
		assertThat(err.toString()).contains("--bogus");
	}
}
