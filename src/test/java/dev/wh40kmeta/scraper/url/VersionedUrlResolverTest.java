package dev.wh40kmeta.scraper.url;

import static org.assertj.core.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.Test;

class VersionedUrlResolverTest {

	private final VersionedUrlResolver resolver = new VersionedUrlResolver("https://wahapedia.ru", "10th");

	@Test
	void testVersionPath() {
		// When/Then
		assertThat(resolver.versionId()).isEqualTo("10th");
		assertThat(resolver.versionPath()).isEqualTo("wh40k10ed");
		assertThat(VersionedUrlResolver.versionPath("9th")).isEqualTo("wh40k9ed");
		assertThat(VersionedUrlResolver.versionPath("8th")).isEqualTo("wh40k8ed");
	}

	@Test
	void testUnknownVersionFallsBackToCurrentEdition() {
		// When
		VersionedUrlResolver unknown = new VersionedUrlResolver("https://wahapedia.ru", "11th");

		// Then
		assertThat(unknown.versionPath()).isEqualTo("wh40k10ed");
		assertThat(VersionedUrlResolver.versionPath(null)).isEqualTo("wh40k10ed");
	}

	@Test
	void testQuickStartUrl() {
		// When/Then
		assertThat(resolver.quickStartUrl()).isEqualTo("https://wahapedia.ru/wh40k10ed/the-rules/quick-start-guide/");
	}

	@Test
	void testFactionUrls() {
		// When/Then
		assertThat(resolver.factionUrl("space-marines"))
				.isEqualTo("https://wahapedia.ru/wh40k10ed/factions/space-marines");
		assertThat(resolver.factionDatasheetsUrl("space-marines"))
				.isEqualTo("https://wahapedia.ru/wh40k10ed/factions/space-marines/datasheets");
		assertThat(resolver.factionUrl("orks")).isEqualTo("https://wahapedia.ru/wh40k10ed/factions/orks");
		assertThat(resolver.factionDatasheetsUrl("t-au-empire"))
				.isEqualTo("https://wahapedia.ru/wh40k10ed/factions/t-au-empire/datasheets");
	}

	@Test
	void testTrailingSlashOnBaseUrl() {
		// Given
		VersionedUrlResolver slashed = new VersionedUrlResolver("https://wahapedia.ru/", "10th");

		// When/Then
		assertThat(slashed.factionUrl("orks")).isEqualTo("https://wahapedia.ru/wh40k10ed/factions/orks");
	}

	@Test
	void testSectionAnchors() {
		// When/Then
		assertThat(resolver.factionSectionUrl("space-marines", "army_rules"))
				.isEqualTo("https://wahapedia.ru/wh40k10ed/factions/space-marines#Army-Rules");
		assertThat(resolver.factionSectionUrl("orks", "detachments"))
				.isEqualTo("https://wahapedia.ru/wh40k10ed/factions/orks#Detachment-Rules");
		assertThat(resolver.factionSectionUrl("necrons", "enhancements"))
				.isEqualTo("https://wahapedia.ru/wh40k10ed/factions/necrons#Enhancements");
		assertThat(resolver.factionSectionUrl("orks", "Custom-Anchor"))
				.isEqualTo("https://wahapedia.ru/wh40k10ed/factions/orks#Custom-Anchor");
	}

	@Test
	void testAllSectionAnchors() {
		// When
		Map<String, String> anchors = VersionedUrlResolver.sectionAnchors();

		// Then
		assertThat(anchors)
				.containsEntry("army_rules", "Army-Rules")
				.containsEntry("detachments", "Detachment-Rules")
				.containsEntry("enhancements", "Enhancements")
				.containsEntry("stratagems", "Stratagems")
				.containsEntry("wargear_options", "Wargear-Options");
		assertThatThrownBy(() -> anchors.put("x", "y")).isInstanceOf(UnsupportedOperationException.class);
	}

	@Test
	void testFactionCodeNormalization() {
		// When/Then
		assertThat(VersionedUrlResolver.normalizeFactionCode("Space Marines")).isEqualTo("space-marines");
		assertThat(VersionedUrlResolver.normalizeFactionCode("T'au Empire")).isEqualTo("t-au-empire");
		assertThat(VersionedUrlResolver.normalizeFactionCode("Emperor's Children")).isEqualTo("emperor-s-children");
		assertThat(VersionedUrlResolver.normalizeFactionCode("Adepta Sororitas")).isEqualTo("adepta-sororitas");
		assertThat(VersionedUrlResolver.normalizeFactionCode("space-marines")).isEqualTo("space-marines");
		assertThat(VersionedUrlResolver.normalizeFactionCode("ORKS")).isEqualTo("orks");
		assertThat(VersionedUrlResolver.normalizeFactionCode("Chaos Space Marines")).isEqualTo("chaos-space-marines");
		assertThat(VersionedUrlResolver.normalizeFactionCode("  Genestealer   Cults  ")).isEqualTo("genestealer-cults");
	}

	@Test
	void testFactionCodeAliases() {
		// When/Then
		assertThat(VersionedUrlResolver.normalizeFactionCode("Adeptus Astartes")).isEqualTo("space-marines");
		assertThat(VersionedUrlResolver.normalizeFactionCode("Imperial Guard")).isEqualTo("astra-militarum");
		assertThat(VersionedUrlResolver.normalizeFactionCode("Sisters of Battle")).isEqualTo("adepta-sororitas");
		assertThat(VersionedUrlResolver.normalizeFactionCode("Eldar")).isEqualTo("aeldari");
		assertThat(VersionedUrlResolver.normalizeFactionCode("Dark Eldar")).isEqualTo("drukhari");
		assertThat(VersionedUrlResolver.normalizeFactionCode("Tau Empire")).isEqualTo("t-au-empire");
		assertThat(VersionedUrlResolver.normalizeFactionCode("Emperors Children")).isEqualTo("emperor-s-children");
		assertThat(VersionedUrlResolver.normalizeFactionCode("Squats")).isEqualTo("leagues-of-votann");
	}

	@Test
	void testNormalizationIsIdempotent() {
		// Given
		String[] names = {"Space Marines", "T'au Empire", "Imperial Guard", "Leagues of Votann", "Death Guard"};

		// When/Then
		for (String name : names) {
			String code = VersionedUrlResolver.normalizeFactionCode(name);
			assertThat(VersionedUrlResolver.normalizeFactionCode(code)).isEqualTo(code);
		}
	}

	@Test
	void testNormalizeBlankName() {
		// When/Then
		assertThat(VersionedUrlResolver.normalizeFactionCode(null)).isNull();
		assertThat(VersionedUrlResolver.normalizeFactionCode("   ")).isNull();
		assertThat(VersionedUrlResolver.normalizeFactionCode("!!!")).isNull();
	}

	@Test
	void testUnitDatasheetUrl() {
		// When/Then
		assertThat(resolver.unitDatasheetUrl("space-marines", "intercessor-squad"))
				.isEqualTo("https://wahapedia.ru/wh40k10ed/factions/space-marines/datasheets#intercessor-squad");
		assertThat(resolver.unitDatasheetUrl("orks", "boyz"))
				.isEqualTo("https://wahapedia.ru/wh40k10ed/factions/orks/datasheets#boyz");
	}

	@Test
	void testSearchUrl() {
		// When/Then
		assertThat(resolver.searchUrl("space marine captain"))
				.isEqualTo("https://wahapedia.ru/wh40k10ed/search?q=space+marine+captain");
		assertThat(resolver.searchUrl("ork boyz")).isEqualTo("https://wahapedia.ru/wh40k10ed/search?q=ork+boyz");
	}

	@Test
	void testBuildUrlWithPatterns() {
		// When/Then
		assertThat(resolver.buildUrl("army_lists", Map.of())).isEqualTo("https://wahapedia.ru/wh40k10ed/army-lists/");
		assertThat(resolver.buildUrl("core_rules", Map.of()))
				.isEqualTo("https://wahapedia.ru/wh40k10ed/the-rules/core-rules/");
		assertThat(resolver.buildUrl("faction_stratagems", Map.of("faction_code", "necrons")))
				.isEqualTo("https://wahapedia.ru/wh40k10ed/factions/necrons/stratagems");
	}

	@Test
	void testBuildUrlWithUnknownPatternOrMissingParameter() {
		// When/Then
		assertThat(resolver.buildUrl("unknown_pattern", Map.of())).isNull();
		assertThat(resolver.buildUrl("faction", Map.of())).isNull();
		assertThat(resolver.factionUrl(null)).isNull();
		assertThat(resolver.factionSectionUrl(null, "army_rules")).isNull();
	}

	@Test
	void testResolve() {
		// When/Then
		assertThat(resolver.resolve("9th", "Space Marines", null))
				.isEqualTo("https://wahapedia.ru/wh40k9ed/factions/space-marines");
		assertThat(resolver.resolve("10th", "orks", "army_rules"))
				.isEqualTo("https://wahapedia.ru/wh40k10ed/factions/orks#Army-Rules");
		assertThat(resolver.resolve("10th", "", "army_rules")).isNull();
		assertThat(resolver.resolve("10th", null, null)).isNull();
	}

	@Test
	void testResolveUsesCache() {
		// Given
		VersionedUrlResolver fresh = new VersionedUrlResolver("https://wahapedia.ru", "10th");

		// When
		String first = fresh.resolve("9th", "Orks", "army_rules");
		String second = fresh.resolve("9th", "orks", "army_rules");
		fresh.resolve("10th", "orks", "army_rules");
		fresh.resolve("9th", "orks", null);

		// Then
		assertThat(second).isSameAs(first);
		assertThat(fresh.cacheSize()).isEqualTo(3);
	}

	@Test
	void testFactionSectionUrlWithoutSection() {
		// When/Then
		assertThat(resolver.factionSectionUrl("orks", null)).isEqualTo("https://wahapedia.ru/wh40k10ed/factions/orks");
		assertThat(resolver.factionSectionUrl("orks", " ")).isEqualTo("https://wahapedia.ru/wh40k10ed/factions/orks");
	}

	@Test
	void testFactionValidation() {
		// When/Then
		assertThat(VersionedUrlResolver.isKnownFaction("space-marines")).isTrue();
		assertThat(VersionedUrlResolver.isKnownFaction("t-au-empire")).isTrue();
		assertThat(VersionedUrlResolver.isKnownFaction("orks")).isTrue();
		assertThat(VersionedUrlResolver.isKnownFaction("squats")).isFalse();
		assertThat(VersionedUrlResolver.isKnownFaction(null)).isFalse();
	}

	@Test
	void testCache() {
		// Given
		VersionedUrlResolver fresh = new VersionedUrlResolver("https://wahapedia.ru", "10th");

		// When
		String first = fresh.factionUrl("orks");
		String second = fresh.factionUrl("orks");
		fresh.factionDatasheetsUrl("orks");

		// Then
		assertThat(second).isSameAs(first);
		assertThat(fresh.cacheSize()).isEqualTo(2);

		// When
		fresh.clearCache();

		// Then
		assertThat(fresh.cacheSize()).isZero();
		assertThat(fresh.factionUrl("orks")).isEqualTo(first);
	}
}
