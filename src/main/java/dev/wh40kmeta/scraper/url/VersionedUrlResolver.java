package dev.wh40kmeta.scraper.url;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps a game version and faction code to upstream URLs. Also owns the faction display name to URL
 * code normalization. Resolved URLs are memoized for the lifetime of the instance.
 */
public class VersionedUrlResolver {
	private static final Logger logger = LoggerFactory.getLogger(VersionedUrlResolver.class);

	public static final String DEFAULT_VERSION_PATH = "wh40k10ed";

	private static final Map<String, String> VERSION_PATHS = Map.of(
			"10th", "wh40k10ed",
			"9th", "wh40k9ed",
			"8th", "wh40k8ed");

	private static final Map<String, String> URL_PATTERNS = new LinkedHashMap<>();

	static {
		URL_PATTERNS.put("quick_start", "the-rules/quick-start-guide/");
		URL_PATTERNS.put("core_rules", "the-rules/core-rules/");
		URL_PATTERNS.put("army_lists", "army-lists/");
		URL_PATTERNS.put("faction", "factions/{faction_code}");
		URL_PATTERNS.put("faction_datasheets", "factions/{faction_code}/datasheets");
		URL_PATTERNS.put("faction_stratagems", "factions/{faction_code}/stratagems");
	}

	private static final Map<String, String> SECTION_ANCHORS = new LinkedHashMap<>();

	static {
		SECTION_ANCHORS.put("army_rules", "Army-Rules");
		SECTION_ANCHORS.put("detachments", "Detachment-Rules");
		SECTION_ANCHORS.put("enhancements", "Enhancements");
		SECTION_ANCHORS.put("stratagems", "Stratagems");
		SECTION_ANCHORS.put("wargear_options", "Wargear-Options");
	}

	private static final Set<String> KNOWN_FACTIONS = Set.of(
			"space-marines",
			"black-templars",
			"blood-angels",
			"dark-angels",
			"deathwatch",
			"space-wolves",
			"grey-knights",
			"adepta-sororitas",
			"adeptus-custodes",
			"adeptus-mechanicus",
			"astra-militarum",
			"imperial-agents",
			"imperial-knights",
			"chaos-space-marines",
			"chaos-daemons",
			"chaos-knights",
			"death-guard",
			"thousand-sons",
			"world-eaters",
			"emperor-s-children",
			"aeldari",
			"drukhari",
			"genestealer-cults",
			"leagues-of-votann",
			"necrons",
			"orks",
			"t-au-empire",
			"tyranids");

	private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+)}");
	private static final Pattern NON_CODE_CHARS = Pattern.compile("[^a-z0-9]+");

	private final String baseUrl;
	private final String versionId;
	private final String versionPath;
	private final Map<String, String> cache = new HashMap<>();

	public VersionedUrlResolver(String baseUrl, String versionId) {
		this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
		this.versionId = versionId;
		this.versionPath = versionPath(versionId);
		logger.debug("URL resolver initialized for version {} ({})", versionId, versionPath);
	}

	/** Upstream path segment for a version id, falling back to the current edition */
	public static String versionPath(String versionId) {
		String path = versionId != null ? VERSION_PATHS.get(versionId) : null;
		if (path == null) {
			logger.warn("Unknown game version '{}', falling back to {}", versionId, DEFAULT_VERSION_PATH);
			return DEFAULT_VERSION_PATH;
		}
		return path;
	}

	/**
	 * Normalize a faction display name to its URL code. Known irregular names are looked up first,
	 * everything else is lowercased with runs of whitespace and punctuation collapsed to a hyphen.
	 *
	 * @return the code, or null for a null or blank name
	 */
	public static String normalizeFactionCode(String name) {
		if (name == null || name.isBlank()) {
			return null;
		}
		String generic = NON_CODE_CHARS.matcher(name.trim().toLowerCase()).replaceAll("-");
		generic = stripHyphens(generic);
		return switch (generic) {
			case "adeptus-astartes" -> "space-marines";
			case "imperial-guard" -> "astra-militarum";
			case "sisters-of-battle" -> "adepta-sororitas";
			case "eldar", "craftworlds", "craftworld-eldar" -> "aeldari";
			case "dark-eldar" -> "drukhari";
			case "squats", "votann" -> "leagues-of-votann";
			case "tau", "tau-empire" -> "t-au-empire";
			case "emperors-children" -> "emperor-s-children";
			default -> generic.isEmpty() ? null : generic;
		};
	}

	private static String stripHyphens(String value) {
		int start = 0;
		int end = value.length();
		while (start < end && value.charAt(start) == '-') start++;
		while (end > start && value.charAt(end - 1) == '-') end--;
		return value.substring(start, end);
	}

	public String versionId() {
		return versionId;
	}

	public String versionPath() {
		return versionPath;
	}

	public String baseUrl() {
		return baseUrl;
	}

	/**
	 * Build a URL from one of the named patterns
	 *
	 * @return the URL, or null when the pattern is unknown or a parameter is missing
	 */
	public String buildUrl(String pattern, Map<String, String> params) {
		String key = pattern + new TreeMap<>(params);
		String cached = cache.get(key);
		if (cached != null) {
			return cached;
		}
		String template = URL_PATTERNS.get(pattern);
		if (template == null) {
			logger.warn("Unknown URL pattern: {}", pattern);
			return null;
		}
		String path = fill(template, params);
		if (path == null) {
			return null;
		}
		String url = baseUrl + "/" + versionPath + "/" + path;
		cache.put(key, url);
		return url;
	}

	private String fill(String template, Map<String, String> params) {
		Matcher matcher = PLACEHOLDER.matcher(template);
		StringBuilder sb = new StringBuilder();
		while (matcher.find()) {
			String value = params.get(matcher.group(1));
			if (value == null || value.isBlank()) {
				logger.warn("Missing parameter '{}' for URL template {}", matcher.group(1), template);
				return null;
			}
			matcher.appendReplacement(sb, Matcher.quoteReplacement(value));
		}
		matcher.appendTail(sb);
		return sb.toString();
	}

	public String quickStartUrl() {
		return buildUrl("quick_start", Map.of());
	}

	public String factionUrl(String factionCode) {
		return buildUrl("faction", params(factionCode));
	}

	public String factionDatasheetsUrl(String factionCode) {
		return buildUrl("faction_datasheets", params(factionCode));
	}

	/**
	 * Faction page URL with the anchor of a section; unknown sections are used as literal anchors and
	 * a missing section gives the plain faction URL
	 */
	public String factionSectionUrl(String factionCode, String section) {
		String url = factionUrl(factionCode);
		return url != null ? withSection(url, section) : null;
	}

	public String unitDatasheetUrl(String factionCode, String unitCode) {
		String url = factionDatasheetsUrl(factionCode);
		return url != null && unitCode != null ? url + "#" + unitCode : url;
	}

	public String searchUrl(String query) {
		return baseUrl + "/" + versionPath + "/search?q=" + URLEncoder.encode(query, StandardCharsets.UTF_8);
	}

	/**
	 * Resolve a faction URL for an arbitrary version, optionally pointing at a section.
	 *
	 * @param factionCode a code or display name, normalized before use
	 * @return the URL, or null when the faction code is missing or normalizes to nothing
	 */
	public String resolve(String versionId, String factionCode, String section) {
		String code = normalizeFactionCode(factionCode);
		if (code == null) {
			return null;
		}
		Map<String, String> key = new TreeMap<>();
		key.put("faction_code", code);
		key.put("section", section == null ? "" : section);
		key.put("version", versionPath(versionId));
		return cache.computeIfAbsent(
				"resolve" + key, k -> withSection(baseUrl + "/" + versionPath(versionId) + "/factions/" + code, section));
	}

	private static String withSection(String url, String section) {
		return section == null || section.isBlank() ? url : url + "#" + sectionAnchor(section);
	}

	public static String sectionAnchor(String section) {
		return SECTION_ANCHORS.getOrDefault(section, section);
	}

	public static Map<String, String> sectionAnchors() {
		return Collections.unmodifiableMap(SECTION_ANCHORS);
	}

	public static boolean isKnownFaction(String factionCode) {
		return factionCode != null && KNOWN_FACTIONS.contains(factionCode);
	}

	public void clearCache() {
		logger.debug("Clearing {} cached URLs", cache.size());
		cache.clear();
	}

	public int cacheSize() {
		return cache.size();
	}

	private static Map<String, String> params(String factionCode) {
		Map<String, String> params = new HashMap<>();
		params.put("faction_code", factionCode);
		return params;
	}
}
