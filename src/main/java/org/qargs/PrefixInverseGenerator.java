package org.qargs;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An {@link InverseGenerator} that knows pairs of opposite prefixes. A flag starting with one of a pair is inverted by swapping in
 * the other, so "with-a" becomes "without-a" and "enable-b" becomes "disable-b". Any other flag is inverted with a fallback prefix,
 * so "c" becomes "no-c".
 */
public class PrefixInverseGenerator implements InverseGenerator {
	/** The default fallback prefix */
	public static final String DEFAULT_FALLBACK = "no-";

	private final Map<String, String> thePairs;
	private final String theFallback;

	/** Creates a generator with the standard with/without and enable/disable pairs and the "no-" fallback */
	public PrefixInverseGenerator() {
		this(defaultPairs(), DEFAULT_FALLBACK);
	}

	/**
	 * @param pairs Each key is a prefix whose value is its opposite. Pairs are not automatically reversed. Checked in iteration
	 *        order, so longer prefixes that start with shorter ones (e.g. "without-" and "with-") should come first.
	 * @param fallback The prefix to add to names matching none of the pairs
	 */
	public PrefixInverseGenerator(Map<String, String> pairs, String fallback) {
		if (fallback == null || fallback.isEmpty())
			throw new IllegalArgumentException("Fallback prefix must not be empty");
		thePairs = Collections.unmodifiableMap(new LinkedHashMap<>(pairs));
		theFallback = fallback;
	}

	/** @return The standard prefix pairs */
	public static Map<String, String> defaultPairs() {
		Map<String, String> pairs = new LinkedHashMap<>();
		pairs.put("without-", "with-");
		pairs.put("with-", "without-");
		pairs.put("enable-", "disable-");
		pairs.put("disable-", "enable-");
		return pairs;
	}

	/** @return The prefix pairs this generator swaps */
	public Map<String, String> getPairs() {
		return thePairs;
	}

	/** @return The prefix added to names matching none of the pairs */
	public String getFallback() {
		return theFallback;
	}

	@Override
	public String generate(String flagName) {
		for (Map.Entry<String, String> pair : thePairs.entrySet()) {
			if (flagName.startsWith(pair.getKey()) && flagName.length() > pair.getKey().length())
				return pair.getValue() + flagName.substring(pair.getKey().length());
		}
		return theFallback + flagName;
	}
}
