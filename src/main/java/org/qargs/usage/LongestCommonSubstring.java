package org.qargs.usage;

/**
 * The longest substring shared by two strings, with what precedes and follows it in each. Prints as e.g. <code>{en,dis}able-b</code>
 * for "enable-b" and "disable-b", which is how a flag and its inverse are shown together in usage text.
 */
public final class LongestCommonSubstring {
	private final String theFirstPrefix;
	private final String theSecondPrefix;
	private final String theFirstSuffix;
	private final String theSecondSuffix;
	private final String theSubstring;

	private LongestCommonSubstring(String firstPrefix, String secondPrefix, String firstSuffix, String secondSuffix, String substring) {
		theFirstPrefix = firstPrefix;
		theSecondPrefix = secondPrefix;
		theFirstSuffix = firstSuffix;
		theSecondSuffix = secondSuffix;
		theSubstring = substring;
	}

	/**
	 * @param s The first string
	 * @param t The second string
	 * @return The longest common substring of the two. If several are equally long, the one found first in <code>s</code>.
	 */
	public static LongestCommonSubstring of(String s, String t) {
		int[] sr = s.codePoints().toArray();
		int[] tr = t.codePoints().toArray();
		int[][] lengths = new int[sr.length][tr.length];
		int longest = 0, iEnd = 0, jEnd = 0;
		for (int i = 0; i < sr.length; i++) {
			for (int j = 0; j < tr.length; j++) {
				if (sr[i] == tr[j]) {
					lengths[i][j] = (i == 0 || j == 0) ? 1 : lengths[i - 1][j - 1] + 1;
					if (lengths[i][j] > longest) {
						longest = lengths[i][j];
						iEnd = i + 1;
						jEnd = j + 1;
					}
				}
			}
		}
		int sBegin = iEnd - longest;
		int tBegin = jEnd - longest;
		return new LongestCommonSubstring(str(sr, 0, sBegin), str(tr, 0, tBegin), str(sr, iEnd, sr.length), str(tr, jEnd, tr.length),
			str(sr, sBegin, iEnd));
	}

	private static String str(int[] codePoints, int start, int end) {
		return new String(codePoints, start, end - start);
	}

	/** @return The text before the substring in the first string */
	public String getFirstPrefix() {
		return theFirstPrefix;
	}

	/** @return The text before the substring in the second string */
	public String getSecondPrefix() {
		return theSecondPrefix;
	}

	/** @return The text after the substring in the first string */
	public String getFirstSuffix() {
		return theFirstSuffix;
	}

	/** @return The text after the substring in the second string */
	public String getSecondSuffix() {
		return theSecondSuffix;
	}

	/** @return The common substring */
	public String getSubstring() {
		return theSubstring;
	}

	private static String choice(String a, String b) {
		if (a.isEmpty() && b.isEmpty())
			return "";
		else if (a.isEmpty())
			return "{" + b + "}";
		else if (b.isEmpty())
			return "{" + a + "}";
		else
			return "{" + a + "," + b + "}";
	}

	@Override
	public String toString() {
		return choice(theFirstPrefix, theSecondPrefix) + theSubstring + choice(theFirstSuffix, theSecondSuffix);
	}
}
