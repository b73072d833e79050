package works.jsontext.codec.text;

import tools.jackson.core.io.NumberOutput;

import static java.util.Objects.requireNonNull;

/**
 * Formatting rules for JSON scalars.
 * <p>
 * Every method is a pure function from a value to its JSON text.
 * None can fail: every value in the accepted Java types has a rendering.
 */
public final class ScalarText {
	private ScalarText() {}

	/**
	 * 2<sup>53</sup>-1, the largest integer that a {@code double} represents exactly.
	 * Integers beyond this are quoted so consumers that parse JSON numbers as doubles
	 * don't silently lose precision.
	 */
	public static final long MAX_SAFE_INTEGER = 0x1F_FFFF_FFFF_FFFFL;

	public static final String NAN = "\"NaN\"";
	public static final String POSITIVE_INFINITY = "\"Infinity\"";
	public static final String NEGATIVE_INFINITY = "\"-Infinity\"";

	private static final char[] HEX_DIGITS = "0123456789ABCDEF".toCharArray();

	public static String quoted(String text) {
		return '"' + text + '"';
	}

	public static String booleanText(boolean value, boolean quote) {
		if (quote) {
			return value ? "\"true\"" : "\"false\"";
		} else {
			return value ? "true" : "false";
		}
	}

	/**
	 * NaN and the infinities are always rendered as JSON strings, regardless of {@code quote}.
	 * Integral values within the {@code long} range are rendered without a decimal point.
	 * Other values get the shortest text that parses back to the same {@code double},
	 * in the same notation as {@link Double#toString(double)}.
	 */
	public static String doubleText(double value, boolean quote) {
		if (Double.isNaN(value)) {
			return NAN;
		} else if (Double.isInfinite(value)) {
			return (value < 0) ? NEGATIVE_INFINITY : POSITIVE_INFINITY;
		}
		String s;
		if (value < (double) Long.MAX_VALUE && value > (double) Long.MIN_VALUE && value == (double) (long) value) {
			s = Long.toString((long) value);
		} else {
			s = NumberOutput.toString(value, true);
		}
		return quote ? quoted(s) : s;
	}

	public static String signedText(long value, boolean quote) {
		String s = Long.toString(value);
		return (quote || !isSafeSigned(value)) ? quoted(s) : s;
	}

	/**
	 * @param value interpreted as an unsigned 64-bit integer
	 */
	public static String unsignedText(long value, boolean quote) {
		String s = Long.toUnsignedString(value);
		return (quote || !isSafeUnsigned(value)) ? quoted(s) : s;
	}

	public static boolean isSafeSigned(long value) {
		return -MAX_SAFE_INTEGER <= value && value <= MAX_SAFE_INTEGER;
	}

	public static boolean isSafeUnsigned(long value) {
		return Long.compareUnsigned(value, MAX_SAFE_INTEGER) <= 0;
	}

	/**
	 * Wraps {@code s} in double quotes, escaping it code point by code point.
	 * <p>
	 * Quote, backslash and the control characters with a short form get their
	 * two-character escapes. Any other C0 (0-31) or C1 (127-159) control character
	 * becomes {@code \}{@code u00XX} with uppercase hex digits.
	 * Everything else, including all non-ASCII text, is copied through literally.
	 */
	public static String stringLiteral(String s) {
		requireNonNull(s);
		StringBuilder sb = new StringBuilder(s.length() + 2);
		sb.append('"');
		for (int i = 0; i < s.length(); ) {
			int cp = s.codePointAt(i);
			switch (cp) {
				case '\b': sb.append("\\b"); break;
				case '\t': sb.append("\\t"); break;
				case '\n': sb.append("\\n"); break;
				case '\f': sb.append("\\f"); break;
				case '\r': sb.append("\\r"); break;
				case '"': sb.append("\\\""); break;
				case '\\': sb.append("\\\\"); break;
				default:
					if (isControl(cp)) {
						sb.append("\\u00")
							.append(HEX_DIGITS[cp >> 4])
							.append(HEX_DIGITS[cp & 0xF]);
					} else {
						sb.appendCodePoint(cp);
					}
			}
			i += Character.charCount(cp);
		}
		sb.append('"');
		return sb.toString();
	}

	private static boolean isControl(int cp) {
		return cp <= 0x1F || (0x7F <= cp && cp <= 0x9F);
	}
}
