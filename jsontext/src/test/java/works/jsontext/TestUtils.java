package works.jsontext;

import tools.jackson.databind.ObjectMapper;

public class TestUtils {
	private static final ObjectMapper MAPPER = new ObjectMapper();

	/**
	 * Parses {@code json} with an independent parser, failing the test if it isn't well-formed.
	 */
	public static Object parse(String json) {
		return MAPPER.readValue(json, Object.class);
	}

	/**
	 * Every control character, both quote-worthy characters, and text from outside the BMP.
	 */
	public static String awkwardString() {
		StringBuilder sb = new StringBuilder();
		for (int c = 0; c <= 0xA0; c++) {
			sb.append((char) c);
		}
		return sb.append("\"\\héllo 😎").toString();
	}
}
