package works.jsontext.codec.text;

import java.nio.ByteBuffer;

import static java.util.Objects.checkFromIndexSize;

/**
 * Renders raw bytes as a quoted JSON string in standard Base64 with padding.
 * <p>
 * The alphabet contains no characters that JSON needs escaped,
 * so the result is emitted without further processing.
 */
public final class Base64Text {
	private Base64Text() {}

	private static final char[] ALPHABET =
		"ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789+/".toCharArray();

	private static final char PAD = '=';

	/**
	 * @return the length of the unquoted Base64 text for {@code byteCount} input bytes
	 * @throws ArithmeticException if the length does not fit in an {@code int}
	 */
	public static int encodedLength(int byteCount) {
		if (byteCount < 0) {
			throw new IllegalArgumentException("Negative byteCount: " + byteCount);
		}
		int groups = byteCount / 3 + ((byteCount % 3 == 0) ? 0 : 1);
		return Math.multiplyExact(4, groups);
	}

	public static String literal(byte[] bytes) {
		return literal(bytes, 0, bytes.length);
	}

	/**
	 * Encodes the remaining bytes of {@code buffer} without changing its position.
	 */
	public static String literal(ByteBuffer buffer) {
		if (buffer.hasArray()) {
			return literal(buffer.array(), buffer.arrayOffset() + buffer.position(), buffer.remaining());
		}
		byte[] bytes = new byte[buffer.remaining()];
		buffer.duplicate().get(bytes);
		return literal(bytes);
	}

	/**
	 * @throws IndexOutOfBoundsException if the range is not within {@code bytes}
	 * @throws ArithmeticException if the quoted text would be too long for a {@link String}
	 */
	public static String literal(byte[] bytes, int offset, int length) {
		checkFromIndexSize(offset, length, bytes.length);
		StringBuilder sb = new StringBuilder(Math.addExact(encodedLength(length), 2));
		sb.append('"');
		int end = offset + length;
		int i = offset;
		for (; end - i >= 3; i += 3) {
			int group = (bytes[i] & 0xFF) << 16
				| (bytes[i + 1] & 0xFF) << 8
				| (bytes[i + 2] & 0xFF);
			sb.append(ALPHABET[(group >> 18) & 63])
				.append(ALPHABET[(group >> 12) & 63])
				.append(ALPHABET[(group >> 6) & 63])
				.append(ALPHABET[group & 63]);
		}
		switch (end - i) {
			case 1: {
				int group = (bytes[i] & 0xFF) << 16;
				sb.append(ALPHABET[(group >> 18) & 63])
					.append(ALPHABET[(group >> 12) & 63])
					.append(PAD)
					.append(PAD);
				break;
			}
			case 2: {
				int group = (bytes[i] & 0xFF) << 16
					| (bytes[i + 1] & 0xFF) << 8;
				sb.append(ALPHABET[(group >> 18) & 63])
					.append(ALPHABET[(group >> 12) & 63])
					.append(ALPHABET[(group >> 6) & 63])
					.append(PAD);
				break;
			}
			default:
				// Input was a whole number of groups
		}
		sb.append('"');
		return sb.toString();
	}
}
