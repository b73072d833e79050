package works.jsontext.codec;

/**
 * The payload of a {@link JsonToken.NumberToken}, carrying an explicit numeric kind
 * so the renderer never has to guess how a value should be formatted.
 */
public sealed interface JsonNumber {
	Kind kind();

	enum Kind {
		DOUBLE,
		SIGNED,
		UNSIGNED,
	}

	record DoubleNumber(double value) implements JsonNumber {
		@Override
		public Kind kind() {
			return Kind.DOUBLE;
		}
	}

	record SignedNumber(long value) implements JsonNumber {
		@Override
		public Kind kind() {
			return Kind.SIGNED;
		}
	}

	/**
	 * @param value interpreted as an unsigned 64-bit integer
	 */
	record UnsignedNumber(long value) implements JsonNumber {
		@Override
		public Kind kind() {
			return Kind.UNSIGNED;
		}

		@Override
		public String toString() {
			return "UnsignedNumber[value=" + Long.toUnsignedString(value) + "]";
		}
	}
}
