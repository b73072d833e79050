package works.jsontext.codec;

import static java.util.Objects.requireNonNull;

/**
 * A lexical unit of JSON output: structural punctuation or a scalar payload.
 * <p>
 * Tokens are immutable and consumed once by {@link JsonEncoder#appendTokens}.
 * The vocabulary is closed; {@link #kind()} lets a renderer switch over it exhaustively.
 */
public sealed interface JsonToken permits
	JsonToken.Fixed,
	JsonToken.BooleanToken,
	JsonToken.NumberToken,
	JsonToken.StringToken
{
	Kind kind();

	Fixed BEGIN_ARRAY = Fixed.BEGIN_ARRAY;
	Fixed END_ARRAY = Fixed.END_ARRAY;
	Fixed BEGIN_OBJECT = Fixed.BEGIN_OBJECT;
	Fixed END_OBJECT = Fixed.END_OBJECT;
	Fixed COLON = Fixed.COLON;
	Fixed COMMA = Fixed.COMMA;
	Fixed NULL = Fixed.NULL;

	static BooleanToken of(boolean value) {
		return value ? BooleanToken.TRUE : BooleanToken.FALSE;
	}

	static StringToken of(String value) {
		return new StringToken(value);
	}

	static NumberToken ofDouble(double value) {
		return new NumberToken(new JsonNumber.DoubleNumber(value));
	}

	static NumberToken ofSigned(long value) {
		return new NumberToken(new JsonNumber.SignedNumber(value));
	}

	/**
	 * @param value interpreted as an unsigned 64-bit integer
	 */
	static NumberToken ofUnsigned(long value) {
		return new NumberToken(new JsonNumber.UnsignedNumber(value));
	}

	enum Kind {
		BEGIN_ARRAY,
		END_ARRAY,
		BEGIN_OBJECT,
		END_OBJECT,
		COLON,
		COMMA,
		BOOLEAN,
		NULL,
		NUMBER,
		STRING,
	}

	/**
	 * Tokens that are always represented in JSON with the same sequence of characters.
	 */
	enum Fixed implements JsonToken {
		BEGIN_ARRAY(Kind.BEGIN_ARRAY, "["),
		END_ARRAY(Kind.END_ARRAY, "]"),
		BEGIN_OBJECT(Kind.BEGIN_OBJECT, "{"),
		END_OBJECT(Kind.END_OBJECT, "}"),
		COLON(Kind.COLON, ":"),
		COMMA(Kind.COMMA, ","),
		NULL(Kind.NULL, "null");

		private final Kind kind;
		private final String fixedRepresentation;

		Fixed(Kind kind, String fixedRepresentation) {
			this.kind = kind;
			this.fixedRepresentation = fixedRepresentation;
		}

		@Override
		public Kind kind() {
			return kind;
		}

		public String fixedRepresentation() {
			return fixedRepresentation;
		}
	}

	/**
	 * Always rendered unquoted.
	 * Quoted booleans, such as map keys, are represented as {@link StringToken}s.
	 */
	record BooleanToken(boolean value) implements JsonToken {
		static final BooleanToken TRUE = new BooleanToken(true);
		static final BooleanToken FALSE = new BooleanToken(false);

		@Override
		public Kind kind() {
			return Kind.BOOLEAN;
		}
	}

	record NumberToken(JsonNumber number) implements JsonToken {
		public NumberToken {
			requireNonNull(number);
		}

		@Override
		public Kind kind() {
			return Kind.NUMBER;
		}
	}

	record StringToken(String value) implements JsonToken {
		public StringToken {
			requireNonNull(value);
		}

		@Override
		public Kind kind() {
			return Kind.STRING;
		}
	}
}
