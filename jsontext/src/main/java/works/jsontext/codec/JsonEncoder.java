package works.jsontext.codec;

import java.io.IOException;
import java.io.Writer;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.jsontext.codec.text.Base64Text;
import works.jsontext.codec.text.ScalarText;
import works.jsontext.exceptions.JsonProcessingException;

import static java.util.Objects.requireNonNull;

/**
 * Accumulates JSON text from a sequence of primitive append operations.
 * <p>
 * The caller owns all schema knowledge: it decides which fields to emit, in what order,
 * and whether a scalar must be quoted. The encoder owns only the textual rules.
 * It performs no validation; an unbalanced call sequence yields unbalanced text.
 * <p>
 * Commas between object members are inserted automatically by {@link #startField}.
 * Each open object or array has its own "needs separator" flag,
 * so closing a nested value restores the enclosing object's state.
 * Array elements are separated by the caller, using {@link JsonToken#COMMA}.
 * <p>
 * Not thread-safe. Use one encoder per document.
 */
public final class JsonEncoder {
	private final List<String> fragments;

	/**
	 * Bit {@code i} is set when the scope at depth {@code i} needs a comma before its next field.
	 * Depth zero is the root scope, which is never popped.
	 */
	private final BitSet needsSeparator = new BitSet();
	private int depth = 0;

	public JsonEncoder() {
		this(Settings.DEFAULT);
	}

	public JsonEncoder(Settings settings) {
		if (!Settings.DEFAULT.equals(settings)) {
			LOGGER.debug("Creating encoder with {}", settings);
		}
		this.fragments = new ArrayList<>(settings.initialFragmentCapacity());
	}

	/**
	 * @param initialFragmentCapacity sizes the fragment buffer up front;
	 *                                the buffer still grows without limit as needed.
	 */
	public record Settings(
		int initialFragmentCapacity
	) {
		public static final Settings DEFAULT = new Settings(64);

		public Settings {
			if (initialFragmentCapacity < 0) {
				throw new IllegalArgumentException("Negative initialFragmentCapacity: " + initialFragmentCapacity);
			}
		}

		public Settings withInitialFragmentCapacity(int initialFragmentCapacity) {
			return new Settings(initialFragmentCapacity);
		}
	}

	/**
	 * @return all text emitted so far. Has no side effects, so it may be called at any time.
	 */
	public String result() {
		return String.join("", fragments);
	}

	public int fragmentCount() {
		return fragments.size();
	}

	/**
	 * Copies the accumulated text to {@code out}, one fragment at a time.
	 * Does not flush or close {@code out}.
	 *
	 * @throws JsonProcessingException if {@code out} throws {@link IOException}
	 */
	public void writeTo(Writer out) {
		LOGGER.debug("Writing {} fragments", fragments.size());
		try {
			for (String fragment : fragments) {
				out.write(fragment);
			}
		} catch (IOException e) {
			throw new JsonProcessingException("Unable to write JSON text", e);
		}
	}

	@Override
	public String toString() {
		return result();
	}

	void append(String text) {
		fragments.add(text);
	}

	public void appendTokens(JsonToken... tokens) {
		appendTokens(List.of(tokens));
	}

	public void appendTokens(List<? extends JsonToken> tokens) {
		for (JsonToken t : tokens) {
			if (LOGGER.isTraceEnabled()) {
				LOGGER.trace("Token {} at depth {}", t, depth);
			}
			switch (t.kind()) {
				case BEGIN_ARRAY, BEGIN_OBJECT -> {
					append(((JsonToken.Fixed) t).fixedRepresentation());
					openScope();
				}
				case END_ARRAY, END_OBJECT -> {
					append(((JsonToken.Fixed) t).fixedRepresentation());
					closeScope();
				}
				case COLON, COMMA, NULL -> append(((JsonToken.Fixed) t).fixedRepresentation());
				case BOOLEAN -> putBoolValue(((JsonToken.BooleanToken) t).value(), false);
				case NUMBER -> appendNumber(((JsonToken.NumberToken) t).number());
				case STRING -> putStringValue(((JsonToken.StringToken) t).value());
			}
		}
	}

	/**
	 * Integers take this path unquoted with no magnitude check.
	 * Callers that need the safe-integer quoting rule use {@link #putInt64} or {@link #putUInt64}.
	 */
	private void appendNumber(JsonNumber number) {
		switch (number.kind()) {
			case DOUBLE -> append(ScalarText.doubleText(((JsonNumber.DoubleNumber) number).value(), false));
			case SIGNED -> append(Long.toString(((JsonNumber.SignedNumber) number).value()));
			case UNSIGNED -> append(Long.toUnsignedString(((JsonNumber.UnsignedNumber) number).value()));
		}
	}

	public void startObject() {
		append(JsonToken.BEGIN_OBJECT.fixedRepresentation());
		openScope();
	}

	/**
	 * Emits the member name and colon, preceded by a comma unless this is the
	 * first member of the innermost open object.
	 *
	 * @param name emitted verbatim with no escaping; must already be a valid JSON member name
	 */
	public void startField(String name) {
		String separator = needsSeparator.get(depth) ? "," : "";
		append(separator + '"' + name + "\":");
		needsSeparator.set(depth);
	}

	public void endObject() {
		append(JsonToken.END_OBJECT.fixedRepresentation());
		closeScope();
	}

	public void putNullValue() {
		append(JsonToken.NULL.fixedRepresentation());
	}

	public void putBoolValue(boolean value, boolean quote) {
		append(ScalarText.booleanText(value, quote));
	}

	public void putFloatValue(float value, boolean quote) {
		putDoubleValue(value, quote);
	}

	public void putDoubleValue(double value, boolean quote) {
		append(ScalarText.doubleText(value, quote));
	}

	/**
	 * Quoted if {@code quote} is set or the magnitude exceeds {@link ScalarText#MAX_SAFE_INTEGER}.
	 */
	public void putInt64(long value, boolean quote) {
		append(ScalarText.signedText(value, quote));
	}

	/**
	 * @param value interpreted as an unsigned 64-bit integer
	 */
	public void putUInt64(long value, boolean quote) {
		append(ScalarText.unsignedText(value, quote));
	}

	public void putStringValue(String value) {
		append(ScalarText.stringLiteral(value));
	}

	public void putBytesValue(byte[] value) {
		append(Base64Text.literal(requireNonNull(value)));
	}

	/**
	 * Encodes the remaining bytes of {@code value} without changing its position.
	 */
	public void putBytesValue(ByteBuffer value) {
		append(Base64Text.literal(requireNonNull(value)));
	}

	private void openScope() {
		depth++;
		needsSeparator.clear(depth);
	}

	/**
	 * The closed value was a member of the enclosing scope,
	 * so that scope needs a comma before its next field.
	 */
	private void closeScope() {
		if (depth == 0) {
			LOGGER.debug("Close with no open object or array; the output is unbalanced");
		} else {
			needsSeparator.clear(depth);
			depth--;
		}
		needsSeparator.set(depth);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JsonEncoder.class);
}
