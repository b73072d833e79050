package works.jsontext.codec;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import works.jsontext.exceptions.JsonProcessingException;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static works.jsontext.TestUtils.awkwardString;
import static works.jsontext.TestUtils.parse;
import static works.jsontext.codec.JsonToken.BEGIN_ARRAY;
import static works.jsontext.codec.JsonToken.COMMA;
import static works.jsontext.codec.JsonToken.END_ARRAY;

class JsonEncoderTest {
	final JsonEncoder encoder = new JsonEncoder();

	@Test
	void newEncoder_isEmpty() {
		assertEquals("", encoder.result());
		assertEquals(0, encoder.fragmentCount());
	}

	@Test
	void twoFields() {
		encoder.startObject();
		encoder.startField("a");
		encoder.putInt64(1, false);
		encoder.startField("b");
		encoder.putInt64(2, false);
		encoder.endObject();
		assertEquals("{\"a\":1,\"b\":2}", encoder.result());
	}

	@Test
	void emptyObject() {
		encoder.startObject();
		encoder.endObject();
		assertEquals("{}", encoder.result());
	}

	@Test
	void emptyObjectAsSoleArrayElement() {
		encoder.appendTokens(BEGIN_ARRAY);
		encoder.startObject();
		encoder.endObject();
		encoder.appendTokens(END_ARRAY);
		assertEquals("[{}]", encoder.result());
	}

	@Test
	void arrayOfObjects() {
		encoder.appendTokens(BEGIN_ARRAY);
		for (int i = 0; i < 3; i++) {
			if (i > 0) {
				encoder.appendTokens(COMMA);
			}
			encoder.startObject();
			encoder.startField("i");
			encoder.putInt64(i, false);
			encoder.endObject();
		}
		encoder.appendTokens(END_ARRAY);
		assertEquals("[{\"i\":0},{\"i\":1},{\"i\":2}]", encoder.result());
	}

	@Test
	void fieldAfterNestedObject_hasComma() {
		encoder.startObject();
		encoder.startField("inner");
		encoder.startObject();
		encoder.startField("x");
		encoder.putBoolValue(true, false);
		encoder.endObject();
		encoder.startField("after");
		encoder.putNullValue();
		encoder.endObject();
		assertEquals("{\"inner\":{\"x\":true},\"after\":null}", encoder.result());
	}

	@Test
	void firstFieldOfNestedObject_hasNoComma() {
		encoder.startObject();
		encoder.startField("a");
		encoder.putInt64(1, false);
		encoder.startField("b");
		encoder.startObject();
		encoder.startField("c");
		encoder.putInt64(3, false);
		encoder.endObject();
		encoder.endObject();
		assertEquals("{\"a\":1,\"b\":{\"c\":3}}", encoder.result());
	}

	@Test
	void fieldAfterArrayOfEmptyObjects_hasComma() {
		encoder.startObject();
		encoder.startField("list");
		encoder.appendTokens(BEGIN_ARRAY);
		encoder.startObject();
		encoder.endObject();
		encoder.appendTokens(END_ARRAY);
		encoder.startField("n");
		encoder.putInt64(5, false);
		encoder.endObject();
		assertEquals("{\"list\":[{}],\"n\":5}", encoder.result());
		assertEquals(Map.of("list", List.of(Map.of()), "n", 5), parse(encoder.result()));
	}

	@Test
	void siblingObjectsAtTopLevel() {
		encoder.startObject();
		encoder.startField("a");
		encoder.putInt64(1, false);
		encoder.endObject();
		encoder.startObject();
		encoder.startField("b");
		encoder.putInt64(2, false);
		encoder.endObject();
		assertEquals("{\"a\":1}{\"b\":2}", encoder.result());
	}

	@Test
	void unbalancedClose_doesNotThrow() {
		encoder.endObject();
		encoder.appendTokens(END_ARRAY);
		assertEquals("}]", encoder.result());
	}

	@Test
	void fieldNames_areNotEscaped() {
		encoder.startObject();
		encoder.startField("already_valid");
		encoder.putStringValue("tab\there");
		encoder.endObject();
		assertEquals("{\"already_valid\":\"tab\\there\"}", encoder.result());
	}

	@Test
	void result_canBeReadMidDocument() {
		encoder.startObject();
		encoder.startField("a");
		assertEquals("{\"a\":", encoder.result());
		assertEquals("{\"a\":", encoder.result());
		encoder.putBoolValue(false, true);
		encoder.endObject();
		assertEquals("{\"a\":\"false\"}", encoder.result());
		assertEquals(encoder.result(), encoder.toString());
	}

	@Test
	void everyScalarKind() {
		encoder.startObject();
		encoder.startField("null");
		encoder.putNullValue();
		encoder.startField("bool");
		encoder.putBoolValue(true, false);
		encoder.startField("float");
		encoder.putFloatValue(1.5f, false);
		encoder.startField("double");
		encoder.putDoubleValue(-0.25, false);
		encoder.startField("nan");
		encoder.putDoubleValue(Double.NaN, false);
		encoder.startField("int64");
		encoder.putInt64(-42, false);
		encoder.startField("bigInt64");
		encoder.putInt64(Long.MIN_VALUE, false);
		encoder.startField("uint64");
		encoder.putUInt64(-1L, false);
		encoder.startField("quotedInt");
		encoder.putInt64(7, true);
		encoder.startField("string");
		encoder.putStringValue("hi");
		encoder.startField("bytes");
		encoder.putBytesValue("foo".getBytes(UTF_8));
		encoder.endObject();
		assertEquals(
			"{\"null\":null,\"bool\":true,\"float\":1.5,\"double\":-0.25,\"nan\":\"NaN\","
				+ "\"int64\":-42,\"bigInt64\":\"-9223372036854775808\",\"uint64\":\"18446744073709551615\","
				+ "\"quotedInt\":\"7\",\"string\":\"hi\",\"bytes\":\"Zm9v\"}",
			encoder.result());
		parse(encoder.result());
	}

	@Test
	void awkwardStringValue_survivesParsing() {
		String value = awkwardString();
		encoder.putStringValue(value);
		assertEquals(value, parse(encoder.result()));
	}

	@Test
	void bytesFromBuffer() {
		ByteBuffer buffer = ByteBuffer.wrap("xfoob".getBytes(UTF_8));
		buffer.position(1);
		encoder.putBytesValue(buffer);
		assertEquals("\"Zm9vYg==\"", encoder.result());
		assertEquals(1, buffer.position());
	}

	@Test
	void writeTo_copiesResult() {
		encoder.startObject();
		encoder.startField("a");
		encoder.putStringValue("b");
		encoder.endObject();
		StringWriter sw = new StringWriter();
		encoder.writeTo(sw);
		assertEquals(encoder.result(), sw.toString());
	}

	@Test
	void writeTo_wrapsIOException() {
		encoder.putNullValue();
		IOException failure = new IOException("disk full");
		Writer broken = new Writer() {
			@Override
			public void write(char[] cbuf, int off, int len) throws IOException {
				throw failure;
			}

			@Override
			public void flush() {}

			@Override
			public void close() {}
		};
		JsonProcessingException e = assertThrows(JsonProcessingException.class, () -> encoder.writeTo(broken));
		assertEquals(failure, e.getCause());
	}

	@Test
	void settings() {
		JsonEncoder.Settings settings = JsonEncoder.Settings.DEFAULT.withInitialFragmentCapacity(0);
		JsonEncoder small = new JsonEncoder(settings);
		small.startObject();
		small.endObject();
		assertEquals("{}", small.result());
		assertThrows(IllegalArgumentException.class, () -> new JsonEncoder.Settings(-1));
	}

	@Test
	void nullArguments_rejected() {
		assertThrows(NullPointerException.class, () -> encoder.putStringValue(null));
		assertThrows(NullPointerException.class, () -> encoder.putBytesValue((byte[]) null));
		assertThrows(NullPointerException.class, () -> encoder.putBytesValue((ByteBuffer) null));
	}
}
