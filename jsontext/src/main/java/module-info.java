/**
 * The jsontext engine renders structured protocol values as JSON text.
 * <p>
 * Callers are schema-driven encoders that already know the semantic type of every
 * value they emit. They drive a {@link works.jsontext.codec.JsonEncoder JsonEncoder}
 * through a sequence of primitive append operations and read the finished
 * document from {@link works.jsontext.codec.JsonEncoder#result() result()}.
 * <p>
 * The packages are:
 *
 * <ul>
 *     <li>
 *         {@link works.jsontext.codec},
 *         the encoder and the {@link works.jsontext.codec.JsonToken token} vocabulary it renders;
 *     </li>
 *     <li>
 *         {@link works.jsontext.codec.text},
 *         the scalar formatting rules for numbers, strings and byte blobs; and
 *     </li>
 *     <li>
 *         {@link works.jsontext.exceptions},
 *         thrown when text cannot be delivered to its destination.
 *     </li>
 * </ul>
 */
module works.jsontext {
	requires org.slf4j;
	requires tools.jackson.core;

	exports works.jsontext.codec;
	exports works.jsontext.codec.text;
	exports works.jsontext.exceptions;
}
