/**
 * Renders JSON text. The main abstraction is {@link works.jsontext.codec.JsonEncoder},
 * which accepts direct scalar appends and sequences of {@link works.jsontext.codec.JsonToken}s
 * and buffers the formatted text until the caller reads it.
 */
package works.jsontext.codec;
