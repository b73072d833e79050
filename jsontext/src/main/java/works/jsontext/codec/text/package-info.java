/**
 * Pure formatting functions for JSON scalar values.
 * {@link works.jsontext.codec.JsonEncoder} delegates to these;
 * they can also be used directly to format a single value.
 */
package works.jsontext.codec.text;
