/**
 * Exceptions thrown by jsontext.
 * All are unchecked and descend from {@link works.jsontext.exceptions.JsonException}.
 */
package works.jsontext.exceptions;
