package io.intellixity.keyset.cursor;

/**
 * Turns a {@link Position} into an opaque, URL-safe token and back.
 *
 * <p>{@code decode(encode(p))} must equal {@code p}, and equal positions must encode to equal tokens.</p>
 */
public interface CursorCodec {
  String encode(Position position);

  /** @throws io.intellixity.keyset.InvalidCursorException if the token is not a well-formed cursor */
  Position decode(String token);
}
