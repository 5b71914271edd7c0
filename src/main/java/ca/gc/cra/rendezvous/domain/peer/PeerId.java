package ca.gc.cra.rendezvous.domain.peer;

import ca.gc.cra.rendezvous.validation.Strings;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * <strong>What:</strong> Opaque, server-issued identifier of one connected peer.
 * <p><strong>Why:</strong> Peers address each other only through these identifiers; they are generated server-side
 * and never accepted from a client as a self-description.</p>
 * <p><strong>Thread-safety:</strong> Immutable value object.</p>
 *
 * @param value lower-case canonical UUID text
 * @since 0.1.0
 */
public record PeerId(String value) implements Comparable<PeerId> {

  /**
   * Validates the identifier text.
   *
   * @throws IllegalArgumentException when {@code value} is not UUID-shaped
   */
  public PeerId {
    Objects.requireNonNull(value, "value");
    if (!Strings.isUuid(value)) {
      throw new IllegalArgumentException("peer id must be UUID-shaped");
    }
    value = value.toLowerCase(Locale.ROOT);
  }

  /**
   * Allocates a fresh random identifier.
   *
   * @return new identifier backed by {@link UUID#randomUUID()}
   */
  public static PeerId random() {
    return new PeerId(UUID.randomUUID().toString());
  }

  /**
   * Parses peer-supplied target text without throwing.
   *
   * @param raw candidate text from a wire field; may be {@code null} or any type
   * @return identifier when {@code raw} is a UUID-shaped string
   */
  public static Optional<PeerId> parse(Object raw) {
    if (raw instanceof String text && Strings.isUuid(text)) {
      return Optional.of(new PeerId(text));
    }
    return Optional.empty();
  }

  /**
   * Returns the first {@code length} characters, used when binding challenges to a peer.
   *
   * @param length number of leading characters
   * @return identifier prefix
   */
  public String prefix(int length) {
    return value.substring(0, Math.min(length, value.length()));
  }

  @Override
  public int compareTo(PeerId other) {
    return value.compareTo(other.value);
  }

  @Override
  public String toString() {
    return value;
  }
}
