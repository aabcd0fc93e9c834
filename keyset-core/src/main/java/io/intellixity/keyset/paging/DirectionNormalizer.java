package io.intellixity.keyset.paging;

import io.intellixity.keyset.InvalidPaginationParametersException;
import io.intellixity.keyset.cursor.CursorCodec;
import io.intellixity.keyset.cursor.Position;
import io.intellixity.keyset.query.SortSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Resolves the four Relay inputs into one {@link PaginationPlan}.\n
 *
 * - first/after page forwards through the declared order.\n
 * - last/before page backwards: the last N in the declared order are the first N in the inverted order,
 *   so the store is queried with every direction flipped and the page is reversed afterwards.\n
 */
public final class DirectionNormalizer {
  private static final Logger log = LoggerFactory.getLogger(DirectionNormalizer.class);

  private final PaginationSettings settings;
  private final CursorCodec codec;

  public DirectionNormalizer(PaginationSettings settings, CursorCodec codec) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  public PaginationSettings settings() { return settings; }

  public PaginationPlan normalize(PaginationRequest request) {
    Objects.requireNonNull(request, "request");
    if (request.first() != null && request.last() != null) {
      throw new InvalidPaginationParametersException("first and last cannot be combined; got first="
          + request.first() + ", last=" + request.last());
    }

    SortSpec declared = (request.sort() == null || request.sort().isEmpty())
        ? SortSpec.ascending(settings.uniqueKey())
        : SortSpec.of(request.sort()).withTieBreaker(settings.uniqueKey());

    boolean backwards = request.last() != null;
    int limit = resolveLimit(backwards ? request.last() : request.first(), backwards ? "last" : "first");
    String token = backwards ? request.before() : request.after();
    String ignored = backwards ? request.after() : request.before();
    if (isPresent(ignored) && log.isDebugEnabled()) {
      log.debug("keyset.normalize ignoring {} cursor in {} mode", backwards ? "after" : "before",
          backwards ? "backward" : "forward");
    }

    Position cursor = isPresent(token) ? codec.decode(token).requireMatches(declared) : null;
    SortSpec execution = backwards ? declared.inverse() : declared;

    return new PaginationPlan(limit, cursor, declared, execution, backwards,
        !backwards && cursor != null, backwards && cursor != null);
  }

  int resolveLimit(Integer requested, String name) {
    int limit;
    if (requested == null) {
      limit = settings.defaultLimit();
    } else if (requested <= 0) {
      if (settings.countPolicy() == CountPolicy.REJECT) {
        throw new InvalidPaginationParametersException(name + " must be > 0 but was " + requested);
      }
      limit = settings.defaultLimit();
    } else {
      limit = requested;
    }
    return Math.min(Math.max(1, limit), settings.maxLimit());
  }

  // "" is treated as absent, like a missing parameter.
  private static boolean isPresent(String token) {
    return token != null && !token.isEmpty();
  }
}
