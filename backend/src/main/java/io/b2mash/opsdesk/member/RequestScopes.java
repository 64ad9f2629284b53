package io.b2mash.opsdesk.member;

import java.util.UUID;

/**
 * Request-scoped caller identity. Bound by {@link MemberFilter} for the duration of one request and
 * cleared when the filter chain returns.
 */
public final class RequestScopes {

  private static final ThreadLocal<UUID> MEMBER_ID = new ThreadLocal<>();

  /** Returns the current member's UUID. Throws if the request carried no identity. */
  public static UUID requireMemberId() {
    var memberId = MEMBER_ID.get();
    if (memberId == null) {
      throw new MemberContextNotBoundException();
    }
    return memberId;
  }

  /** Returns the current member's UUID, or null if not bound. */
  public static UUID getMemberIdOrNull() {
    return MEMBER_ID.get();
  }

  static void bindMemberId(UUID memberId) {
    MEMBER_ID.set(memberId);
  }

  static void clear() {
    MEMBER_ID.remove();
  }

  private RequestScopes() {}
}
