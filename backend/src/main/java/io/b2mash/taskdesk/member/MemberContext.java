package io.b2mash.taskdesk.member;

/**
 * Acting member for the current request. Bound by {@link MemberFilter} from the identity headers
 * set by the upstream gateway, cleared when the request completes.
 */
public final class MemberContext {

  private static final ThreadLocal<String> CURRENT_MEMBER_ID = new ThreadLocal<>();
  private static final ThreadLocal<String> CURRENT_ROLE = new ThreadLocal<>();

  private MemberContext() {}

  public static void setCurrentMemberId(String memberId) {
    CURRENT_MEMBER_ID.set(memberId);
  }

  public static String getCurrentMemberId() {
    return CURRENT_MEMBER_ID.get();
  }

  /** Returns the current member's id. Throws if the filter chain did not bind one. */
  public static String requireMemberId() {
    String memberId = CURRENT_MEMBER_ID.get();
    if (memberId == null) {
      throw new MemberContextNotBoundException();
    }
    return memberId;
  }

  public static void setRole(String role) {
    CURRENT_ROLE.set(role);
  }

  /** Returns the current member's role, or null if not bound. */
  public static String getRole() {
    return CURRENT_ROLE.get();
  }

  public static void clear() {
    CURRENT_MEMBER_ID.remove();
    CURRENT_ROLE.remove();
  }
}
