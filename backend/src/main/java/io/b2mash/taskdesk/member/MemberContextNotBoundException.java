package io.b2mash.taskdesk.member;

public class MemberContextNotBoundException extends RuntimeException {

  public MemberContextNotBoundException() {
    super("Member context not available: no " + MemberFilter.MEMBER_ID_HEADER + " on request");
  }
}
