package io.b2mash.opsdesk.member;

public class MemberContextNotBoundException extends RuntimeException {

  public MemberContextNotBoundException() {
    super("Member context not available, send the " + MemberFilter.MEMBER_HEADER + " header");
  }
}
