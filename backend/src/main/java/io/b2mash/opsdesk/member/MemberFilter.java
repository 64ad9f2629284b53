package io.b2mash.opsdesk.member;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds the caller's member id, asserted by the upstream gateway in {@value #MEMBER_HEADER}, for
 * the duration of the request. Requests without a parsable id continue unbound.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class MemberFilter extends OncePerRequestFilter {

  public static final String MEMBER_HEADER = "X-Member-Id";

  private static final Logger log = LoggerFactory.getLogger(MemberFilter.class);

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    UUID memberId = parse(request.getHeader(MEMBER_HEADER));
    if (memberId == null) {
      filterChain.doFilter(request, response);
      return;
    }
    RequestScopes.bindMemberId(memberId);
    try {
      filterChain.doFilter(request, response);
    } finally {
      RequestScopes.clear();
    }
  }

  private UUID parse(String header) {
    if (header == null || header.isBlank()) {
      return null;
    }
    try {
      return UUID.fromString(header.trim());
    } catch (IllegalArgumentException e) {
      log.debug("Ignoring malformed {} header: {}", MEMBER_HEADER, header);
      return null;
    }
  }
}
