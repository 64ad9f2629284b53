package io.b2mash.opsdesk.ratelimit;

import io.b2mash.opsdesk.member.MemberFilter;
import io.b2mash.opsdesk.member.RequestScopes;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Rejects mutating requests once the caller used up its per-minute budget. Runs after {@link
 * MemberFilter}; callers without a member id are counted by remote address. Search requests are
 * reads even when posted and are never counted.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 20)
public class RateLimitFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(RateLimitFilter.class);

  private static final Set<String> MUTATING_METHODS = Set.of("POST", "PUT", "PATCH", "DELETE");

  // Search takes its filters as POST bodies but never writes.
  private static final String READ_ONLY_PREFIX = "/search/";

  private final MutationRateLimiter rateLimiter;

  public RateLimitFilter(MutationRateLimiter rateLimiter) {
    this.rateLimiter = rateLimiter;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !MUTATING_METHODS.contains(request.getMethod())
        || request.getRequestURI().startsWith(READ_ONLY_PREFIX);
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    var memberId = RequestScopes.getMemberIdOrNull();
    var caller = memberId != null ? "member:" + memberId : "addr:" + request.getRemoteAddr();
    if (!rateLimiter.tryAcquire(caller)) {
      log.info("Rate limit of {} mutations per minute exceeded by {}", rateLimiter.limit(), caller);
      response.sendError(HttpStatus.TOO_MANY_REQUESTS.value(), "Too many mutating requests");
      return;
    }
    filterChain.doFilter(request, response);
  }
}
