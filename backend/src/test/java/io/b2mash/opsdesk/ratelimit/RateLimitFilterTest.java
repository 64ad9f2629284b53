package io.b2mash.opsdesk.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import jakarta.servlet.ServletException;
import java.io.IOException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

@ExtendWith(MockitoExtension.class)
class RateLimitFilterTest {

  @Mock private MutationRateLimiter rateLimiter;

  private MockHttpServletResponse run(String method, String uri)
      throws ServletException, IOException {
    var request = new MockHttpServletRequest(method, uri);
    request.setRemoteAddr("10.0.0.7");
    var response = new MockHttpServletResponse();
    new RateLimitFilter(rateLimiter).doFilter(request, response, new MockFilterChain());
    return response;
  }

  @ParameterizedTest
  @ValueSource(
      strings = {"/search/advanced-results", "/search/latest-tickets", "/search/options"})
  void postedSearchesDoNotSpendMutationBudget(String uri) throws Exception {
    var response = run("POST", uri);

    assertThat(response.getStatus()).isEqualTo(200);
    verifyNoInteractions(rateLimiter);
  }

  @Test
  void readsAreNotCounted() throws Exception {
    run("GET", "/sales/leads");

    verifyNoInteractions(rateLimiter);
  }

  @Test
  void mutationsAreCountedPerRemoteAddress() throws Exception {
    when(rateLimiter.tryAcquire("addr:10.0.0.7")).thenReturn(true);

    var response = run("POST", "/sales/leads");

    assertThat(response.getStatus()).isEqualTo(200);
    verify(rateLimiter).tryAcquire("addr:10.0.0.7");
  }

  @Test
  void exhaustedBudgetIsRejectedWith429() throws Exception {
    when(rateLimiter.tryAcquire("addr:10.0.0.7")).thenReturn(false);

    var response = run("PUT", "/sales/leads/6b1f0e8e-0d1b-4c1f-9a38-2d0c7f3e2a11");

    assertThat(response.getStatus()).isEqualTo(429);
  }
}
