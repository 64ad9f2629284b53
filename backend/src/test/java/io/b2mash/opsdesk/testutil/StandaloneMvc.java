package io.b2mash.opsdesk.testutil;

import io.b2mash.opsdesk.exception.GlobalExceptionHandler;
import io.b2mash.opsdesk.health.BackendHealthMonitor;
import io.b2mash.opsdesk.member.MemberFilter;
import io.b2mash.opsdesk.sales.LeadStatusConverter;
import org.springframework.format.support.DefaultFormattingConversionService;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * MockMvc around a single controller with the application's error mapping, member filter and
 * request parameter converters, no application context needed.
 */
public final class StandaloneMvc {

  private StandaloneMvc() {}

  public static MockMvc of(Object controller, BackendHealthMonitor healthMonitor) {
    var conversionService = new DefaultFormattingConversionService();
    conversionService.addConverter(new LeadStatusConverter());
    return MockMvcBuilders.standaloneSetup(controller)
        .setControllerAdvice(new GlobalExceptionHandler(healthMonitor))
        .setConversionService(conversionService)
        .addFilters(new MemberFilter())
        .build();
  }
}
